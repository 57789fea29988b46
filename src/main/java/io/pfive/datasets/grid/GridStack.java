// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.grid;

import com.google.common.collect.ImmutableList;
import io.pfive.datasets.cache.CacheKey;
import io.pfive.datasets.coords.Extent;
import io.pfive.datasets.exception.IncompatibleGridsException;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/// Presents a sequence of grids with identical extents as one grid with an extra leading axis,
/// e.g. a directory of daily 2D sea surface temperature images as one "tyx" time series. Layer k
/// sits at coordinate corner + k * increment along the new axis. Layers are read lazily, and only
/// the layers that intersect a requested window are touched.
///
/// The new axis must become the first axis of the result: t can be added to "yx" or "zyx", and z
/// only to "yx". All layers must share the data type, the NoData values, the scaling, the extent
/// and a compatible spatial reference, otherwise IncompatibleGridsException is thrown immediately.
public class GridStack extends AbstractGrid {

    private final List<Grid> layers;
    private final char axis;
    private final double corner;
    private final double increment;
    private final GridMetadata stackedMetadata;

    public GridStack (String displayName, List<? extends Grid> layers, char axis, double corner, double increment) {
        super(displayName);
        checkArgument(!layers.isEmpty(), "A stack needs at least one layer.");
        this.layers = ImmutableList.copyOf(layers);
        this.axis = axis;
        this.corner = corner;
        this.increment = increment;
        GridMetadata first = this.layers.get(0).metadata();
        for (Grid layer : this.layers.subList(1, this.layers.size())) {
            checkCompatible(first, layer);
        }
        Extent stacked = first.extent().withAxis(axis, this.layers.size(), corner, increment);
        checkArgument(stacked.axisIndex(axis) == 0, "Stacking along %s would not add a leading axis to %s.",
              axis, first.extent().dimensions());
        this.stackedMetadata = first.withExtent(stacked);
    }

    private static void checkCompatible (GridMetadata first, Grid layer) {
        GridMetadata other = layer.metadata();
        String name = layer.displayName();
        if (!first.extent().sameAs(other.extent())) {
            throw new IncompatibleGridsException(String.format("layer %s differs in extent: %s",
                  name, first.extent().describeDifference(other.extent())));
        }
        if (!first.spatialReference().isCompatibleWith(other.spatialReference())) {
            throw new IncompatibleGridsException(String.format("layer %s has spatial reference %s, expected %s",
                  name, other.spatialReference(), first.spatialReference()));
        }
        if (first.dataType() != other.dataType() || first.unscaledDataType() != other.unscaledDataType()) {
            throw new IncompatibleGridsException(String.format("layer %s has data type %s, expected %s",
                  name, other.dataType(), first.dataType()));
        }
        if (!NoData.sameValue(first.noDataValue(), other.noDataValue())
              || !NoData.sameValue(first.unscaledNoDataValue(), other.unscaledNoDataValue())) {
            throw new IncompatibleGridsException(String.format("layer %s has NoData value %s, expected %s",
                  name, other.noDataValue(), first.noDataValue()));
        }
        if (first.isScaled() != other.isScaled() || (first.isScaled() && !first.scaling().equals(other.scaling()))) {
            throw new IncompatibleGridsException(String.format("layer %s has scaling %s, expected %s",
                  name, other.scaling(), first.scaling()));
        }
    }

    public List<Grid> layers () {
        return layers;
    }

    @Override
    protected GridMetadata loadMetadata () {
        return stackedMetadata;
    }

    @Override
    protected String computeFingerprint () {
        CacheKey.Builder key = CacheKey.builder("stack")
              .put("axis", String.valueOf(axis))
              .put("corner", corner)
              .put("increment", increment)
              .put("count", layers.size());
        for (int i = 0; i < layers.size(); i++) {
            key.put("layer." + i, layers.get(i).fingerprint());
        }
        return key.build().fingerprint();
    }

    @Override
    protected Block readValidBlock (int[] origin, int[] shape) {
        return readLayers(origin, shape, false);
    }

    @Override
    protected Block readValidUnscaledBlock (int[] origin, int[] shape) {
        return readLayers(origin, shape, true);
    }

    /// The stacked axis is leading, so each layer fills one contiguous slab of the output.
    private Block readLayers (int[] origin, int[] shape, boolean unscaled) {
        int n = shape.length;
        int[] layerOrigin = new int[n - 1];
        int[] layerShape = new int[n - 1];
        System.arraycopy(origin, 1, layerOrigin, 0, n - 1);
        System.arraycopy(shape, 1, layerShape, 0, n - 1);
        DataType type = unscaled ? stackedMetadata.unscaledDataType() : stackedMetadata.dataType();
        Double noData = unscaled ? stackedMetadata.unscaledNoDataValue() : stackedMetadata.noDataValue();
        Block result = Block.filled(type, noData, origin, shape, 0);
        int slab = (int) Block.countCells(layerShape);
        for (int k = 0; k < shape[0]; k++) {
            Grid layer = layers.get(origin[0] + k);
            Block layerBlock = unscaled ? layer.readUnscaledBlock(layerOrigin, layerShape) : layer.readBlock(layerOrigin, layerShape);
            System.arraycopy(layerBlock.values(), 0, result.values(), k * slab, slab);
        }
        return result;
    }

}

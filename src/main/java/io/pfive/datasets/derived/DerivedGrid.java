// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.derived;

import com.google.common.collect.ImmutableList;
import io.pfive.datasets.cache.CacheKey;
import io.pfive.datasets.grid.AbstractGrid;
import io.pfive.datasets.grid.Block;
import io.pfive.datasets.grid.DataType;
import io.pfive.datasets.grid.Grid;
import io.pfive.datasets.grid.GridMetadata;
import io.pfive.datasets.util.MilliTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Arrays;
import java.util.List;

/// A grid whose values are computed on demand from other grids by a Derivation. Nothing is read
/// or computed until a block is requested. A request is broken down into tiles aligned to a fixed
/// tile grid (edge length from the engine's block size along y and x, one cell along t and z), each
/// tile is computed from input blocks covering exactly that tile, and the requested window is
/// assembled from the tiles. Because tiles are aligned to the grid and not to the request, the
/// same tile is reused by any request touching it, and each tile is held in the engine's
/// ResultCache keyed by this grid's fingerprint and the tile's position.
///
/// Instances are created through GridEngine.derive(), which validates the inputs.
public class DerivedGrid extends AbstractGrid {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final GridEngine engine;
    private final Derivation derivation;
    private final List<Grid> inputs;
    private final GridMetadata derivedMetadata;

    DerivedGrid (GridEngine engine, Derivation derivation, List<Grid> inputs, double outputNoData) {
        super(derivation.identity() + inputs.stream().map(Grid::displayName).toList());
        this.engine = engine;
        this.derivation = derivation;
        this.inputs = ImmutableList.copyOf(inputs);
        Grid first = inputs.get(0);
        this.derivedMetadata = GridMetadata.of(derivation.outputType(), first.getExtent(),
              first.getSpatialReference(), outputNoData);
    }

    public Derivation derivation () {
        return derivation;
    }

    public List<Grid> inputs () {
        return inputs;
    }

    @Override
    protected GridMetadata loadMetadata () {
        return derivedMetadata;
    }

    @Override
    protected String computeFingerprint () {
        CacheKey.Builder key = CacheKey.builder("derived")
              .put("derivation", derivation.identity())
              .put("outputType", derivation.outputType().name())
              .put("noData", derivedMetadata.noDataValue())
              .put("handlesNoData", derivation.handlesNoData());
        for (int i = 0; i < inputs.size(); i++) {
            key.put("input." + i, inputs.get(i).fingerprint());
        }
        return key.build().fingerprint();
    }

    @Override
    protected Block readValidBlock (int[] origin, int[] shape) {
        int n = shape.length;
        int[] gridShape = getExtent().shape();
        int[] tileSize = tileSize(n);
        // Range of tile indexes touched by the window along each axis.
        int[] firstTile = new int[n];
        int[] lastTile = new int[n];
        for (int axis = 0; axis < n; axis++) {
            firstTile[axis] = origin[axis] / tileSize[axis];
            lastTile[axis] = (origin[axis] + shape[axis] - 1) / tileSize[axis];
        }
        Block result = Block.filled(derivedMetadata.dataType(), derivedMetadata.noDataValue(), origin, shape, 0);
        int[] tile = firstTile.clone();
        while (true) {
            int[] tileOrigin = new int[n];
            int[] tileShape = new int[n];
            for (int axis = 0; axis < n; axis++) {
                tileOrigin[axis] = tile[axis] * tileSize[axis];
                tileShape[axis] = Math.min(tileSize[axis], gridShape[axis] - tileOrigin[axis]);
            }
            result.copyOverlapFrom(tile(tileOrigin, tileShape));
            // Odometer over tile indexes, x fastest.
            int axis = n - 1;
            while (axis >= 0) {
                tile[axis] += 1;
                if (tile[axis] <= lastTile[axis]) break;
                tile[axis] = firstTile[axis];
                axis -= 1;
            }
            if (axis < 0) return result;
        }
    }

    private int[] tileSize (int nDims) {
        int[] tileSize = new int[nDims];
        Arrays.fill(tileSize, 1);
        tileSize[nDims - 1] = engine.blockSize();
        tileSize[nDims - 2] = engine.blockSize();
        return tileSize;
    }

    private Block tile (int[] tileOrigin, int[] tileShape) {
        CacheKey key = CacheKey.builder("tile")
              .put("grid", fingerprint())
              .put("origin", tileOrigin)
              .put("shape", tileShape)
              .build();
        return engine.cache().getOrCompute(key, () -> computeTile(tileOrigin, tileShape));
    }

    /// Read the inputs for one tile, apply the derivation, then enforce NoData propagation and
    /// representability in the output type.
    private Block computeTile (int[] tileOrigin, int[] tileShape) {
        MilliTimer timer = new MilliTimer();
        Block[] inputBlocks = new Block[inputs.size()];
        for (int k = 0; k < inputBlocks.length; k++) {
            inputBlocks[k] = inputs.get(k).readBlock(tileOrigin, tileShape);
        }
        DataType outputType = derivedMetadata.dataType();
        double noData = derivedMetadata.noDataValue();
        Block output = Block.noData(outputType, noData, tileOrigin, tileShape);
        derivation.compute(inputBlocks, output);
        boolean propagate = !derivation.handlesNoData();
        int nNoData = 0;
        for (int i = 0; i < output.nCells(); i++) {
            double value = output.get(i);
            boolean missing = Double.isNaN(value) || !outputType.canRepresent(value);
            if (propagate && !missing) {
                for (Block input : inputBlocks) {
                    if (input.isNoData(i)) {
                        missing = true;
                        break;
                    }
                }
            }
            if (missing) {
                output.set(i, noData);
                nNoData += 1;
            } else {
                output.set(i, outputType.coerce(value));
            }
        }
        LOG.debug("Computed tile {} {} of {} ({} NoData cells) in {}.", Arrays.toString(tileOrigin),
              Arrays.toString(tileShape), displayName(), nNoData, timer.getElapsedString());
        return output;
    }

}

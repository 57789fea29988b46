// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.grid;

import io.pfive.datasets.cache.CacheKey;

import static com.google.common.base.Preconditions.checkArgument;

/// A view of one t or z position of a grid with one fewer axis, e.g. a single day of a daily time
/// series as a 2D grid. Nothing is copied up front; reads are passed through to the source with
/// a window of length one along the removed axis.
public class GridSlice extends AbstractGrid {

    private final Grid source;
    private final char axis;
    private final int index;
    private final int axisPosition;

    public GridSlice (Grid source, char axis, int index) {
        super(source.displayName() + "[" + axis + "=" + index + "]");
        this.source = source;
        this.axis = axis;
        this.index = index;
        this.axisPosition = source.getExtent().axisIndex(axis);
        checkArgument(axisPosition >= 0, "Grid %s has no %s axis.", source.displayName(), axis);
        int count = source.getExtent().shape(axisPosition);
        checkArgument(index >= 0 && index < count, "Index %s along %s is outside 0..%s.", index, axis, count - 1);
    }

    @Override
    protected GridMetadata loadMetadata () {
        GridMetadata sourceMetadata = source.metadata();
        return sourceMetadata.withExtent(sourceMetadata.extent().withoutAxis(axis));
    }

    @Override
    protected String computeFingerprint () {
        return CacheKey.builder("slice")
              .put("source", source.fingerprint())
              .put("axis", String.valueOf(axis))
              .put("index", index)
              .build()
              .fingerprint();
    }

    @Override
    protected Block readValidBlock (int[] origin, int[] shape) {
        return source.readBlock(sourceWindow(origin), sourceWindow(shape, 1)).reshape(origin, shape);
    }

    @Override
    protected Block readValidUnscaledBlock (int[] origin, int[] shape) {
        return source.readUnscaledBlock(sourceWindow(origin), sourceWindow(shape, 1)).reshape(origin, shape);
    }

    private int[] sourceWindow (int[] origin) {
        return sourceWindow(origin, index);
    }

    /// Insert a value at the position of the removed axis. Removing a length-one axis does not
    /// change the row-major order of values, so source blocks can be reshaped without copying.
    private int[] sourceWindow (int[] sliceValues, int insert) {
        int[] result = new int[sliceValues.length + 1];
        for (int from = 0, to = 0; to < result.length; to++) {
            result[to] = (to == axisPosition) ? insert : sliceValues[from++];
        }
        return result;
    }
}

// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.grid;

import com.google.common.base.MoreObjects;
import io.pfive.datasets.util.ByteSize;
import io.pfive.datasets.util.ByteSizeUtil;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// A dense window of cell values read from (or computed for) a grid. The window knows where it
/// sits within its grid (origin, in cells along each axis of the grid's dimensions string) so that
/// blocks from different reads can be reassembled without extra bookkeeping. Values are stored
/// flattened in row-major order with the last axis (x) varying fastest.
///
/// Values are doubles whatever the grid's DataType. Every supported type round-trips exactly
/// through double, and a single representation keeps derivation functions free of eight-way type
/// dispatch. The memory cost is acceptable because blocks are bounded by the tile size.
///
/// Blocks are mutable to allow computations to fill their output in place, but once handed out by
/// a grid (or stored in a cache) they must be treated as read-only.
public final class Block implements ByteSize {

    private final DataType dataType;
    private final Double noDataValue;
    private final int[] origin;
    private final int[] shape;
    private final int[] strides;
    private final double[] values;

    private Block (DataType dataType, Double noDataValue, int[] origin, int[] shape, double[] values) {
        this.dataType = dataType;
        this.noDataValue = noDataValue;
        this.origin = origin;
        this.shape = shape;
        this.values = values;
        this.strides = new int[shape.length];
        int stride = 1;
        for (int axis = shape.length - 1; axis >= 0; axis--) {
            strides[axis] = stride;
            stride *= shape[axis];
        }
    }

    /// Wrap the supplied array without copying. The caller gives up ownership of the array.
    public static Block wrap (DataType dataType, Double noDataValue, int[] origin, int[] shape, double[] values) {
        checkNotNull(dataType, "dataType");
        checkArgument(origin.length == shape.length, "Origin and shape must have the same number of axes.");
        long n = countCells(shape);
        checkArgument(values.length == n, "Expected %s values for shape %s, got %s.", n, Arrays.toString(shape), values.length);
        return new Block(dataType, noDataValue, origin.clone(), shape.clone(), values);
    }

    /// Create a block with every cell set to the given value.
    public static Block filled (DataType dataType, Double noDataValue, int[] origin, int[] shape, double fill) {
        long n = countCells(shape);
        checkArgument(n <= Integer.MAX_VALUE, "Block of shape %s is too large.", Arrays.toString(shape));
        double[] values = new double[(int) n];
        if (fill != 0) Arrays.fill(values, fill);
        return wrap(dataType, noDataValue, origin, shape, values);
    }

    /// Create a block filled with NoData, or with NaN if there is no NoData value.
    public static Block noData (DataType dataType, Double noDataValue, int[] origin, int[] shape) {
        double fill = (noDataValue != null) ? noDataValue : Double.NaN;
        return filled(dataType, noDataValue, origin, shape, fill);
    }

    public static long countCells (int[] shape) {
        long n = 1;
        for (int s : shape) {
            checkArgument(s > 0, "Block dimensions must be positive: %s", Arrays.toString(shape));
            n *= s;
        }
        return n;
    }

    public DataType dataType () {
        return dataType;
    }

    public Double noDataValue () {
        return noDataValue;
    }

    public int nDims () {
        return shape.length;
    }

    public int[] origin () {
        return origin.clone();
    }

    public int[] shape () {
        return shape.clone();
    }

    public int nCells () {
        return values.length;
    }

    /// The backing array. Exposed for tight loops in derivations; do not retain or share it.
    public double[] values () {
        return values;
    }

    public double get (int flatIndex) {
        return values[flatIndex];
    }

    public void set (int flatIndex, double value) {
        values[flatIndex] = value;
    }

    /// Value at a position given relative to this block's origin.
    public double get (int... localIndex) {
        return values[flatIndex(localIndex)];
    }

    public int flatIndex (int... localIndex) {
        checkArgument(localIndex.length == shape.length, "Expected %s indexes.", shape.length);
        int flat = 0;
        for (int axis = 0; axis < shape.length; axis++) {
            int i = localIndex[axis];
            if (i < 0 || i >= shape[axis]) {
                throw new IndexOutOfBoundsException(String.format("Index %s outside block shape %s.",
                      Arrays.toString(localIndex), Arrays.toString(shape)));
            }
            flat += i * strides[axis];
        }
        return flat;
    }

    /// Flat index of a position given in the coordinates of the whole grid. No range checks.
    private int flatIndexAbsolute (int[] gridIndex) {
        int flat = 0;
        for (int axis = 0; axis < shape.length; axis++) {
            flat += (gridIndex[axis] - origin[axis]) * strides[axis];
        }
        return flat;
    }

    public boolean isNoData (int flatIndex) {
        return NoData.isNoData(values[flatIndex], noDataValue, dataType);
    }

    public int countNoData () {
        int n = 0;
        for (int i = 0; i < values.length; i++) if (isNoData(i)) n += 1;
        return n;
    }

    /// Copy all cells of the source block that overlap this one, matching cells by their position
    /// in the grid. Works one x row at a time so most of the copying is System.arraycopy.
    /// Returns the number of cells copied.
    public int copyOverlapFrom (Block source) {
        checkArgument(source.nDims() == nDims(), "Blocks have different numbers of axes.");
        int n = nDims();
        int[] lo = new int[n];
        int[] hi = new int[n];
        for (int axis = 0; axis < n; axis++) {
            lo[axis] = Math.max(origin[axis], source.origin[axis]);
            hi[axis] = Math.min(origin[axis] + shape[axis], source.origin[axis] + source.shape[axis]);
            if (lo[axis] >= hi[axis]) return 0;
        }
        int rowLength = hi[n - 1] - lo[n - 1];
        int[] index = lo.clone();
        int copied = 0;
        while (true) {
            System.arraycopy(source.values, source.flatIndexAbsolute(index), values, flatIndexAbsolute(index), rowLength);
            copied += rowLength;
            // Advance the leading axes like an odometer, the x axis is covered by the row copy.
            int axis = n - 2;
            while (axis >= 0) {
                index[axis] += 1;
                if (index[axis] < hi[axis]) break;
                index[axis] = lo[axis];
                axis -= 1;
            }
            if (axis < 0) return copied;
        }
    }

    /// Extract a sub-window of this block, given in grid coordinates. The window must lie within
    /// this block.
    public Block window (int[] windowOrigin, int[] windowShape) {
        checkArgument(windowOrigin.length == nDims() && windowShape.length == nDims(), "Expected %s axes.", nDims());
        for (int axis = 0; axis < nDims(); axis++) {
            checkArgument(windowOrigin[axis] >= origin[axis]
                  && windowOrigin[axis] + windowShape[axis] <= origin[axis] + shape[axis],
                  "Window is not contained in block.");
        }
        Block result = filled(dataType, noDataValue, windowOrigin, windowShape, 0);
        result.copyOverlapFrom(this);
        return result;
    }

    /// The same values positioned elsewhere, or with a different number of axes (as long as the
    /// cell count is unchanged). Shares the backing array.
    public Block reshape (int[] newOrigin, int[] newShape) {
        return wrap(dataType, noDataValue, newOrigin, newShape, values);
    }

    @Override
    public long byteSize () {
        return ByteSizeUtil.OBJECT_BYTES + ByteSizeUtil.doubleArrayFieldBytes(values)
              + 3 * ByteSizeUtil.intArrayFieldBytes(shape);
    }

    /// Blocks are equal if they have the same type, position, shape, NoData value and values.
    /// Value comparison treats NaN as equal to NaN (by way of Double.doubleToLongBits).
    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (!(o instanceof Block other)) return false;
        return dataType == other.dataType && NoData.sameValue(noDataValue, other.noDataValue)
              && Arrays.equals(origin, other.origin) && Arrays.equals(shape, other.shape)
              && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode () {
        int result = dataType.hashCode();
        result = 31 * result + Arrays.hashCode(origin);
        result = 31 * result + Arrays.hashCode(shape);
        return 31 * result + Arrays.hashCode(values);
    }

    @Override
    public String toString () {
        return MoreObjects.toStringHelper(this)
              .add("type", dataType)
              .add("origin", Arrays.toString(origin))
              .add("shape", Arrays.toString(shape))
              .add("noData", noDataValue)
              .toString();
    }
}

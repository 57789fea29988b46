// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.coords;

import com.google.common.base.MoreObjects;
import io.pfive.datasets.exception.OutOfBoundsException;
import org.locationtech.jts.geom.Envelope;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// The footprint of a grid: which axes it has, how many cells lie along each, where the first
/// cell is and how large each cell is. All per-axis arrays in the library (shapes, origins of
/// windows, cell sizes) are ordered by the dimensions string, which is one of "yx", "zyx", "tyx" or
/// "tzyx", so the x axis always varies fastest in flattened arrays.
///
/// Corner coordinates are the coordinates of the center of the first cell along each axis. Index
/// zero along y is the southernmost row: y coordinates increase with increasing index (unlike most
/// image formats). The t axis is in whatever increment unit the backend uses (e.g. days since an
/// epoch); the library only needs it to be regular.
///
/// Two extents are the "same" when their axes and cell counts are identical and their corner
/// coordinates and cell sizes agree to within a tiny fraction of a cell. Anything looser would
/// require resampling, which is never done implicitly.
public final class Extent {

    public static final Set<String> VALID_DIMENSIONS = Set.of("yx", "zyx", "tyx", "tzyx");

    /// Canonical order of all axes. Derived extents insert and remove axes consistently with it.
    private static final String AXIS_ORDER = "tzyx";

    /// Fraction of a cell by which coordinates may differ while still considered identical.
    private static final double CELL_TOLERANCE = 1e-9;

    private final String dimensions;
    private final int[] shape;
    private final double[] cornerCoords;
    private final double[] cellSizes;

    private Extent (String dimensions, int[] shape, double[] cornerCoords, double[] cellSizes) {
        this.dimensions = dimensions;
        this.shape = shape;
        this.cornerCoords = cornerCoords;
        this.cellSizes = cellSizes;
    }

    public static Extent of (String dimensions, int[] shape, double[] cornerCoords, double[] cellSizes) {
        checkNotNull(dimensions, "dimensions");
        checkArgument(VALID_DIMENSIONS.contains(dimensions), "Dimensions must be one of %s, was '%s'.", VALID_DIMENSIONS, dimensions);
        int n = dimensions.length();
        checkArgument(shape != null && shape.length == n, "Shape must have %s elements.", n);
        checkArgument(cornerCoords != null && cornerCoords.length == n, "Corner coordinates must have %s elements.", n);
        checkArgument(cellSizes != null && cellSizes.length == n, "Cell sizes must have %s elements.", n);
        for (int axis = 0; axis < n; axis++) {
            checkArgument(shape[axis] > 0, "Cell count along %s must be positive.", dimensions.charAt(axis));
            checkArgument(Double.isFinite(cornerCoords[axis]), "Corner coordinate along %s must be finite.", dimensions.charAt(axis));
            checkArgument(Double.isFinite(cellSizes[axis]) && cellSizes[axis] > 0,
                  "Cell size along %s must be positive.", dimensions.charAt(axis));
        }
        return new Extent(dimensions, shape.clone(), cornerCoords.clone(), cellSizes.clone());
    }

    /// Convenience factory for the common 2D case, given the outer lower-left edge of the grid
    /// and square cells.
    public static Extent yx (int nRows, int nCols, double xMin, double yMin, double cellSize) {
        double half = cellSize / 2;
        return of("yx", new int[] {nRows, nCols}, new double[] {yMin + half, xMin + half}, new double[] {cellSize, cellSize});
    }

    public String dimensions () {
        return dimensions;
    }

    public int nDims () {
        return dimensions.length();
    }

    public int[] shape () {
        return shape.clone();
    }

    public int shape (int axis) {
        return shape[axis];
    }

    public long nCells () {
        long n = 1;
        for (int s : shape) n *= s;
        return n;
    }

    /// Returns the position of the given axis character in the dimensions string, or -1.
    public int axisIndex (char axis) {
        return dimensions.indexOf(axis);
    }

    public boolean hasAxis (char axis) {
        return axisIndex(axis) >= 0;
    }

    public double cornerCoord (int axis) {
        return cornerCoords[axis];
    }

    public double cellSize (int axis) {
        return cellSizes[axis];
    }

    public double centerCoord (int axis, int index) {
        return cornerCoords[axis] + index * cellSizes[axis];
    }

    public double minCoord (int axis, int index) {
        return centerCoord(axis, index) - cellSizes[axis] / 2;
    }

    public double maxCoord (int axis, int index) {
        return centerCoord(axis, index) + cellSizes[axis] / 2;
    }

    /// The outer bounds of the grid in the x/y plane, in the grid's own coordinate system.
    public Envelope envelope () {
        int xa = axisIndex('x');
        int ya = axisIndex('y');
        return new Envelope(minCoord(xa, 0), maxCoord(xa, shape[xa] - 1), minCoord(ya, 0), maxCoord(ya, shape[ya] - 1));
    }

    /// True if a window with the given origin and shape lies entirely within this extent.
    public boolean contains (int[] origin, int[] windowShape) {
        if (origin == null || windowShape == null) return false;
        if (origin.length != shape.length || windowShape.length != shape.length) return false;
        for (int axis = 0; axis < shape.length; axis++) {
            if (origin[axis] < 0 || windowShape[axis] < 1) return false;
            // Compare in long arithmetic so that huge windows cannot overflow into range.
            if ((long) origin[axis] + windowShape[axis] > shape[axis]) return false;
        }
        return true;
    }

    public void checkWindow (int[] origin, int[] windowShape) {
        if (!contains(origin, windowShape)) {
            throw new OutOfBoundsException(origin, windowShape, shape);
        }
    }

    public boolean sameAs (Extent other) {
        if (other == null) return false;
        if (this == other) return true;
        if (!dimensions.equals(other.dimensions)) return false;
        if (!Arrays.equals(shape, other.shape)) return false;
        for (int axis = 0; axis < shape.length; axis++) {
            double tolerance = CELL_TOLERANCE * cellSizes[axis];
            if (Math.abs(cellSizes[axis] - other.cellSizes[axis]) > tolerance) return false;
            if (Math.abs(cornerCoords[axis] - other.cornerCoords[axis]) > tolerance) return false;
        }
        return true;
    }

    /// Describe the first difference between this extent and another, for error messages.
    public String describeDifference (Extent other) {
        if (!dimensions.equals(other.dimensions)) {
            return String.format("dimensions %s vs. %s", dimensions, other.dimensions);
        }
        if (!Arrays.equals(shape, other.shape)) {
            return String.format("shape %s vs. %s", Arrays.toString(shape), Arrays.toString(other.shape));
        }
        if (!sameAs(other)) {
            return String.format("corner %s / cell size %s vs. corner %s / cell size %s",
                  Arrays.toString(cornerCoords), Arrays.toString(cellSizes),
                  Arrays.toString(other.cornerCoords), Arrays.toString(other.cellSizes));
        }
        return "none";
    }

    /// The extent that remains after removing one axis, as seen by a slice through this grid.
    public Extent withoutAxis (char axis) {
        int index = axisIndex(axis);
        checkArgument(index >= 0, "Extent with dimensions %s has no %s axis.", dimensions, axis);
        checkArgument(axis == 't' || axis == 'z', "Only the t and z axes can be removed, not %s.", axis);
        int n = nDims() - 1;
        int[] newShape = new int[n];
        double[] newCorner = new double[n];
        double[] newCellSize = new double[n];
        for (int from = 0, to = 0; from < nDims(); from++) {
            if (from == index) continue;
            newShape[to] = shape[from];
            newCorner[to] = cornerCoords[from];
            newCellSize[to] = cellSizes[from];
            to += 1;
        }
        String newDims = dimensions.substring(0, index) + dimensions.substring(index + 1);
        return of(newDims, newShape, newCorner, newCellSize);
    }

    /// The extent of a stack of grids with this extent along a new t or z axis.
    public Extent withAxis (char axis, int count, double corner, double cellSize) {
        checkArgument(axis == 't' || axis == 'z', "Only t and z axes can be added, not %s.", axis);
        checkArgument(!hasAxis(axis), "Extent with dimensions %s already has a %s axis.", dimensions, axis);
        StringBuilder dims = new StringBuilder();
        for (char c : AXIS_ORDER.toCharArray()) {
            if (c == axis || hasAxis(c)) dims.append(c);
        }
        String newDims = dims.toString();
        int index = newDims.indexOf(axis);
        int n = newDims.length();
        int[] newShape = new int[n];
        double[] newCorner = new double[n];
        double[] newCellSize = new double[n];
        for (int to = 0, from = 0; to < n; to++) {
            if (to == index) {
                newShape[to] = count;
                newCorner[to] = corner;
                newCellSize[to] = cellSize;
            } else {
                newShape[to] = shape[from];
                newCorner[to] = cornerCoords[from];
                newCellSize[to] = cellSizes[from];
                from += 1;
            }
        }
        return of(newDims, newShape, newCorner, newCellSize);
    }

    /// A stable textual form for use in fingerprints, rounded so that floating point noise below
    /// the comparison tolerance does not change it.
    public String canonical () {
        StringBuilder sb = new StringBuilder(dimensions);
        for (int axis = 0; axis < shape.length; axis++) {
            sb.append(String.format(Locale.ROOT, "|%d@%.12g+%.12g", shape[axis], cornerCoords[axis], cellSizes[axis]));
        }
        return sb.toString();
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (!(o instanceof Extent other)) return false;
        return dimensions.equals(other.dimensions) && Arrays.equals(shape, other.shape)
              && Arrays.equals(cornerCoords, other.cornerCoords) && Arrays.equals(cellSizes, other.cellSizes);
    }

    @Override
    public int hashCode () {
        int result = dimensions.hashCode();
        result = 31 * result + Arrays.hashCode(shape);
        result = 31 * result + Arrays.hashCode(cornerCoords);
        return 31 * result + Arrays.hashCode(cellSizes);
    }

    @Override
    public String toString () {
        return MoreObjects.toStringHelper(this)
              .add("dimensions", dimensions)
              .add("shape", Arrays.toString(shape))
              .add("corner", Arrays.toString(cornerCoords))
              .add("cellSize", Arrays.toString(cellSizes))
              .toString();
    }
}

// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.grid;

import io.pfive.datasets.coords.Extent;
import io.pfive.datasets.coords.SpatialReference;

/// An n-dimensional raster with a cell type, a NoData marker, an extent and a spatial reference.
/// This is the contract every backend adapter and every virtual or derived grid satisfies.
///
/// Metadata accessors perform no I/O beyond the first resolution of backend metadata, which is
/// retained for the lifetime of the grid. Reads are side-effect free with respect to the stored
/// data. Implementations must be safe for concurrent reads from multiple threads.
public interface Grid extends Dataset {

    GridMetadata metadata ();

    default DataType getDataType () {
        return metadata().dataType();
    }

    default Extent getExtent () {
        return metadata().extent();
    }

    default SpatialReference getSpatialReference () {
        return metadata().spatialReference();
    }

    /// The NoData value of scaled cell values, or null if the grid declares none.
    default Double getNoDataValue () {
        return metadata().noDataValue();
    }

    /// The NoData value as stored by the backend, before scaling.
    default Double getUnscaledNoDataValue () {
        return metadata().unscaledNoDataValue();
    }

    default DataType getUnscaledDataType () {
        return metadata().unscaledDataType();
    }

    /// Null when values are not scaled.
    default Scaling getScaling () {
        return metadata().scaling();
    }

    /// Read the (scaled) values of a window. The origin and shape are in cells, ordered like the
    /// extent's dimensions string.
    /// @throws io.pfive.datasets.exception.OutOfBoundsException if the window exceeds the extent
    /// @throws io.pfive.datasets.exception.BackendUnavailableException if the data cannot be accessed
    Block readBlock (int[] origin, int[] shape);

    /// Read values as stored, before scaling. For grids without scaling this is readBlock.
    default Block readUnscaledBlock (int[] origin, int[] shape) {
        return readBlock(origin, shape);
    }

    /// Read the entire grid in one block. Intended for small grids and tests.
    default Block readAll () {
        return readBlock(new int[getExtent().nDims()], getExtent().shape());
    }

    default boolean isNoData (double value) {
        return NoData.isNoData(value, getNoDataValue(), getDataType());
    }

}

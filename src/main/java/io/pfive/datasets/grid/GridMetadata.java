// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.grid;

import io.pfive.datasets.coords.Extent;
import io.pfive.datasets.coords.SpatialReference;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// Everything about a grid except its cell values. Backends often need I/O to learn these, so
/// grids resolve them once and keep them.
///
/// The scaled and unscaled views differ only when a Scaling is present (packed data). Without one,
/// the two data types and the two NoData values must be the same. NoData values must be
/// representable in their data types: an integer grid cannot have NaN or -9999.5 as its NoData.
public record GridMetadata (
      DataType dataType,
      Extent extent,
      SpatialReference spatialReference,
      Double noDataValue,
      DataType unscaledDataType,
      Double unscaledNoDataValue,
      Scaling scaling
) {

    public GridMetadata {
        checkNotNull(dataType, "dataType");
        checkNotNull(extent, "extent");
        checkNotNull(spatialReference, "spatialReference");
        checkNotNull(unscaledDataType, "unscaledDataType");
        checkArgument(noDataValue == null || dataType.canRepresent(noDataValue),
              "NoData value %s cannot be represented as %s.", noDataValue, dataType);
        checkArgument(unscaledNoDataValue == null || unscaledDataType.canRepresent(unscaledNoDataValue),
              "Unscaled NoData value %s cannot be represented as %s.", unscaledNoDataValue, unscaledDataType);
        if (scaling == null || scaling.isIdentity()) {
            scaling = null;
            checkArgument(dataType == unscaledDataType, "Data types differ but no scaling was supplied.");
            checkArgument(NoData.sameValue(noDataValue, unscaledNoDataValue),
                  "NoData values differ (%s vs. unscaled %s) but no scaling was supplied.", noDataValue, unscaledNoDataValue);
        }
    }

    /// Metadata for a grid whose values are presented as stored.
    public static GridMetadata of (DataType dataType, Extent extent, SpatialReference spatialReference, Double noDataValue) {
        return new GridMetadata(dataType, extent, spatialReference, noDataValue, dataType, noDataValue, null);
    }

    public boolean isScaled () {
        return scaling != null;
    }

    /// The same metadata with a different extent, as seen by slices and stacks of this grid.
    public GridMetadata withExtent (Extent newExtent) {
        return new GridMetadata(dataType, newExtent, spatialReference, noDataValue, unscaledDataType, unscaledNoDataValue, scaling);
    }

    /// Metadata describing the scaled values only, as held by a grid materialized from this one.
    public GridMetadata scaledOnly () {
        return of(dataType, extent, spatialReference, noDataValue);
    }

    public String canonical () {
        return String.join(";",
              dataType.name(),
              extent.canonical(),
              spatialReference.canonical(),
              String.valueOf(noDataValue),
              unscaledDataType.name(),
              String.valueOf(unscaledNoDataValue),
              scaling == null ? "unscaled" : scaling.canonical());
    }
}

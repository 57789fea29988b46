// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.adapter;

import com.google.common.collect.ImmutableSortedMap;
import io.pfive.datasets.coords.Extent;
import io.pfive.datasets.coords.SpatialReference;
import io.pfive.datasets.grid.DataType;
import io.pfive.datasets.grid.GridMetadata;
import io.pfive.datasets.grid.Scaling;

import java.nio.ByteOrder;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// Contents of the JSON sidecar file describing a raw raster: everything needed to interpret the
/// bytes of the accompanying .raw file. Field names follow the JSON keys.
///
/// ```json
/// { "dataType": "int16", "byteOrder": "little", "dimensions": "yx", "shape": [180, 360],
///   "cornerCoords": [-89.5, -179.5], "cellSizes": [1.0, 1.0], "noDataValue": -32768,
///   "scaleFactor": 0.01, "addOffset": 0, "scaledDataType": "float32",
///   "spatialReference": { "name": "WGS 84", "datum": "WGS_1984", "projection": "geographic" } }
/// ```
public class RawRasterHeader {

    /// Cell type of the stored values.
    public String dataType;
    /// "little" (the default) or "big".
    public String byteOrder;
    public String dimensions;
    public int[] shape;
    public double[] cornerCoords;
    public double[] cellSizes;
    public Double noDataValue;

    // Optional packing. Scaled values are stored * scaleFactor + addOffset.
    public Double scaleFactor;
    public Double addOffset;
    /// Type of scaled values, defaulting to float32.
    public String scaledDataType;
    /// NoData of scaled values. Defaults to NaN for floating point scaled types.
    public Double scaledNoDataValue;

    /// Absent means WGS84 geographic coordinates.
    public SpatialReferenceJson spatialReference;

    public static class SpatialReferenceJson {
        public String name;
        public String datum;
        public String projection;
        public ImmutableSortedMap<String, Double> parameters;
        public String linearUnit;
        public Double metersPerUnit;

        SpatialReference toSpatialReference () {
            checkNotNull(datum, "spatialReference.datum");
            checkNotNull(projection, "spatialReference.projection");
            boolean geographic = SpatialReference.GEOGRAPHIC.equalsIgnoreCase(projection);
            String unit = (linearUnit != null) ? linearUnit : (geographic ? "degree" : "metre");
            double factor = (metersPerUnit != null) ? metersPerUnit
                  : (geographic ? SpatialReference.WGS84.metersPerUnit() : 1.0);
            String displayName = (name != null) ? name : datum + " " + projection;
            return new SpatialReference(displayName, datum, projection, parameters, unit, factor);
        }
    }

    public ByteOrder nativeByteOrder () {
        if (byteOrder == null || byteOrder.equalsIgnoreCase("little")) return ByteOrder.LITTLE_ENDIAN;
        checkArgument(byteOrder.equalsIgnoreCase("big"), "Byte order must be 'little' or 'big', was '%s'.", byteOrder);
        return ByteOrder.BIG_ENDIAN;
    }

    public GridMetadata toMetadata () {
        checkNotNull(dataType, "dataType");
        checkNotNull(dimensions, "dimensions");
        DataType stored = DataType.parse(dataType);
        Extent extent = Extent.of(dimensions, shape, cornerCoords, cellSizes);
        SpatialReference srs = (spatialReference == null) ? SpatialReference.WGS84 : spatialReference.toSpatialReference();
        if (scaleFactor == null && addOffset == null) {
            return GridMetadata.of(stored, extent, srs, noDataValue);
        }
        Scaling scaling = new Scaling(scaleFactor == null ? 1 : scaleFactor, addOffset == null ? 0 : addOffset);
        if (scaling.isIdentity()) {
            return GridMetadata.of(stored, extent, srs, noDataValue);
        }
        DataType scaledType = (scaledDataType == null) ? DataType.FLOAT32 : DataType.parse(scaledDataType);
        Double scaledNoData = scaledNoDataValue;
        if (scaledNoData == null && noDataValue != null) {
            scaledNoData = scaledType.floating ? Double.NaN : scaledType.minValue;
        }
        return new GridMetadata(scaledType, extent, srs, scaledNoData, stored, noDataValue, scaling);
    }

}

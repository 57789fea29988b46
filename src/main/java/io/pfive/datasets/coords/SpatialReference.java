// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.coords;

import com.google.common.collect.ImmutableSortedMap;

import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// Describes the coordinate system of a grid: the datum, the projection (or "geographic" for
/// unprojected latitude and longitude) with its numeric parameters, and the linear unit of the
/// projected coordinates. This is deliberately much smaller than a full OGC CRS model. Backends
/// describe their coordinate systems in many slightly different ways (WKT flavors, EPSG codes, PROJ
/// strings) and what matters to the library is only whether two grids can be combined cell by cell.
///
/// Two references are compatible if their datum and projection names match ignoring case, they
/// have the same set of projection parameters, and every parameter and the unit conversion factor
/// agree within a relative tolerance. The name is for display only and is not compared.
public record SpatialReference (
      String name,
      String datum,
      String projection,
      SortedMap<String, Double> parameters,
      String linearUnit,
      double metersPerUnit
) {

    public static final double DEFAULT_TOLERANCE = 1e-9;

    public static final String GEOGRAPHIC = "geographic";

    /// Unprojected WGS84 longitude and latitude. The unit factor is meters per degree at the equator.
    public static final SpatialReference WGS84 = new SpatialReference(
          "WGS 84", "WGS_1984", GEOGRAPHIC, ImmutableSortedMap.of(), "degree", 111_319.490793
    );

    public SpatialReference {
        checkNotNull(name, "name");
        checkNotNull(datum, "datum");
        checkNotNull(projection, "projection");
        checkNotNull(linearUnit, "linearUnit");
        checkArgument(Double.isFinite(metersPerUnit) && metersPerUnit > 0,
              "Linear unit conversion factor must be positive, was %s", metersPerUnit);
        parameters = (parameters == null) ? ImmutableSortedMap.of() : ImmutableSortedMap.copyOfSorted(parameters);
        for (Map.Entry<String, Double> entry : parameters.entrySet()) {
            checkArgument(entry.getValue() != null && Double.isFinite(entry.getValue()),
                  "Projection parameter %s must be a finite number.", entry.getKey());
        }
    }

    /// A projected coordinate system in meters.
    public static SpatialReference projected (String name, String datum, String projection, Map<String, Double> parameters) {
        return new SpatialReference(name, datum, projection, ImmutableSortedMap.copyOf(parameters), "metre", 1.0);
    }

    public boolean isGeographic () {
        return GEOGRAPHIC.equalsIgnoreCase(projection);
    }

    public boolean isCompatibleWith (SpatialReference other) {
        return isCompatibleWith(other, DEFAULT_TOLERANCE);
    }

    public boolean isCompatibleWith (SpatialReference other, double tolerance) {
        if (other == null) return false;
        if (this == other) return true;
        if (!datum.equalsIgnoreCase(other.datum)) return false;
        if (!projection.equalsIgnoreCase(other.projection)) return false;
        if (!parameters.keySet().equals(other.parameters.keySet())) return false;
        for (Map.Entry<String, Double> entry : parameters.entrySet()) {
            if (!approximatelyEqual(entry.getValue(), other.parameters.get(entry.getKey()), tolerance)) return false;
        }
        return approximatelyEqual(metersPerUnit, other.metersPerUnit, tolerance);
    }

    /// Relative comparison, falling back to absolute comparison for values smaller than one.
    static boolean approximatelyEqual (double a, double b, double tolerance) {
        if (a == b) return true;
        double scale = Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
        return Math.abs(a - b) <= tolerance * scale;
    }

    /// A stable textual form for use in fingerprints. Parameter values are rounded to 12
    /// significant digits so that references which differ only by floating point noise produce
    /// the same text.
    public String canonical () {
        StringBuilder sb = new StringBuilder();
        sb.append(datum.toUpperCase(Locale.ROOT)).append('|').append(projection.toLowerCase(Locale.ROOT));
        for (Map.Entry<String, Double> entry : parameters.entrySet()) {
            sb.append('|').append(entry.getKey()).append('=').append(String.format(Locale.ROOT, "%.12g", entry.getValue()));
        }
        sb.append('|').append(String.format(Locale.ROOT, "%.12g", metersPerUnit));
        return sb.toString();
    }

    @Override
    public String toString () {
        return name;
    }
}

// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.grid;

/// The only place where cell values are compared against NoData markers. IEEE comparison of NaN
/// with anything (including itself) is false, so a grid whose NoData value is NaN would never find
/// any NoData cells with plain ==, and two grids that both use NaN as NoData would appear to
/// disagree about their NoData value. Everything in this library that asks "is this NoData" or
/// "are these the same NoData value" must call one of these methods rather than comparing directly.
public abstract class NoData {

    /// Equality that treats NaN as equal to NaN. Positive and negative zero are equal.
    public static boolean sameValue (double a, double b) {
        return a == b || (Double.isNaN(a) && Double.isNaN(b));
    }

    /// Null-tolerant version for optional NoData values: two absent values are the same.
    public static boolean sameValue (Double a, Double b) {
        if (a == null || b == null) return a == b;
        return sameValue(a.doubleValue(), b.doubleValue());
    }

    /// True if a cell holding the given value represents missing data. In floating point grids,
    /// NaN cells are always treated as NoData whatever the declared NoData value, because no
    /// computation can make use of them.
    public static boolean isNoData (double value, Double noDataValue, DataType dataType) {
        if (dataType.floating && Double.isNaN(value)) return true;
        return noDataValue != null && sameValue(value, noDataValue.doubleValue());
    }

}

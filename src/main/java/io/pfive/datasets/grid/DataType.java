// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.grid;

import java.util.Locale;

/// The cell types that a grid may have, as stored by the backend. Every one of these can be held
/// exactly in a Java double, which is why Blocks carry double values regardless of type.
/// 64-bit integers are intentionally absent: they cannot round-trip through doubles.
public enum DataType {

    INT8    (8,  true,  false, Byte.MIN_VALUE, Byte.MAX_VALUE),
    UINT8   (8,  false, false, 0, 255),
    INT16   (16, true,  false, Short.MIN_VALUE, Short.MAX_VALUE),
    UINT16  (16, false, false, 0, 65_535),
    INT32   (32, true,  false, Integer.MIN_VALUE, Integer.MAX_VALUE),
    UINT32  (32, false, false, 0, 4_294_967_295.0),
    FLOAT32 (32, true,  true,  -Float.MAX_VALUE, Float.MAX_VALUE),
    FLOAT64 (64, true,  true,  -Double.MAX_VALUE, Double.MAX_VALUE);

    public final int bits;
    public final boolean signed;
    public final boolean floating;
    public final double minValue;
    public final double maxValue;

    DataType (int bits, boolean signed, boolean floating, double minValue, double maxValue) {
        this.bits = bits;
        this.signed = signed;
        this.floating = floating;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    public int bytes () {
        return bits / 8;
    }

    public boolean isInteger () {
        return !floating;
    }

    /// True if the value can be stored in a cell of this type without change (after rounding
    /// float32 precision). Floating types accept NaN and infinities, integer types only whole
    /// numbers within range.
    public boolean canRepresent (double value) {
        if (floating) {
            if (this == FLOAT32 && Double.isFinite(value)) return Math.abs(value) <= Float.MAX_VALUE;
            return true;
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) return false;
        return value == Math.rint(value) && value >= minValue && value <= maxValue;
    }

    /// Convert a computed value to the precision of this type. Callers must check canRepresent
    /// first for integer types, this does not clamp.
    public double coerce (double value) {
        if (this == FLOAT32) return (float) value;
        return value;
    }

    /// Accepts enum names and the lower case names used by numpy and GDAL ("float32", "uint8").
    public static DataType parse (String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "BYTE": return UINT8;
            case "FLOAT": return FLOAT32;
            case "DOUBLE": return FLOAT64;
            default: return DataType.valueOf(normalized);
        }
    }
}

// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.util;

/// Various static helper functions to assist in computing the memory consumption of class instances.
/// Typically used by implementations of the [ByteSize] interface.
public abstract class ByteSizeUtil {

    public static final int OBJECT_BYTES = 16;
    public static final int ARRAY_BYTES = OBJECT_BYTES + 8;
    public static final int OBJECT_REFERENCE_BYTES = 6;

    private static final String[] UNITS = {"B", "kB", "MB", "GB", "TB"};

    public static long intArrayFieldBytes (int[] array) {
        if (array == null) return OBJECT_REFERENCE_BYTES;
        return OBJECT_REFERENCE_BYTES + intArrayBytes(array);
    }

    public static long doubleArrayFieldBytes (double[] array) {
        if (array == null) return OBJECT_REFERENCE_BYTES;
        return OBJECT_REFERENCE_BYTES + doubleArrayBytes(array);
    }

    public static long intArrayBytes (int[] array) {
        return (long) array.length * Integer.BYTES + ARRAY_BYTES;
    }

    public static long doubleArrayBytes (double[] array) {
        return (long) array.length * Double.BYTES + ARRAY_BYTES;
    }

    /// Estimate for values that do not implement ByteSize: only their reference is counted.
    public static long byteSizeOf (Object object) {
        if (object instanceof ByteSize byteSize) return byteSize.byteSize();
        if (object instanceof double[] array) return doubleArrayBytes(array);
        if (object instanceof int[] array) return intArrayBytes(array);
        return OBJECT_BYTES;
    }

    /// Format a number of bytes with a binary-scaled unit, e.g. "1.5 MB".
    public static String human (long bytes) {
        double value = bytes;
        int unit = 0;
        while (value >= 1024 && unit < UNITS.length - 1) {
            value /= 1024;
            unit += 1;
        }
        return unit == 0 ? bytes + " B" : String.format("%.1f %s", value, UNITS[unit]);
    }

}

// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.table;

/// Type of the values in one column of a table. Values are held as Long, Double or String.
public enum FieldType {
    INTEGER, REAL, STRING;

    public boolean isNumeric () {
        return this == INTEGER || this == REAL;
    }

    /// The narrowest type that can hold the given text, which must not be empty.
    public static FieldType infer (String text) {
        if (parseLong(text) != null) return INTEGER;
        if (parseDouble(text) != null) return REAL;
        return STRING;
    }

    /// The narrowest type able to hold values of both types.
    public FieldType widen (FieldType other) {
        if (this == other) return this;
        if (this.isNumeric() && other.isNumeric()) return REAL;
        return STRING;
    }

    /// Convert text to a value of this type. Empty text is a null value.
    public Object convert (String text) {
        if (text == null || text.isEmpty()) return null;
        switch (this) {
            case INTEGER: {
                Long value = parseLong(text);
                if (value == null) throw new IllegalArgumentException("Not an integer: " + text);
                return value;
            }
            case REAL: {
                Double value = parseDouble(text);
                if (value == null) throw new IllegalArgumentException("Not a number: " + text);
                return value;
            }
            default: return text;
        }
    }

    private static Long parseLong (String text) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double parseDouble (String text) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

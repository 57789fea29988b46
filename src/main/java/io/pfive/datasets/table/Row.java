// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.table;

import com.google.common.base.MoreObjects;

import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/// The values of one table row, positioned like the table's fields. Values may be null.
public final class Row {

    private final List<Field> fields;
    private final Object[] values;

    public Row (List<Field> fields, Object[] values) {
        checkArgument(fields.size() == values.length, "Expected %s values, got %s.", fields.size(), values.length);
        this.fields = fields;
        this.values = values.clone();
    }

    public int indexOf (String fieldName) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equalsIgnoreCase(fieldName)) return i;
        }
        throw new IllegalArgumentException("No field named " + fieldName);
    }

    public Object get (int index) {
        return values[index];
    }

    /// Field names are matched ignoring case, like most database engines do.
    public Object get (String fieldName) {
        return values[indexOf(fieldName)];
    }

    public Double getDouble (String fieldName) {
        Object value = get(fieldName);
        return (value == null) ? null : ((Number) value).doubleValue();
    }

    public String getString (String fieldName) {
        Object value = get(fieldName);
        return (value == null) ? null : value.toString();
    }

    public List<Field> fields () {
        return fields;
    }

    @Override
    public String toString () {
        return MoreObjects.toStringHelper(this).add("values", Arrays.toString(values)).toString();
    }
}

// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.table;

import io.pfive.datasets.grid.Dataset;

import java.util.List;
import java.util.function.Predicate;

/// A dataset of rows with named, typed fields.
public interface Table extends Dataset {

    List<Field> fields ();

    /// Open a forward-only cursor over the rows matching the predicate. The cursor holds backend
    /// resources until it is closed, so open it in a try-with-resources block.
    SelectCursor openSelectCursor (Predicate<Row> where);

    default SelectCursor openSelectCursor () {
        return openSelectCursor(row -> true);
    }

    default Field field (String name) {
        for (Field field : fields()) {
            if (field.name().equalsIgnoreCase(name)) return field;
        }
        throw new IllegalArgumentException(String.format("Table %s has no field named %s.", displayName(), name));
    }

}

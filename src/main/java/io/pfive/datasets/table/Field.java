// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.table;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// One column of a table.
public record Field (String name, FieldType type) {

    public Field {
        checkNotNull(name, "name");
        checkArgument(!name.isBlank(), "Field names must not be blank.");
        checkNotNull(type, "type");
    }

}

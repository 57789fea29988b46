// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.invoke.MethodHandles;
import java.util.Iterator;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkState;

/// Forward-only iteration over the rows of a table that match a predicate. Call nextRow() to move
/// to each row in turn, then getValue() to read fields of the current row. When nextRow() returns
/// false the cursor is at its end and releases its backend resources; closing it earlier does the
/// same. Closing is idempotent. A cursor must be used by one thread at a time.
public class SelectCursor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final String tableName;
    private final Iterator<Row> rows;
    private final Predicate<Row> where;
    private final Closeable resource;
    private Row current;
    private boolean atEnd;
    private boolean open = true;
    private long nRows;

    /// @param resource closed when the cursor is closed or reaches its end, may be null
    public SelectCursor (String tableName, Iterator<Row> rows, Predicate<Row> where, Closeable resource) {
        this.tableName = tableName;
        this.rows = rows;
        this.where = where;
        this.resource = resource;
    }

    /// Advance to the next matching row. Returns false when there are no more rows.
    public boolean nextRow () {
        checkState(open || atEnd, "Cursor on %s is closed.", tableName);
        if (atEnd) return false;
        while (rows.hasNext()) {
            Row row = rows.next();
            if (where.test(row)) {
                current = row;
                nRows += 1;
                return true;
            }
        }
        current = null;
        atEnd = true;
        close();
        return false;
    }

    public Row currentRow () {
        checkState(current != null, "Cursor on %s is not positioned on a row.", tableName);
        return current;
    }

    public Object getValue (String fieldName) {
        return currentRow().get(fieldName);
    }

    public boolean isOpen () {
        return open;
    }

    public boolean atEnd () {
        return atEnd;
    }

    @Override
    public void close () {
        if (!open) return;
        open = false;
        current = null;
        LOG.debug("Closing cursor on {} after {} rows.", tableName, nRows);
        if (resource != null) {
            try {
                resource.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Could not close cursor on " + tableName, e);
            }
        }
    }
}

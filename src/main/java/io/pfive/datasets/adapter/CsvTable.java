// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.adapter;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import io.pfive.datasets.cache.CacheKey;
import io.pfive.datasets.exception.BackendUnavailableException;
import io.pfive.datasets.table.Field;
import io.pfive.datasets.table.FieldType;
import io.pfive.datasets.table.Row;
import io.pfive.datasets.table.SelectCursor;
import io.pfive.datasets.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.function.Supplier;

/// A table read from a comma separated file whose first line holds the field names. Field types
/// are not declared in CSV, so they are inferred on first use by scanning every value: a column is
/// INTEGER if all its non-empty values are whole numbers, REAL if they are all numbers, otherwise
/// STRING. Empty values are nulls. Every cursor opens the file anew and closes it when done.
public class CsvTable implements Table {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    // Reading rows as arrays keeps the header row and the column order.
    private static final ObjectReader ROW_READER = new CsvMapper()
          .enable(CsvParser.Feature.WRAP_AS_ARRAY)
          .readerFor(String[].class);

    private final Path path;
    private final String displayName;
    private final Supplier<List<Field>> fields = Suppliers.memoize(this::inferFields);

    public CsvTable (Path path) {
        this.path = path;
        String name = path.getFileName().toString();
        this.displayName = name.toLowerCase(Locale.ROOT).endsWith(".csv") ? name.substring(0, name.length() - 4) : name;
    }

    public static boolean isCsv (Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv");
    }

    public Path path () {
        return path;
    }

    @Override
    public String displayName () {
        return displayName;
    }

    @Override
    public String fingerprint () {
        // Not cached, the file may be rewritten while the table is open.
        CacheKey.Builder key = CacheKey.builder("file").put("format", getClass().getSimpleName());
        FileIdentity.put(key, "path", path);
        return key.build().fingerprint();
    }

    @Override
    public List<Field> fields () {
        return fields.get();
    }

    private List<Field> inferFields () {
        try (MappingIterator<String[]> lines = ROW_READER.readValues(path.toFile())) {
            if (!lines.hasNext()) {
                throw new BackendUnavailableException(path.toString(), "CSV file has no header line");
            }
            String[] names = lines.next();
            FieldType[] types = new FieldType[names.length];
            long nLines = 0;
            while (lines.hasNext()) {
                String[] line = lines.next();
                checkWidth(line, names.length);
                for (int i = 0; i < line.length; i++) {
                    if (line[i] == null || line[i].isEmpty()) continue;
                    FieldType type = FieldType.infer(line[i]);
                    types[i] = (types[i] == null) ? type : types[i].widen(type);
                }
                nLines += 1;
            }
            ImmutableList.Builder<Field> fields = ImmutableList.builder();
            for (int i = 0; i < names.length; i++) {
                fields.add(new Field(names[i].trim(), types[i] == null ? FieldType.STRING : types[i]));
            }
            List<Field> result = fields.build();
            LOG.debug("Inferred fields of {} from {} rows: {}", displayName, nLines, result);
            return result;
        } catch (IOException e) {
            throw AdapterGrid.unavailable(path.toString(), e);
        }
    }

    private void checkWidth (String[] line, int nFields) {
        if (line.length > nFields) {
            throw new BackendUnavailableException(path.toString(),
                  String.format("a row has %d values but there are %d fields", line.length, nFields));
        }
    }

    @Override
    public SelectCursor openSelectCursor (Predicate<Row> where) {
        List<Field> fields = fields();
        MappingIterator<String[]> lines;
        try {
            lines = ROW_READER.readValues(path.toFile());
        } catch (IOException e) {
            throw AdapterGrid.unavailable(path.toString(), e);
        }
        // Skip the header.
        if (lines.hasNext()) lines.next();
        Iterator<Row> rows = Iterators.transform(lines, line -> toRow(fields, line));
        return new SelectCursor(displayName, rows, where, lines);
    }

    private Row toRow (List<Field> fields, String[] line) {
        checkWidth(line, fields.size());
        Object[] values = new Object[fields.size()];
        for (int i = 0; i < line.length; i++) {
            values[i] = fields.get(i).type().convert(line[i]);
        }
        return new Row(fields, values);
    }

    @Override
    public String toString () {
        return "CsvTable[" + displayName + "]";
    }
}

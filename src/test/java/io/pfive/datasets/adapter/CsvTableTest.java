// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.adapter;

import io.pfive.datasets.exception.BackendUnavailableException;
import io.pfive.datasets.table.Field;
import io.pfive.datasets.table.FieldType;
import io.pfive.datasets.table.SelectCursor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvTableTest {

    @TempDir
    Path dir;

    private CsvTable stations () throws IOException {
        Path path = dir.resolve("stations.csv");
        Files.writeString(path, String.join("\n",
              "id,name,depth,temperature",
              "1,Alpha,120,14.5",
              "2,\"Bravo, north\",80,",
              "3,Charlie,310,9",
              "4,Delta,,11.25"));
        return new CsvTable(path);
    }

    @Test
    void fieldTypesAreInferred () throws IOException {
        CsvTable table = stations();
        assertEquals("stations", table.displayName());
        assertEquals(List.of(
              new Field("id", FieldType.INTEGER),
              new Field("name", FieldType.STRING),
              new Field("depth", FieldType.INTEGER),
              new Field("temperature", FieldType.REAL)), table.fields());
        assertEquals(FieldType.REAL, table.field("Temperature").type());
    }

    @Test
    void cursorVisitsMatchingRows () throws IOException {
        CsvTable table = stations();
        List<String> names = new ArrayList<>();
        try (SelectCursor cursor = table.openSelectCursor(row -> row.get("depth") != null && (Long) row.get("depth") > 100)) {
            assertTrue(cursor.isOpen());
            while (cursor.nextRow()) {
                names.add((String) cursor.getValue("name"));
            }
            assertTrue(cursor.atEnd());
            assertFalse(cursor.isOpen());
            assertFalse(cursor.nextRow());
        }
        assertEquals(List.of("Alpha", "Charlie"), names);
    }

    @Test
    void emptyValuesAreNull () throws IOException {
        try (SelectCursor cursor = stations().openSelectCursor()) {
            assertTrue(cursor.nextRow());
            assertEquals(14.5, cursor.getValue("temperature"));
            assertTrue(cursor.nextRow());
            assertEquals("Bravo, north", cursor.getValue("name"));
            assertNull(cursor.getValue("temperature"));
            assertTrue(cursor.nextRow());
            assertEquals(9.0, cursor.currentRow().getDouble("temperature"));
            assertTrue(cursor.nextRow());
            assertNull(cursor.getValue("depth"));
            assertFalse(cursor.nextRow());
        }
    }

    @Test
    void closeIsIdempotentAndEndsTheCursor () throws IOException {
        SelectCursor cursor = stations().openSelectCursor();
        assertThrows(IllegalStateException.class, () -> cursor.getValue("id"));
        assertTrue(cursor.nextRow());
        assertEquals(1L, cursor.getValue("id"));
        cursor.close();
        cursor.close();
        assertFalse(cursor.isOpen());
        assertFalse(cursor.atEnd());
        assertThrows(IllegalStateException.class, cursor::nextRow);
        assertThrows(IllegalStateException.class, () -> cursor.getValue("id"));
    }

    @Test
    void missingFileIsBackendUnavailable () {
        CsvTable table = new CsvTable(dir.resolve("absent.csv"));
        assertThrows(BackendUnavailableException.class, table::fields);
        assertThrows(BackendUnavailableException.class, table::fingerprint);
    }

    @Test
    void upperCaseSuffixUnderTurkishLocale () throws IOException {
        Locale saved = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            Path path = dir.resolve("INDEX.CSV");
            Files.writeString(path, "id\n1\n");
            assertTrue(CsvTable.isCsv(path));
            assertTrue(CsvTable.isCsv(Path.of("wind.Csv")));
            assertEquals("INDEX", new CsvTable(path).displayName());
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void fingerprintFollowsRewrites () throws IOException {
        CsvTable table = stations();
        String before = table.fingerprint();
        assertEquals(before, table.fingerprint());
        Path path = table.path();
        Files.writeString(path, "id,name\n9,Echo\n");
        Files.setLastModifiedTime(path, FileTime.fromMillis(Files.getLastModifiedTime(path).toMillis() + 60_000));
        assertNotEquals(before, table.fingerprint());
    }
}

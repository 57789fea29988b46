// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.adapter;

import io.pfive.datasets.Configuration;
import io.pfive.datasets.derived.Derivations;
import io.pfive.datasets.derived.DerivedGrid;
import io.pfive.datasets.derived.GridEngine;
import io.pfive.datasets.exception.BackendUnavailableException;
import io.pfive.datasets.exception.DatasetException;
import io.pfive.datasets.grid.ArrayGrid;
import io.pfive.datasets.grid.Block;
import io.pfive.datasets.grid.DataType;
import io.pfive.datasets.grid.GridSlice;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Envelope;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RawRasterGridTest {

    @TempDir
    Path dir;

    /// Write name.grid.json with the given header body and name.raw with int16 values.
    static Path writeInt16 (Path dir, String name, String header, ByteOrder order, short... values) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * 2).order(order);
        for (short v : values) buffer.putShort(v);
        Files.write(dir.resolve(name + ".raw"), buffer.array());
        Path headerPath = dir.resolve(name + ".grid.json");
        Files.writeString(headerPath, header);
        return headerPath;
    }

    static String header2d (String dataType, int rows, int cols, String extra) {
        return String.format("{\"dataType\": \"%s\", \"dimensions\": \"yx\", \"shape\": [%d, %d], "
              + "\"cornerCoords\": [0.5, 10.5], \"cellSizes\": [1, 1]%s}", dataType, rows, cols, extra);
    }

    private Path sample () throws IOException {
        return writeInt16(dir, "sample", header2d("int16", 3, 4, ", \"noDataValue\": -32768"), ByteOrder.LITTLE_ENDIAN,
              (short) 0, (short) 10, (short) 20, (short) 30,
              (short) 40, Short.MIN_VALUE, (short) 60, (short) 70,
              (short) 80, (short) 90, (short) -100, (short) 110);
    }

    @Test
    void readsMetadataAndWindows () throws IOException {
        try (RawRasterGrid grid = new RawRasterGrid(sample())) {
            assertEquals("sample", grid.displayName());
            assertEquals(DataType.INT16, grid.getDataType());
            assertEquals(-32768.0, grid.getNoDataValue());
            assertNull(grid.getScaling());
            assertEquals(new Envelope(10, 14, 0, 3), grid.getExtent().envelope());
            Block block = grid.readBlock(new int[] {1, 1}, new int[] {2, 2});
            assertArrayEquals(new double[] {-32768, 60, 90, -100}, block.values());
            assertTrue(block.isNoData(0));
            assertEquals(grid.readAll(), ArrayGrid.materialize(grid).readAll());
        }
    }

    @Test
    void bigEndianFloats () throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(4 * 4).order(ByteOrder.BIG_ENDIAN);
        for (float v : new float[] {1.5f, Float.NaN, -2.25f, 1e30f}) buffer.putFloat(v);
        Files.write(dir.resolve("floats.raw"), buffer.array());
        Path header = dir.resolve("floats.grid.json");
        Files.writeString(header, header2d("float32", 2, 2, ", \"byteOrder\": \"big\""));
        RawRasterGrid grid = new RawRasterGrid(header);
        Block block = grid.readAll();
        assertEquals(1.5, block.get(0));
        assertTrue(Double.isNaN(block.get(1)));
        assertTrue(block.isNoData(1));
        assertEquals(-2.25, block.get(2));
        assertEquals((double) 1e30f, block.get(3));
    }

    @Test
    void scaledValuesAndNoData () throws IOException {
        String extra = ", \"noDataValue\": -1, \"scaleFactor\": 0.5, \"addOffset\": 10";
        Path header = writeInt16(dir, "packed", header2d("int16", 1, 4, extra), ByteOrder.LITTLE_ENDIAN,
              (short) 0, (short) 1, (short) -1, (short) 100);
        RawRasterGrid grid = new RawRasterGrid(header);
        assertEquals(DataType.FLOAT32, grid.getDataType());
        assertEquals(DataType.INT16, grid.getUnscaledDataType());
        assertEquals(-1.0, grid.getUnscaledNoDataValue());
        assertTrue(Double.isNaN(grid.getNoDataValue()));
        Block scaled = grid.readAll();
        assertEquals(10, scaled.get(0));
        assertEquals(10.5, scaled.get(1));
        assertTrue(scaled.isNoData(2));
        assertEquals(60, scaled.get(3));
        assertArrayEquals(new double[] {0, 1, -1, 100}, grid.readUnscaledBlock(new int[] {0, 0}, new int[] {1, 4}).values());
        ArrayGrid materialized = ArrayGrid.materialize(grid);
        assertEquals(scaled, materialized.readAll());
    }

    @Test
    void threeDimensionalGrid () throws IOException {
        String header = "{\"dataType\": \"uint8\", \"dimensions\": \"tyx\", \"shape\": [2, 2, 3], "
              + "\"cornerCoords\": [18000, 0.5, 0.5], \"cellSizes\": [1, 1, 1]}";
        byte[] values = new byte[12];
        for (int i = 0; i < 12; i++) values[i] = (byte) (i * 20);
        Files.write(dir.resolve("series.raw"), values);
        Files.writeString(dir.resolve("series.grid.json"), header);
        RawRasterGrid grid = new RawRasterGrid(dir.resolve("series.grid.json"));
        Block block = grid.readBlock(new int[] {0, 1, 1}, new int[] {2, 1, 2});
        // Flat index = t * 6 + y * 3 + x, stored value = index * 20 read as unsigned.
        assertArrayEquals(new double[] {80, 100, 200, 220}, block.values());
        assertArrayEquals(new double[] {120, 140, 160, 180, 200, 220},
              new GridSlice(grid, 't', 1).readAll().values());
    }

    @Test
    void missingDataFileIsBackendUnavailable () throws IOException {
        Path header = sample();
        Files.delete(dir.resolve("sample.raw"));
        RawRasterGrid grid = new RawRasterGrid(header);
        // Metadata comes from the header alone.
        assertEquals(DataType.INT16, grid.getDataType());
        BackendUnavailableException e = assertThrows(BackendUnavailableException.class,
              () -> grid.readBlock(new int[] {0, 0}, new int[] {1, 1}));
        assertInstanceOf(NoSuchFileException.class, e.getCause());
        assertEquals(DatasetException.ErrorType.BACKEND, e.errorType());
        assertTrue(e.resource().endsWith("sample.raw"));
        assertThrows(BackendUnavailableException.class, grid::fingerprint);
    }

    @Test
    void missingOrInvalidHeaderIsBackendUnavailable () throws IOException {
        RawRasterGrid missing = new RawRasterGrid(dir.resolve("nothing.grid.json"));
        assertThrows(BackendUnavailableException.class, missing::getExtent);
        Path header = writeInt16(dir, "bad", "{\"dataType\": \"int16\", \"dimensions\": \"xy\", \"shape\": [1, 1], "
              + "\"cornerCoords\": [0, 0], \"cellSizes\": [1, 1]}", ByteOrder.LITTLE_ENDIAN, (short) 1);
        assertThrows(BackendUnavailableException.class, () -> new RawRasterGrid(header).getExtent());
    }

    @Test
    void truncatedDataFileIsBackendUnavailable () throws IOException {
        Path header = writeInt16(dir, "short", header2d("int16", 2, 2, ""), ByteOrder.LITTLE_ENDIAN, (short) 1, (short) 2);
        BackendUnavailableException e = assertThrows(BackendUnavailableException.class,
              () -> new RawRasterGrid(header).readAll());
        assertInstanceOf(EOFException.class, e.getCause());
    }

    @Test
    void fingerprintChangesWhenTheFileChanges () throws IOException {
        Path header = sample();
        String before = new RawRasterGrid(header).fingerprint();
        assertEquals(before, new RawRasterGrid(header).fingerprint());
        Files.setLastModifiedTime(dir.resolve("sample.raw"), FileTime.fromMillis(1_000_000));
        assertNotEquals(before, new RawRasterGrid(header).fingerprint());
    }

    @Test
    void derivedTilesFollowRewrittenData () throws IOException {
        Path header = writeInt16(dir, "level", header2d("int16", 2, 2, ""), ByteOrder.LITTLE_ENDIAN,
              (short) 1, (short) 2, (short) 3, (short) 4);
        Path data = dir.resolve("level.raw");
        GridEngine engine = new GridEngine(Configuration.defaults());
        try (RawRasterGrid grid = new RawRasterGrid(header)) {
            DerivedGrid plusOne = engine.derive(Derivations.linear(DataType.FLOAT64, 1, 1), grid);
            assertArrayEquals(new double[] {2, 3, 4, 5}, plusOne.readAll().values());
            String before = grid.fingerprint();

            writeInt16(dir, "level", header2d("int16", 2, 2, ""), ByteOrder.LITTLE_ENDIAN,
                  (short) 50, (short) 60, (short) 70, (short) 80);
            Files.setLastModifiedTime(data, FileTime.fromMillis(Files.getLastModifiedTime(data).toMillis() + 60_000));

            assertNotEquals(before, grid.fingerprint());
            assertArrayEquals(new double[] {51, 61, 71, 81}, plusOne.readAll().values());
            assertArrayEquals(new double[] {51, 61, 71, 81},
                  engine.derive(Derivations.linear(DataType.FLOAT64, 1, 1), grid).readAll().values());
        }
    }

    @Test
    void byteOrderIsReadOnceWithTheHeader () throws IOException {
        Path header = sample();
        try (RawRasterGrid grid = new RawRasterGrid(header)) {
            Block first = grid.readAll();
            Files.writeString(header, header2d("int16", 3, 4, ", \"noDataValue\": -32768, \"byteOrder\": \"big\""));
            assertEquals(first, grid.readAll());
            assertArrayEquals(new double[] {60, 70}, grid.readBlock(new int[] {1, 2}, new int[] {1, 2}).values());
        }
    }
}

// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.adapter;

import io.pfive.datasets.grid.DataType;
import io.pfive.datasets.grid.GridMetadata;
import io.pfive.datasets.util.JsonUtil;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/// A grid stored as a headerless binary file of cells (name.raw) described by a JSON sidecar
/// (name.grid.json, see RawRasterHeader). Cells are stored in row-major order with x varying
/// fastest, row zero first, which is the same layout as a Block. Each read fetches one x row of
/// the window at a time through a positioned FileChannel read. The header is read once, with the
/// metadata, and its byte order is used for every later read.
public class RawRasterGrid extends AdapterGrid {

    public static final String HEADER_SUFFIX = ".grid.json";
    public static final String DATA_SUFFIX = ".raw";

    private final Path headerPath;
    // Set together with the metadata.
    private volatile ByteOrder byteOrder;

    /// @param headerPath the .grid.json file, the data file is found beside it
    public RawRasterGrid (Path headerPath) {
        super(baseName(headerPath), dataPathFor(headerPath));
        this.headerPath = headerPath;
    }

    public static boolean isHeader (Path path) {
        return path.getFileName().toString().endsWith(HEADER_SUFFIX);
    }

    static String baseName (Path headerPath) {
        String name = headerPath.getFileName().toString();
        return name.endsWith(HEADER_SUFFIX) ? name.substring(0, name.length() - HEADER_SUFFIX.length()) : name;
    }

    static Path dataPathFor (Path headerPath) {
        return headerPath.resolveSibling(baseName(headerPath) + DATA_SUFFIX);
    }

    private RawRasterHeader header () throws IOException {
        return JsonUtil.objectMapper.readValue(headerPath.toFile(), RawRasterHeader.class);
    }

    @Override
    protected GridMetadata readMetadata () throws IOException {
        try {
            RawRasterHeader header = header();
            GridMetadata metadata = header.toMetadata();
            byteOrder = header.nativeByteOrder();
            return metadata;
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IOException("Invalid raster header " + headerPath + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected Path[] auxiliaryPaths () {
        return new Path[] {headerPath};
    }

    @Override
    protected BackendHandle openHandle () throws IOException {
        // Make sure the header has been read.
        metadata();
        return new ChannelHandle(FileChannel.open(path, StandardOpenOption.READ), byteOrder);
    }

    @Override
    protected double[] readRaw (BackendHandle backendHandle, int[] origin, int[] shape) throws IOException {
        ChannelHandle handle = (ChannelHandle) backendHandle;
        DataType type = getUnscaledDataType();
        int[] gridShape = getExtent().shape();
        int n = shape.length;
        int cellBytes = type.bytes();
        long expectedSize = getExtent().nCells() * cellBytes;
        if (handle.channel.size() < expectedSize) {
            throw new EOFException(String.format("%s holds %d bytes but the header describes %d.",
                  path, handle.channel.size(), expectedSize));
        }
        int rowLength = shape[n - 1];
        ByteBuffer row = ByteBuffer.allocate(rowLength * cellBytes).order(handle.order);
        double[] values = new double[(int) countCells(shape)];
        int[] index = new int[n];
        int out = 0;
        while (true) {
            // Flat cell index in the file of the first cell of this row.
            long fileCell = 0;
            for (int axis = 0; axis < n; axis++) {
                fileCell = fileCell * gridShape[axis] + origin[axis] + (axis == n - 1 ? 0 : index[axis]);
            }
            row.clear();
            long position = fileCell * cellBytes;
            while (row.hasRemaining()) {
                int read = handle.channel.read(row, position + row.position());
                if (read < 0) throw new EOFException("Unexpected end of " + path);
            }
            row.flip();
            for (int i = 0; i < rowLength; i++) {
                values[out++] = decode(row, type);
            }
            int axis = n - 2;
            while (axis >= 0) {
                index[axis] += 1;
                if (index[axis] < shape[axis]) break;
                index[axis] = 0;
                axis -= 1;
            }
            if (axis < 0) return values;
        }
    }

    private static long countCells (int[] shape) {
        long count = 1;
        for (int s : shape) count *= s;
        return count;
    }

    private static double decode (ByteBuffer buffer, DataType type) {
        switch (type) {
            case INT8: return buffer.get();
            case UINT8: return Byte.toUnsignedInt(buffer.get());
            case INT16: return buffer.getShort();
            case UINT16: return Short.toUnsignedInt(buffer.getShort());
            case INT32: return buffer.getInt();
            case UINT32: return Integer.toUnsignedLong(buffer.getInt());
            case FLOAT32: return buffer.getFloat();
            case FLOAT64: return buffer.getDouble();
            default: throw new IllegalStateException("Unhandled data type " + type);
        }
    }

    private record ChannelHandle (FileChannel channel, ByteOrder order) implements BackendHandle {
        @Override
        public void close () throws IOException {
            channel.close();
        }
    }

}

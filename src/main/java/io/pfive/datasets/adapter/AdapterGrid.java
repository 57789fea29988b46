// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.adapter;

import com.google.common.util.concurrent.Striped;
import io.pfive.datasets.cache.CacheKey;
import io.pfive.datasets.exception.BackendUnavailableException;
import io.pfive.datasets.grid.AbstractGrid;
import io.pfive.datasets.grid.Block;
import io.pfive.datasets.grid.DataType;
import io.pfive.datasets.grid.GridMetadata;
import io.pfive.datasets.grid.Scaling;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.locks.Lock;

/// Base class for grids backed by files. Subclasses only describe how to read their format; this
/// class supplies the rest of the Grid contract in the same way for every format:
///
/// - Physical reads of the same resource are serialized. Many native readers are not safe for
///   concurrent use of one file, and the lock is cheap compared to the I/O. The lock is striped on
///   the resource's real path, so two grids opened through different links to one file share it.
/// - Each read opens its own BackendHandle and closes it before returning, on every exit path.
/// - IOExceptions become BackendUnavailableException with the original exception as the cause.
/// - Scaled blocks are derived from raw blocks, with NoData cells mapped to the scaled NoData value.
/// - The fingerprint is taken from the resource's real path, size and modification time, so it
///   changes when the file is rewritten.
public abstract class AdapterGrid extends AbstractGrid {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private static final Striped<Lock> RESOURCE_LOCKS = Striped.lock(64);

    protected final Path path;

    protected AdapterGrid (String displayName, Path path) {
        super(displayName);
        this.path = path;
    }

    public Path path () {
        return path;
    }

    /// Read the format's metadata. Called at most once on success.
    protected abstract GridMetadata readMetadata () throws IOException;

    /// Open the resource for one read.
    protected abstract BackendHandle openHandle () throws IOException;

    /// Read stored (unscaled) values for a window already checked against the extent, in
    /// row-major order with x varying fastest.
    protected abstract double[] readRaw (BackendHandle handle, int[] origin, int[] shape) throws IOException;

    /// Any additional files whose content the grid depends on, besides the main path.
    protected Path[] auxiliaryPaths () {
        return new Path[0];
    }

    @Override
    protected GridMetadata loadMetadata () {
        try {
            GridMetadata metadata = readMetadata();
            LOG.debug("Loaded metadata for {}: {}", displayName(), metadata.extent());
            return metadata;
        } catch (IOException e) {
            throw unavailable(path.toString(), e);
        }
    }

    @Override
    protected String computeFingerprint () {
        CacheKey.Builder key = CacheKey.builder("file").put("format", getClass().getSimpleName());
        FileIdentity.put(key, "path", path);
        Path[] auxiliary = auxiliaryPaths();
        for (int i = 0; i < auxiliary.length; i++) {
            FileIdentity.put(key, "auxiliary." + i, auxiliary[i]);
        }
        return key.build().fingerprint();
    }

    @Override
    protected Block readValidUnscaledBlock (int[] origin, int[] shape) {
        GridMetadata metadata = metadata();
        String resource = path.toString();
        double[] raw;
        Lock lock = RESOURCE_LOCKS.get(lockKey());
        lock.lock();
        try (BackendHandle handle = openHandle()) {
            raw = readRaw(handle, origin, shape);
        } catch (IOException e) {
            throw unavailable(resource, e);
        } finally {
            lock.unlock();
        }
        return Block.wrap(metadata.unscaledDataType(), metadata.unscaledNoDataValue(), origin, shape, raw);
    }

    @Override
    protected Block readValidBlock (int[] origin, int[] shape) {
        GridMetadata metadata = metadata();
        Block raw = readValidUnscaledBlock(origin, shape);
        if (!metadata.isScaled()) return raw;
        Scaling scaling = metadata.scaling();
        DataType type = metadata.dataType();
        Double noData = metadata.noDataValue();
        double scaledNoData = (noData != null) ? noData : Double.NaN;
        double[] values = new double[raw.nCells()];
        for (int i = 0; i < values.length; i++) {
            values[i] = raw.isNoData(i) ? scaledNoData : type.coerce(scaling.scale(raw.get(i)));
        }
        return Block.wrap(type, noData, origin, shape, values);
    }

    /// Lock on the real path where possible so that all aliases of a file share one lock.
    private String lockKey () {
        try {
            return path.toRealPath().toString();
        } catch (IOException e) {
            // The read itself will report the failure.
            return path.toAbsolutePath().normalize().toString();
        }
    }

    /// Map an I/O failure onto the exception taxonomy, keeping the original as the cause.
    public static BackendUnavailableException unavailable (String resource, IOException e) {
        String message;
        if (e instanceof NoSuchFileException) {
            message = "file not found";
        } else if (e instanceof AccessDeniedException) {
            message = "access denied";
        } else {
            message = String.valueOf(e.getMessage());
        }
        return new BackendUnavailableException(resource, message, e);
    }

}

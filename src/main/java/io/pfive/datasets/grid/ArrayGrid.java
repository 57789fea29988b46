// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.grid;

import com.google.common.base.Suppliers;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import io.pfive.datasets.cache.CacheKey;
import io.pfive.datasets.coords.Extent;
import io.pfive.datasets.util.MilliTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkArgument;

/// A grid whose values are held in memory, in the same row-major layout as a Block. Used for
/// small inputs, for tests, and as the result of explicitly materializing another grid (the only
/// place where the library reads an entire grid eagerly).
///
/// The fingerprint is a digest of the metadata and every value, so two ArrayGrids holding the same
/// data share cache entries, and a materialized copy of a grid does not share entries with the grid
/// it was copied from unless it carries the same content hash.
public class ArrayGrid extends AbstractGrid {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final GridMetadata metadata;
    private final double[] values;
    private final Supplier<String> fingerprint = Suppliers.memoize(this::hashContent);

    /// The values array is copied. Values must be representable in the data type (NaN is only
    /// allowed in floating point grids).
    public ArrayGrid (String displayName, GridMetadata metadata, double[] values) {
        super(displayName);
        checkArgument(!metadata.isScaled(), "In-memory grids hold scaled values only.");
        Extent extent = metadata.extent();
        checkArgument(values.length == extent.nCells(),
              "Expected %s values for extent shape, got %s.", extent.nCells(), values.length);
        DataType type = metadata.dataType();
        this.values = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            if (!type.canRepresent(v)) {
                throw new IllegalArgumentException(String.format("Value %s at index %d cannot be represented as %s.", v, i, type));
            }
            this.values[i] = type.coerce(v);
        }
        this.metadata = metadata;
    }

    /// Convenience factory for integer data.
    public static ArrayGrid ofInts (String displayName, GridMetadata metadata, int[] values) {
        double[] doubles = new double[values.length];
        for (int i = 0; i < values.length; i++) doubles[i] = values[i];
        return new ArrayGrid(displayName, metadata, doubles);
    }

    /// Read the whole source grid into memory. The result presents the source's scaled values.
    public static ArrayGrid materialize (Grid source) {
        MilliTimer timer = new MilliTimer();
        Block all = source.readAll();
        ArrayGrid result = new ArrayGrid(source.displayName(), source.metadata().scaledOnly(), all.values());
        LOG.info("Materialized {} ({} cells) in {}.", source.displayName(), all.nCells(), timer.getElapsedString());
        return result;
    }

    @Override
    protected GridMetadata loadMetadata () {
        return metadata;
    }

    @Override
    protected String computeFingerprint () {
        return fingerprint.get();
    }

    private String hashContent () {
        Hasher hasher = Hashing.sha256().newHasher();
        for (double v : values) hasher.putDouble(v);
        return CacheKey.builder("array")
              .put("metadata", metadata.canonical())
              .put("values", hasher.hash().toString())
              .build()
              .fingerprint();
    }

    @Override
    protected Block readValidBlock (int[] origin, int[] shape) {
        Block whole = Block.wrap(metadata.dataType(), metadata.noDataValue(),
              new int[origin.length], metadata.extent().shape(), values);
        Block result = Block.filled(metadata.dataType(), metadata.noDataValue(), origin, shape, 0);
        result.copyOverlapFrom(whole);
        return result;
    }

}

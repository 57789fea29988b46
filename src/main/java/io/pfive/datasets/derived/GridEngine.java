// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.derived;

import io.pfive.datasets.Configuration;
import io.pfive.datasets.cache.ResultCache;
import io.pfive.datasets.coords.Extent;
import io.pfive.datasets.coords.SpatialReference;
import io.pfive.datasets.exception.IncompatibleGridsException;
import io.pfive.datasets.grid.DataType;
import io.pfive.datasets.grid.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// Creates derived grids and holds what they share: the tile size and the cache of computed
/// tiles. All checks that can be made without reading cell values are made when a derived grid is
/// created, so an analysis combining mismatched inputs fails immediately rather than partway
/// through reading. This class is threadsafe.
///
/// Grids derived here cannot form a cycle: every input exists before the grid built over it, and a
/// derived grid's fingerprint includes the fingerprints of its inputs. Definitions that refer to
/// each other by name before any grid exists are checked for cycles by VirtualCollection.
public class GridEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final Configuration configuration;
    private final ResultCache cache;

    public GridEngine (Configuration configuration, ResultCache cache) {
        this.configuration = checkNotNull(configuration, "configuration");
        this.cache = checkNotNull(cache, "cache");
    }

    public GridEngine (Configuration configuration) {
        this(configuration, new ResultCache(configuration));
    }

    public GridEngine () {
        this(Configuration.load());
    }

    public int blockSize () {
        return configuration.blockSize;
    }

    public ResultCache cache () {
        return cache;
    }

    public DerivedGrid derive (Derivation derivation, Grid... inputs) {
        return derive(derivation, null, inputs);
    }

    /// @param outputNoData the NoData value of the result, or null to use the default: the first
    ///        input's NoData value if the output type can hold it, otherwise NaN for floating point
    ///        outputs and the minimum value of integer outputs
    public DerivedGrid derive (Derivation derivation, Double outputNoData, Grid... inputs) {
        checkNotNull(derivation, "derivation");
        checkNotNull(inputs, "inputs");
        if (inputs.length != derivation.arity()) {
            throw new IncompatibleGridsException(String.format("%s takes %d inputs but %d were supplied.",
                  derivation.identity(), derivation.arity(), inputs.length));
        }
        checkArgument(inputs.length > 0, "A derived grid needs at least one input.");
        Grid first = inputs[0];
        Extent extent = first.getExtent();
        SpatialReference srs = first.getSpatialReference();
        checkArgument(extent.nDims() >= 2, "Grids must have x and y axes.");
        for (int i = 1; i < inputs.length; i++) {
            Grid input = inputs[i];
            if (!extent.sameAs(input.getExtent())) {
                throw new IncompatibleGridsException(String.format("Input %d (%s) differs from input 0 (%s) in %s.",
                      i, input.displayName(), first.displayName(), extent.describeDifference(input.getExtent())));
            }
            if (!srs.isCompatibleWith(input.getSpatialReference(), configuration.srsTolerance)) {
                throw new IncompatibleGridsException(String.format(
                      "Input %d (%s) has spatial reference %s, incompatible with %s of input 0 (%s).",
                      i, input.displayName(), input.getSpatialReference(), srs, first.displayName()));
            }
        }
        DataType outputType = derivation.outputType();
        double noData;
        if (outputNoData == null) {
            noData = defaultOutputNoData(first.getNoDataValue(), outputType);
        } else {
            checkArgument(outputType.canRepresent(outputNoData),
                  "Output NoData value %s cannot be represented as %s.", outputNoData, outputType);
            noData = outputNoData;
        }
        DerivedGrid derived = new DerivedGrid(this, derivation, List.of(inputs), noData);
        LOG.debug("Created derived grid {} with fingerprint {}.", derived.displayName(), derived.fingerprint());
        return derived;
    }

    static double defaultOutputNoData (Double firstInputNoData, DataType outputType) {
        if (firstInputNoData != null && outputType.canRepresent(firstInputNoData)) return firstInputNoData;
        return outputType.floating ? Double.NaN : outputType.minValue;
    }

    @Override
    public String toString () {
        return String.format("GridEngine[blockSize=%d, %s]", blockSize(), cache);
    }
}

// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.derived;

import io.pfive.datasets.grid.Block;
import io.pfive.datasets.grid.DataType;

import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// Factories for derivations that compute each output cell from the input cells at the same
/// position. Lambdas have no stable identity, so every factory takes the identity string that
/// will be used in fingerprints.
public abstract class Derivations {

    /// Computes one output value from the input values at one cell.
    @FunctionalInterface
    public interface CellFunction {
        double apply (double[] values);
    }

    /// Like CellFunction, but also told which of the inputs are NoData at that cell.
    @FunctionalInterface
    public interface NoDataAwareCellFunction {
        double apply (double[] values, boolean[] noData);
    }

    public static Derivation cellwise (String identity, DataType outputType, int arity, CellFunction function) {
        checkNotNull(function, "function");
        return new CellwiseDerivation(identity, outputType, arity, false) {
            @Override
            protected double computeCell (double[] values, boolean[] noData) {
                return function.apply(values);
            }
        };
    }

    /// A cellwise derivation that receives NoData cells instead of having them masked.
    public static Derivation cellwiseWithNoData (String identity, DataType outputType, int arity,
                                                 NoDataAwareCellFunction function) {
        checkNotNull(function, "function");
        return new CellwiseDerivation(identity, outputType, arity, true) {
            @Override
            protected double computeCell (double[] values, boolean[] noData) {
                return function.apply(values, noData);
            }
        };
    }

    public static Derivation unary (String identity, DataType outputType, DoubleUnaryOperator operator) {
        return cellwise(identity, outputType, 1, values -> operator.applyAsDouble(values[0]));
    }

    public static Derivation binary (String identity, DataType outputType, DoubleBinaryOperator operator) {
        return cellwise(identity, outputType, 2, values -> operator.applyAsDouble(values[0], values[1]));
    }

    public static Derivation add (DataType outputType) {
        return binary("add", outputType, Double::sum);
    }

    public static Derivation subtract (DataType outputType) {
        return binary("subtract", outputType, (a, b) -> a - b);
    }

    public static Derivation multiply (DataType outputType) {
        return binary("multiply", outputType, (a, b) -> a * b);
    }

    /// Division by zero gives an infinite or NaN result, which becomes NoData in integer outputs.
    public static Derivation divide (DataType outputType) {
        return binary("divide", outputType, (a, b) -> a / b);
    }

    /// Multiply and add a constant, e.g. to convert units.
    public static Derivation linear (DataType outputType, double scale, double offset) {
        return unary(String.format("linear(%s,%s)", scale, offset), outputType, v -> v * scale + offset);
    }

    /// 1 where the input is strictly greater than the threshold, 0 elsewhere.
    public static Derivation greaterThan (double threshold) {
        return unary(String.format("greaterThan(%s)", threshold), DataType.UINT8, v -> v > threshold ? 1 : 0);
    }

    /// The first input where it has data, otherwise the second. Output is NoData only where both are.
    public static Derivation coalesce (DataType outputType) {
        return cellwiseWithNoData("coalesce", outputType, 2, (values, noData) -> {
            if (!noData[0]) return values[0];
            if (!noData[1]) return values[1];
            return Double.NaN;
        });
    }

    private abstract static class CellwiseDerivation implements Derivation {
        private final String identity;
        private final DataType outputType;
        private final int arity;
        private final boolean handlesNoData;

        CellwiseDerivation (String identity, DataType outputType, int arity, boolean handlesNoData) {
            checkNotNull(identity, "identity");
            checkArgument(!identity.isBlank(), "Derivation identity must not be blank.");
            checkNotNull(outputType, "outputType");
            checkArgument(arity > 0, "Derivations need at least one input.");
            this.identity = identity;
            this.outputType = outputType;
            this.arity = arity;
            this.handlesNoData = handlesNoData;
        }

        protected abstract double computeCell (double[] values, boolean[] noData);

        @Override
        public String identity () {
            return identity;
        }

        @Override
        public int arity () {
            return arity;
        }

        @Override
        public DataType outputType () {
            return outputType;
        }

        @Override
        public boolean handlesNoData () {
            return handlesNoData;
        }

        @Override
        public void compute (Block[] inputs, Block output) {
            double[] values = new double[arity];
            boolean[] noData = new boolean[arity];
            for (int i = 0; i < output.nCells(); i++) {
                for (int k = 0; k < arity; k++) {
                    values[k] = inputs[k].get(i);
                    noData[k] = inputs[k].isNoData(i);
                }
                output.set(i, computeCell(values, noData));
            }
        }

        @Override
        public String toString () {
            return identity;
        }
    }
}

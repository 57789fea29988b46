// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.grid;

import io.pfive.datasets.coords.Extent;
import io.pfive.datasets.coords.SpatialReference;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntToDoubleFunction;

/// Small in-memory grids for tests.
public abstract class GridFixtures {

    /// A 2D grid with unit cells whose lower left corner is at the origin.
    public static ArrayGrid grid2d (String name, DataType type, Double noData, int rows, int cols,
                                    IntToDoubleFunction valueForFlatIndex) {
        Extent extent = Extent.yx(rows, cols, 0, 0, 1);
        return grid(name, GridMetadata.of(type, extent, SpatialReference.WGS84, noData), valueForFlatIndex);
    }

    public static ArrayGrid grid (String name, GridMetadata metadata, IntToDoubleFunction valueForFlatIndex) {
        double[] values = new double[(int) metadata.extent().nCells()];
        for (int i = 0; i < values.length; i++) values[i] = valueForFlatIndex.applyAsDouble(i);
        return new ArrayGrid(name, metadata, values);
    }

    /// Wraps a grid and counts block reads, to check that something did or did not read.
    public static class CountingGrid implements Grid {
        private final Grid delegate;
        public final AtomicInteger reads = new AtomicInteger();

        public CountingGrid (Grid delegate) {
            this.delegate = delegate;
        }

        @Override
        public GridMetadata metadata () {
            return delegate.metadata();
        }

        @Override
        public Block readBlock (int[] origin, int[] shape) {
            reads.incrementAndGet();
            return delegate.readBlock(origin, shape);
        }

        @Override
        public String displayName () {
            return delegate.displayName();
        }

        @Override
        public String fingerprint () {
            return delegate.fingerprint();
        }
    }
}

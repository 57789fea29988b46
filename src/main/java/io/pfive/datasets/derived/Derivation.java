// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.derived;

import io.pfive.datasets.grid.Block;
import io.pfive.datasets.grid.DataType;

/// A function computing one grid from one or more input grids of identical extent, one tile at a
/// time. Implementations must be pure: the output for a tile may depend only on the input blocks
/// for that same tile, never on which tile it is or what was computed before. That is what makes
/// results independent of the tile size and of how reads are partitioned, and what allows tiles
/// to be cached.
///
/// Two derivations with the same identity string must compute the same thing, because the identity
/// is part of every cache key and fingerprint involving the derived grid. Include any parameters in
/// the identity (e.g. "threshold(0.5)").
public interface Derivation {

    String identity ();

    /// Number of input grids.
    int arity ();

    DataType outputType ();

    /// When false (the default) the engine writes output NoData wherever any input is NoData, and
    /// compute() need not look at NoData at all. When true, compute() sees NoData input cells as
    /// they are and decides for itself.
    default boolean handlesNoData () {
        return false;
    }

    /// Fill every cell of the output block. All blocks have the same origin and shape.
    void compute (Block[] inputs, Block output);

}

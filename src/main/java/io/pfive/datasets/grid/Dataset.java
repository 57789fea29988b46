// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.grid;

/// Anything that can be a member of a collection: a grid, a table, or another collection.
/// Datasets may hold backend resources, so they are AutoCloseable. Closing is idempotent and
/// never throws checked exceptions.
public interface Dataset extends AutoCloseable {

    /// Name to show to people in logs and messages. Not unique and not used for identity.
    String displayName ();

    /// A stable identity for the dataset's content: equal for two instances backed by the same
    /// unchanged data and computed the same way, even across JVM runs, and different when any input
    /// changes. Never derived from object identity.
    String fingerprint ();

    @Override
    default void close () { }

}

// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.grid;

import com.google.common.base.Suppliers;

import java.util.function.Supplier;

/// Base class handling the parts of the Grid contract that are the same for every implementation:
/// metadata is resolved lazily on first use and then retained, and every read window is checked
/// against the extent before the subclass sees it. Subclasses only supply metadata, a fingerprint,
/// and reads of windows already known to be valid.
///
/// Fingerprints are recomputed on every call so that they follow changes to the backend content.
/// Subclasses whose content cannot change may cache their own.
///
/// Memoization does not remember failures, so a grid whose backend was unavailable at first
/// access will try again to resolve its metadata on the next call.
public abstract class AbstractGrid implements Grid {

    private final String displayName;
    private final Supplier<GridMetadata> metadata = Suppliers.memoize(this::loadMetadata);

    protected AbstractGrid (String displayName) {
        this.displayName = displayName;
    }

    /// Resolve the metadata of this grid. Called at most once on success.
    protected abstract GridMetadata loadMetadata ();

    /// Compute the identity of this grid's content. Called by every fingerprint() call.
    protected abstract String computeFingerprint ();

    /// Read a window that has already been checked against the extent.
    protected abstract Block readValidBlock (int[] origin, int[] shape);

    /// Read an unscaled window that has already been checked. By default there is no scaling.
    protected Block readValidUnscaledBlock (int[] origin, int[] shape) {
        return readValidBlock(origin, shape);
    }

    @Override
    public final GridMetadata metadata () {
        return metadata.get();
    }

    @Override
    public final String fingerprint () {
        return computeFingerprint();
    }

    @Override
    public String displayName () {
        return displayName;
    }

    @Override
    public final Block readBlock (int[] origin, int[] shape) {
        getExtent().checkWindow(origin, shape);
        return readValidBlock(origin.clone(), shape.clone());
    }

    @Override
    public final Block readUnscaledBlock (int[] origin, int[] shape) {
        getExtent().checkWindow(origin, shape);
        return readValidUnscaledBlock(origin.clone(), shape.clone());
    }

    @Override
    public String toString () {
        return getClass().getSimpleName() + "[" + displayName + "]";
    }
}

// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.util;

/// Interface for classes that can estimate memory consumption of their instances.
/// Sizes are recursive, so should only be defined on acyclic object graphs.
/// The ResultCache uses this to weigh entries when it is bounded in bytes.
public interface ByteSize {

    /// Estimate the memory consumed by the instance in bytes.
    /// Implementations can use helper functions in [ByteSizeUtil].
    long byteSize ();

    /// Convenience wrapper method to return a human-readable string of the size in bytes.
    default String humanByteSize () {
        return ByteSizeUtil.human(byteSize());
    }

}

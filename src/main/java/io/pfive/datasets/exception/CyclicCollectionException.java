// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.exception;

import java.util.List;

/// Traversal of nested collections came back around to a collection that is already being
/// traversed, for example through a symbolic link pointing at one of its own parent directories.
public class CyclicCollectionException extends DatasetException {

    private final List<String> path;

    public CyclicCollectionException (List<String> path) {
        super("Collection cycle detected: " + String.join(" -> ", path));
        this.path = List.copyOf(path);
    }

    /// The chain of collection identities ending with the one that repeats.
    public List<String> path () {
        return path;
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.STRUCTURE;
    }

    @Override
    public boolean isPermanent () {
        return true;
    }
}

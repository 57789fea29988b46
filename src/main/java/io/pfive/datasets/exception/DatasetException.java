// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.exception;

/// Superclass for all exceptions representing problems accessing or combining datasets. These
/// are unchecked, like the rest of the library's failures: a caller reading a block in a tight
/// loop should not have to declare backend failures at every level, and the type of the exception
/// tells the caller whether changing the request can help. Subclasses that describe a structural
/// problem with the inputs themselves (not a transient condition of the storage) report
/// themselves as permanent, which the ResultCache uses to decide whether a failure may be retried.
public abstract class DatasetException extends RuntimeException {

    public DatasetException (String message) {
        super(message);
    }

    public DatasetException (String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorType errorType ();

    /// A permanent failure will fail again identically for the same inputs.
    public boolean isPermanent () {
        return false;
    }

    public enum ErrorType {
        /// The caller asked for something outside what the dataset offers. Correct the request.
        REQUEST,
        /// The storage behind the dataset could not be accessed.
        BACKEND,
        /// Datasets cannot be combined as requested.
        INCOMPATIBLE,
        /// A collection member could not be uniquely identified.
        LOOKUP,
        /// The structure of a collection or derivation graph is invalid.
        STRUCTURE
    }
}

// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.exception;

/// The resource behind a dataset is missing, unreadable, corrupt, or otherwise inaccessible.
/// The original backend exception is always retained as the cause. These are surfaced
/// immediately and never retried: a missing file or revoked permission does not heal itself.
public class BackendUnavailableException extends DatasetException {

    private final String resource;

    public BackendUnavailableException (String resource, String message, Throwable cause) {
        super(String.format("Backend unavailable for '%s': %s", resource, message), cause);
        this.resource = resource;
    }

    public BackendUnavailableException (String resource, String message) {
        this(resource, message, null);
    }

    /// Identifies the storage resource (usually a path) that could not be accessed.
    public String resource () {
        return resource;
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.BACKEND;
    }
}

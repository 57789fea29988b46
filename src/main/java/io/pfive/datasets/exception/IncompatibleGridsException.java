// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.exception;

/// Grids were combined that do not share an identical extent or a compatible spatial reference.
/// No implicit resampling is ever attempted, so retrying with the same inputs cannot succeed.
public class IncompatibleGridsException extends DatasetException {

    public IncompatibleGridsException (String message) {
        super("Incompatible grids: " + message);
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.INCOMPATIBLE;
    }

    @Override
    public boolean isPermanent () {
        return true;
    }
}

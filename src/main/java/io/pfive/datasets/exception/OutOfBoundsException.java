// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.exception;

import java.util.Arrays;

/// Throw this when a requested window does not fit inside the extent of a grid.
public class OutOfBoundsException extends DatasetException {

    public OutOfBoundsException (String message) {
        super("Out of bounds: " + message);
    }

    public OutOfBoundsException (int[] origin, int[] shape, int[] gridShape) {
        this(String.format("window at origin %s with shape %s does not fit in grid of shape %s",
              Arrays.toString(origin), Arrays.toString(shape), Arrays.toString(gridShape)));
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.REQUEST;
    }
}

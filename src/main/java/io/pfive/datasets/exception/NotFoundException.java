// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.exception;

public class NotFoundException extends DatasetException {

    public NotFoundException (String collection, String identifier) {
        super(String.format("No member '%s' in collection '%s'.", identifier, collection));
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.LOOKUP;
    }
}

// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.exception;

import java.util.List;

/// A filter or name matched more than one member, and the caller asked for exactly one.
public class AmbiguousIdentifierException extends DatasetException {

    private final List<String> matches;

    public AmbiguousIdentifierException (String collection, String filter, List<String> matches) {
        super(String.format("Filter %s matched %d members of collection '%s': %s",
              filter, matches.size(), collection, matches));
        this.matches = List.copyOf(matches);
    }

    public List<String> matches () {
        return matches;
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.LOOKUP;
    }
}

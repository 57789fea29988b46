// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.exception;

import java.util.List;

/// A derived grid would depend (directly or transitively) on itself.
public class CyclicDerivationException extends DatasetException {

    private final List<String> cycle;

    public CyclicDerivationException (List<String> cycle) {
        super("Derivation cycle detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle () {
        return cycle;
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

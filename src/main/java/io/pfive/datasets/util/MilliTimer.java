// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.util;

/// Measures wall-clock time for log messages about slow operations such as materialization or
/// directory scans.
public class MilliTimer {
    private final long startTime = System.currentTimeMillis();

    public long getElapsedMillis () {
        return System.currentTimeMillis() - startTime;
    }

    public String getElapsedString () {
        return String.format("%5.3f sec", getElapsedMillis() / 1000.0D);
    }
}

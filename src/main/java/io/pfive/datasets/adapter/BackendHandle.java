// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.adapter;

import java.io.IOException;

/// An open connection to the storage behind a dataset (a file channel, a database connection).
/// Handles are opened for one read and closed when it completes, always in a try-with-resources
/// block, so no handle outlives the operation that needed it.
public interface BackendHandle extends AutoCloseable {

    @Override
    void close () throws IOException;

}

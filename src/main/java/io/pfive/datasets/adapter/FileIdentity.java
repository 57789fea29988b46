// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.adapter;

import io.pfive.datasets.cache.CacheKey;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/// Fingerprint parameters for file-backed datasets: the real path, the size and the modification
/// time. These change whenever a file is replaced or rewritten, without reading its content.
public abstract class FileIdentity {

    public static void put (CacheKey.Builder key, String name, Path file) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            key.put(name, file.toRealPath().toString());
            key.put(name + ".size", attributes.size());
            key.put(name + ".modified", attributes.lastModifiedTime().toMillis());
        } catch (IOException e) {
            throw AdapterGrid.unavailable(file.toString(), e);
        }
    }

}

// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.cache;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CacheKeyTest {

    @Test
    void parameterOrderDoesNotMatter () {
        CacheKey a = CacheKey.builder("tile").put("grid", "derived:abc").put("origin", new int[] {0, 256}).build();
        CacheKey b = CacheKey.builder("tile").put("origin", new int[] {0, 256}).put("grid", "derived:abc").build();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(a.fingerprint(), b.fingerprint());
    }

    @Test
    void anyDifferenceChangesTheKey () {
        CacheKey base = CacheKey.builder("tile").put("x", 1).build();
        assertNotEquals(base, CacheKey.builder("tile").put("x", 2).build());
        assertNotEquals(base, CacheKey.builder("block").put("x", 1).build());
        assertNotEquals(base, CacheKey.builder("tile").put("y", 1).build());
        assertNotEquals(CacheKey.builder("k").put("v", 0.1).build(), CacheKey.builder("k").put("v", 0.1f).build());
    }

    @Test
    void fingerprintIsKindAndDigest () {
        CacheKey key = CacheKey.builder("array").put("values", "x").build();
        assertTrue(key.fingerprint().startsWith("array:"));
        assertEquals(64, key.digest().length());
        CacheKey nested = CacheKey.builder("derived").put("input.0", key).build();
        assertEquals(key.fingerprint(), nested.parameters().get("input.0"));
    }

    @Test
    void duplicateParametersAreRejected () {
        CacheKey.Builder builder = CacheKey.builder("k").put("a", 1);
        assertThrows(IllegalArgumentException.class, () -> builder.put("a", 2));
        assertThrows(IllegalArgumentException.class, () -> CacheKey.builder(" "));
    }
}

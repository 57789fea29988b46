// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// Canonical fingerprint of a computation or a backend resource, used both as a ResultCache key
/// and as the identity of datasets. A key is a kind tag plus named parameters, all reduced to
/// strings. Parameters are sorted by name, so the order in which they were added does not matter,
/// then written out as JSON and digested with SHA-256. The digest alone determines equality, so
/// two keys built from logically identical inputs are equal even when the inputs are different
/// object instances, and the digest is the same in every JVM run.
///
/// Anything positional (the order of inputs to a non-commutative function) must be encoded in
/// parameter names, e.g. "input.0", "input.1".
public final class CacheKey {

    // Writer configured once, ObjectMapper is threadsafe after configuration.
    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
          .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final String kind;
    private final ImmutableSortedMap<String, String> parameters;
    private final String digest;

    private CacheKey (String kind, SortedMap<String, String> parameters) {
        this.kind = kind;
        this.parameters = ImmutableSortedMap.copyOfSorted(parameters);
        this.digest = Hashing.sha256().hashString(canonicalJson(), StandardCharsets.UTF_8).toString();
    }

    public static Builder builder (String kind) {
        return new Builder(kind);
    }

    private String canonicalJson () {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("kind", kind);
        document.put("parameters", parameters);
        try {
            return CANONICAL_MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            // Maps of strings always serialize.
            throw new IllegalStateException("Could not serialize cache key.", e);
        }
    }

    public String kind () {
        return kind;
    }

    public Map<String, String> parameters () {
        return parameters;
    }

    /// Hex SHA-256 of the canonical form.
    public String digest () {
        return digest;
    }

    /// Kind and digest together, the form used as a dataset fingerprint.
    public String fingerprint () {
        return kind + ":" + digest;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        return o instanceof CacheKey other && digest.equals(other.digest);
    }

    @Override
    public int hashCode () {
        return digest.hashCode();
    }

    @Override
    public String toString () {
        return kind + ":" + digest.substring(0, 12) + parameters;
    }

    /// Collects parameters. Not threadsafe, build the key in a single thread.
    public static class Builder {
        private final String kind;
        private final SortedMap<String, String> parameters = new TreeMap<>();

        private Builder (String kind) {
            checkNotNull(kind, "kind");
            checkArgument(!kind.isBlank(), "Cache key kind must not be blank.");
            this.kind = kind;
        }

        public Builder put (String name, String value) {
            checkNotNull(name, "name");
            checkArgument(!parameters.containsKey(name), "Parameter '%s' was already set.", name);
            parameters.put(name, String.valueOf(value));
            return this;
        }

        public Builder put (String name, long value) {
            return put(name, Long.toString(value));
        }

        /// Doubles are written with Double.toString, which is exact and identical on every JVM.
        public Builder put (String name, double value) {
            return put(name, Double.toString(value));
        }

        public Builder put (String name, boolean value) {
            return put(name, Boolean.toString(value));
        }

        public Builder put (String name, int[] value) {
            return put(name, Arrays.toString(value));
        }

        /// Add another key's fingerprint as a parameter, for keys that depend on other keys.
        public Builder put (String name, CacheKey value) {
            return put(name, value.fingerprint());
        }

        public CacheKey build () {
            return new CacheKey(kind, parameters);
        }
    }
}

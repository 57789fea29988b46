// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.Properties;

/// Tuning options for grid evaluation and result caching. Values come from a datasets.properties
/// file on the classpath, and any key can be overridden by a JVM system property with the same name
/// prefixed by "datasets." (e.g. -Ddatasets.block-size=512). Unlike a server configuration this is
/// instantiable rather than global, so tests and independent analysis runs can each hold their own.
/// None of these options affect results, only memory use and speed.
public class Configuration {

    public static final String RESOURCE_NAME = "datasets.properties";
    public static final String SYSTEM_PROPERTY_PREFIX = "datasets.";

    public static final int DEFAULT_BLOCK_SIZE = 256;
    public static final double DEFAULT_SRS_TOLERANCE = 1e-9;

    private final Properties properties;

    /// Edge length in cells of the square x/y tiles used when evaluating derived grids.
    public final int blockSize;

    /// Relative tolerance used when comparing spatial reference parameters.
    public final double srsTolerance;

    // Cache bounds are optional. When none are set the cache is unbounded for the process lifetime.
    public final OptionalLong cacheMaximumEntries;
    public final OptionalLong cacheMaximumBytes;
    public final OptionalLong cacheExpireAfterWriteSeconds;

    private Configuration (Properties properties) {
        this.properties = properties;
        this.blockSize = intVal("block-size", DEFAULT_BLOCK_SIZE);
        this.srsTolerance = doubleVal("srs-tolerance", DEFAULT_SRS_TOLERANCE);
        this.cacheMaximumEntries = optionalLongVal("cache-maximum-entries");
        this.cacheMaximumBytes = optionalLongVal("cache-maximum-bytes");
        this.cacheExpireAfterWriteSeconds = optionalLongVal("cache-expire-after-write-seconds");
        if (blockSize < 1) {
            throw new IllegalStateException("Configuration key 'block-size' must be positive, was " + blockSize);
        }
        if (cacheMaximumEntries.isPresent() && cacheMaximumBytes.isPresent()) {
            throw new IllegalStateException(
                  "Configuration keys 'cache-maximum-entries' and 'cache-maximum-bytes' are mutually exclusive.");
        }
    }

    /// Load from the classpath resource (if any) with system property overrides applied.
    public static Configuration load () {
        Properties properties = new Properties();
        try (InputStream in = Configuration.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) properties.load(in);
        } catch (IOException e) {
            throw new RuntimeException("Could not read " + RESOURCE_NAME, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                properties.setProperty(name.substring(SYSTEM_PROPERTY_PREFIX.length()), System.getProperty(name));
            }
        }
        return new Configuration(properties);
    }

    public static Configuration fromProperties (Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new Configuration(copy);
    }

    /// All defaults, no cache bounds.
    public static Configuration defaults () {
        return new Configuration(new Properties());
    }

    public Duration cacheExpireAfterWrite () {
        return cacheExpireAfterWriteSeconds.isPresent() ?
              Duration.ofSeconds(cacheExpireAfterWriteSeconds.getAsLong()) : null;
    }

    private String stringVal (String key) {
        String val = properties.getProperty(key);
        if (val == null) return null;
        val = val.trim();
        return val.isEmpty() ? null : val;
    }

    private int intVal (String key, int defaultValue) {
        String val = stringVal(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as integer.", val, key);
            throw new IllegalStateException(message, e);
        }
    }

    private double doubleVal (String key, double defaultValue) {
        String val = stringVal(key);
        if (val == null) return defaultValue;
        try {
            return Double.parseDouble(val);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as a number.", val, key);
            throw new IllegalStateException(message, e);
        }
    }

    private OptionalLong optionalLongVal (String key) {
        String val = stringVal(key);
        if (val == null) return OptionalLong.empty();
        try {
            long parsed = Long.parseLong(val);
            if (parsed < 0) {
                throw new IllegalStateException(String.format("Configuration key '%s' must not be negative.", key));
            }
            return OptionalLong.of(parsed);
        } catch (NumberFormatException e) {
            var message = String.format("Cannot parse value '%s' for configuration key '%s' as integer.", val, key);
            throw new IllegalStateException(message, e);
        }
    }

}

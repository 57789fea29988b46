// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;

/// Shared Jackson configuration for the JSON sidecar files read by adapters. ObjectMapper is
/// threadsafe once configured, so one instance serves the whole library.
public abstract class JsonUtil {

    /// Unknown properties are ignored so that sidecar files written by newer tools remain readable.
    public static final ObjectMapper objectMapper = new ObjectMapper()
          .registerModule(new GuavaModule())
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

}

/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.fireflyframework.dispatch.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds single-line JSON documents for structured log output.
 * Values are rendered with their string form, so durations, instants and
 * enums appear the same way they do in the rest of the engine's logs.
 */
public final class JsonUtils {
    private static final Logger log = LoggerFactory.getLogger(JsonUtils.class);
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private JsonUtils() {
    }

    /**
     * Creates a JSON object from alternating keys and values.
     *
     * @param keyValuePairs key1, value1, key2, value2, ...
     * @return JSON text, or {@code "{}"} when serialization fails
     * @throws IllegalArgumentException if the number of arguments is odd
     */
    public static String json(Object... keyValuePairs) {
        if (keyValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("Key-value pairs must be provided in pairs (even number of arguments)");
        }

        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValuePairs.length; i += 2) {
            map.put(String.valueOf(keyValuePairs[i]), render(keyValuePairs[i + 1]));
        }

        try {
            return objectMapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            log.error("Failed to create JSON from key-value pairs", e);
            return "{}";
        }
    }

    /**
     * Shared mapper configured for java.time types. Callers must not reconfigure it.
     */
    public static ObjectMapper mapper() {
        return objectMapper;
    }

    private static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Throwable t) {
            return t.getClass().getName() + (t.getMessage() != null ? ": " + t.getMessage() : "");
        }
        return value.toString();
    }
}

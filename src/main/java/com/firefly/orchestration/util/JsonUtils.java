/*
 * Copyright 2025 Firefly Software Solutions Inc
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


package com.firefly.orchestration.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON helpers for structured, single-line log messages.
 * Every lifecycle log line of the engine is produced through {@link #json(String...)} so that
 * log shippers can parse them without a custom grammar.
 */
public final class JsonUtils {
    private static final Logger log = LoggerFactory.getLogger(JsonUtils.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_ERROR_LENGTH = 500;

    private JsonUtils() {
    }

    /**
     * Renders alternating keys and values as a flat JSON object, keeping argument order.
     * Null values are written as empty strings.
     *
     * @throws IllegalArgumentException when a key has no value
     */
    public static String json(String... fields) {
        if ((fields.length & 1) == 1) {
            throw new IllegalArgumentException("Expected key/value pairs but got " + fields.length + " arguments");
        }
        Map<String, String> object = new LinkedHashMap<>(fields.length);
        for (int k = 0; k + 1 < fields.length; k += 2) {
            object.put(fields[k], fields[k + 1] == null ? "" : fields[k + 1]);
        }
        return render(object);
    }

    /**
     * Renders an arbitrary value as a truncated preview, used for action inputs and results in logs.
     */
    public static String summarize(Object value, int max) {
        if (value == null) return "null";
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return truncate(value.toString(), max);
        }
        try {
            return truncate(MAPPER.writeValueAsString(value), max);
        } catch (JsonProcessingException e) {
            return truncate(String.valueOf(value), max);
        }
    }

    public static String truncate(String s, int max) {
        if (s == null) return "";
        int limit = Math.max(0, max);
        return s.length() > limit ? s.substring(0, limit) + "..." : s;
    }

    public static String errorMessage(Throwable error) {
        if (error == null) return "";
        String message = error.getMessage();
        return truncate(message != null ? message : error.getClass().getSimpleName(), MAX_ERROR_LENGTH);
    }

    private static String render(Map<String, String> object) {
        try {
            return MAPPER.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            log.error("Could not render log fields {}", object.keySet(), e);
            return "{}";
        }
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.agentruntime.common.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.File;
import java.io.IOException;
import java.util.Map;

/**
 * Shared Jackson mapper for events, requests and project descriptors.
 *
 * <p>{@link #toJson(Object)} is compact because each event becomes one SSE
 * {@code data:} line. Descriptor files written by {@link #toFile(File, Object)}
 * are indented.</p>
 */
public final class JsonUtil {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private JsonUtil() {}

    public static ObjectMapper mapper() { return MAPPER; }

    /** Single-line JSON, safe to put on an SSE {@code data:} line. */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot write " + value.getClass().getSimpleName() + " as JSON", e);
        }
    }

    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw malformed(e);
        }
    }

    public static <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw malformed(e);
        }
    }

    /**
     * Detached copy of a bean, made by writing it to a tree and reading it back
     * as the same runtime type. Read-only properties such as {@code object} are
     * skipped on the way back.
     */
    public static <T> T copy(T value) {
        try {
            return MAPPER.readerFor(value.getClass())
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(MAPPER.<JsonNode>valueToTree(value));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot copy " + value.getClass().getSimpleName(), e);
        }
    }

    public static <T> T fromFile(File file, Class<T> type) throws IOException {
        return MAPPER.readValue(file, type);
    }

    public static void toFile(File file, Object value) throws IOException {
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(file, value);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> toMap(Object value) {
        return MAPPER.convertValue(value, Map.class);
    }

    private static IllegalArgumentException malformed(JsonProcessingException e) {
        return new IllegalArgumentException("JSON deserialization failed: " + e.getOriginalMessage(), e);
    }
}

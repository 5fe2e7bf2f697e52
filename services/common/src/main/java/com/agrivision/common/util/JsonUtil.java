package com.agrivision.common.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Utility class for JSON handling shared by the AgriVision services.
 * Provides a pre-configured ObjectMapper and helpers for working with loosely typed
 * device payloads.
 */
public final class JsonUtil {

    private static final ObjectMapper OBJECT_MAPPER = createObjectMapper();

    private JsonUtil() {}

    /**
     * Returns the shared ObjectMapper instance.
     */
    public static ObjectMapper getObjectMapper() {
        return OBJECT_MAPPER;
    }

    /**
     * Creates a new configured ObjectMapper instance.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());

        // ISO-8601 strings instead of epoch numbers
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // Devices send extra keys (database_name, firmware info, ...)
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return mapper;
    }

    /**
     * True when a payload property was not sent at all or was sent as JSON null.
     */
    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    /**
     * Converts a JSON node into plain Java values (String, Number, Boolean, List, Map)
     * so it can be handed to a document store as-is. Absent nodes become {@code null}.
     */
    public static Object toPlainValue(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        return OBJECT_MAPPER.convertValue(node, Object.class);
    }
}

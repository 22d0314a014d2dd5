package com.riskgate.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static JSON helper for the small documents the gate shares with other processes: lease
 * payloads and the circuit breaker state file.
 *
 * <p>Failures surface as {@link IllegalStateException}; callers decide whether that fails open
 * or closed.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static {
        OBJECT_MAPPER.findAndRegisterModules();
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private JsonHelper() {}

    /** Serialize an object to compact JSON. Returns null if input is null. */
    public static String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize to JSON: {}", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    /** Serialize an object to indented JSON, for files operators read by hand. */
    public static String toPrettyJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize to JSON: {}", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    /**
     * Parse a JSON document into a tree. Blank input is rejected like malformed input, since an
     * empty shared state file is as untrustworthy as a corrupt one.
     */
    public static JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalStateException("JSON document is empty");
        }
        try {
            return OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("Failed to parse JSON document: {}", e.getOriginalMessage());
            throw new IllegalStateException("JSON deserialization failed", e);
        }
    }

    /** Exposes the shared mapper for building object nodes. */
    public static ObjectMapper mapper() {
        return OBJECT_MAPPER;
    }
}

package com.kpisentinel.service.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON helpers shared by the stores, the notification channels and the API.
 *
 * <p>
 * JSON documents (alert context, notification payloads, rule configuration,
 * audit payloads) are stored as text columns.
 * </p>
 */
public final class JsonSupport {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private JsonSupport() {
        // utility class
    }

    /**
     * @return the mapper used across the service: snake_case properties,
     *         ISO-8601 dates, lenient on unknown fields
     */
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public static String write(ObjectMapper mapper, Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize value to JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse a JSON object. {@code null} or blank text yields an empty map.
     *
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public static Map<String, Object> readObject(ObjectMapper mapper, String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> parsed = mapper.readValue(json, MAP_TYPE);
            return parsed != null ? parsed : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON object: " + e.getOriginalMessage(), e);
        }
    }
}

package com.hybridorm.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;

/**
 * Shared Jackson mapper and the encode/decode helpers built on it.
 */
public interface Json {
    ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /**
     * Serializes a value to JSON text.
     *
     * @throws IllegalArgumentException if Jackson cannot serialize the value
     */
    static String encode(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON serializable: " + e.getOriginalMessage(), e);
        }
    }

    static Map<String, Object> decodeMap(String text) throws JsonProcessingException {
        return MAPPER.readValue(text, MAP_TYPE);
    }

    static Object decode(String text) throws JsonProcessingException {
        return MAPPER.readValue(text, Object.class);
    }
}

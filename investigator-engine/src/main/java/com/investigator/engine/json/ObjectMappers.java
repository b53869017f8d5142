package com.investigator.engine.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Jackson configuration shared by audit serialization and model-response parsing.
 */
public final class ObjectMappers {
    
    private ObjectMappers() {
    }
    
    /**
     * Mapper with java.time support, ISO-8601 timestamps and lenient reading.
     */
    public static ObjectMapper standard() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
    
    /**
     * Parse a model response as JSON, tolerating a surrounding markdown code fence
     * and leading or trailing prose.
     * 
     * @throws JsonProcessingException when no JSON value can be read
     */
    public static JsonNode readModelJson(ObjectMapper mapper, String response) throws JsonProcessingException {
        if (response == null) {
            throw new IllegalArgumentException("response is null");
        }
        String text = response.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            int closingFence = text.lastIndexOf("```");
            if (firstNewline > 0 && closingFence > firstNewline) {
                text = text.substring(firstNewline + 1, closingFence).trim();
            }
        }
        int start = firstJsonStart(text);
        if (start > 0) {
            text = text.substring(start);
        }
        return mapper.readTree(text);
    }
    
    private static int firstJsonStart(String text) {
        int object = text.indexOf('{');
        int array = text.indexOf('[');
        if (object < 0) {
            return array;
        }
        if (array < 0) {
            return object;
        }
        return Math.min(object, array);
    }
}

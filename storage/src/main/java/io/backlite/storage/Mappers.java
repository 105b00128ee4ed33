// file: storage/src/main/java/io/backlite/storage/Mappers.java
package io.backlite.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.Map;

/**
 * Shared Jackson configuration.
 * <p>
 *  - java.time values are written as ISO-8601 strings, not epoch numbers.
 *  - Unknown properties are ignored so older builds can read newer files.
 * <p>
 * ObjectMapper is thread-safe once configured, so one instance is shared.
 */
public final class Mappers {
    /** A JSON object as a plain map (nested objects become maps, arrays become lists). */
    public static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private static final ObjectMapper JSON = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private Mappers() {
        // utility
    }

    public static ObjectMapper json() {
        return JSON;
    }

    /**
     * Normalize an arbitrary record into plain JSON types by a write-then-read pass.
     *
     * @throws IllegalArgumentException when the record holds values Jackson cannot serialize
     */
    public static Map<String, Object> normalize(Map<String, ?> record) {
        try {
            return JSON.readValue(JSON.writeValueAsBytes(record), RECORD_TYPE);
        } catch (IOException e) {
            throw new IllegalArgumentException("record is not representable as JSON: " + e.getMessage(), e);
        }
    }
}

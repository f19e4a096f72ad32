package com.keystone.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON codec for {@link AuditEntry}. Timestamps are written as ISO-8601 strings.
 */
public final class AuditEntryCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private AuditEntryCodec() {
        // utility class
    }

    /**
     * @throws AuditCodecException if the entry cannot be written
     */
    public static String encode(AuditEntry entry) {
        try {
            return MAPPER.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new AuditCodecException("Failed to encode audit entry " + entry.entryId(), e);
        }
    }

    /**
     * @throws AuditCodecException if the JSON is malformed or misses required fields
     */
    public static AuditEntry decode(String json) {
        try {
            return MAPPER.readValue(json, AuditEntry.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new AuditCodecException("Failed to decode audit entry", e);
        }
    }

    /** Thrown when an audit entry cannot be encoded or decoded. */
    public static class AuditCodecException extends RuntimeException {
        public AuditCodecException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

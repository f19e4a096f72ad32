package com.keystone.persistence;

/** Thrown when a create or update would break a uniqueness rule of a record type. */
public class DuplicateRecordException extends RuntimeException {

    private final String recordType;
    private final String field;

    public DuplicateRecordException(String recordType, String field, Object value) {
        super("%s with %s '%s' already exists".formatted(recordType, field, value));
        this.recordType = recordType;
        this.field = field;
    }

    public String recordType() {
        return recordType;
    }

    public String field() {
        return field;
    }
}

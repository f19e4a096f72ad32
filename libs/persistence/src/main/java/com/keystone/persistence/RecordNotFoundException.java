package com.keystone.persistence;

/** Thrown when an update targets a record that does not exist in the caller's scope. */
public class RecordNotFoundException extends RuntimeException {

    private final String recordType;
    private final String recordId;

    public RecordNotFoundException(String recordType, String recordId) {
        super("%s %s not found".formatted(recordType, recordId));
        this.recordType = recordType;
        this.recordId = recordId;
    }

    public String recordType() {
        return recordType;
    }

    public String recordId() {
        return recordId;
    }
}

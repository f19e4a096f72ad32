package com.keystone.persistence;

/** Thrown when an update names a version that is no longer current. */
public class OptimisticConflictException extends RuntimeException {

    private final String recordType;
    private final String recordId;
    private final long expectedVersion;
    private final long actualVersion;

    public OptimisticConflictException(String recordType, String recordId, long expectedVersion, long actualVersion) {
        super("%s %s was modified concurrently: expected version %d, found %d"
                .formatted(recordType, recordId, expectedVersion, actualVersion));
        this.recordType = recordType;
        this.recordId = recordId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String recordType() {
        return recordType;
    }

    public String recordId() {
        return recordId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }
}

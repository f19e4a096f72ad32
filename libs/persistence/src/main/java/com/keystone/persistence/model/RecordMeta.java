package com.keystone.persistence.model;

import java.time.Instant;

/**
 * Lifecycle fields shared by every stored record.
 *
 * @param id        opaque random id, null until the record is first stored
 * @param version   optimistic-concurrency counter; 0 before the first store, then 1, incremented
 *                  on every update
 * @param createdAt when the record was first stored
 * @param updatedAt when the record was last changed
 * @param deletedAt soft-delete marker, null while the record is live
 */
public record RecordMeta(String id, long version, Instant createdAt, Instant updatedAt, Instant deletedAt) {

    private static final RecordMeta UNSAVED = new RecordMeta(null, 0, null, null, null);

    public RecordMeta {
        if (version < 0) {
            throw new IllegalArgumentException("version must not be negative");
        }
    }

    /** Meta of a record that has not been stored yet. */
    public static RecordMeta unsaved() {
        return UNSAVED;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean isSaved() {
        return id != null;
    }

    public RecordMeta created(String newId, Instant now) {
        return new RecordMeta(newId, 1, now, now, null);
    }

    public RecordMeta updated(Instant now) {
        return new RecordMeta(id, version + 1, createdAt, now, deletedAt);
    }

    public RecordMeta deleted(Instant now) {
        return new RecordMeta(id, version + 1, createdAt, now, now);
    }
}

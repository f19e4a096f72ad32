package com.keystone.persistence.model;

/**
 * A record kept in the {@link com.keystone.persistence.RecordStore}. Records are immutable; every
 * change produces a new instance.
 *
 * @param <T> the concrete record type
 */
public interface StoredRecord<T extends StoredRecord<T>> {

    RecordMeta meta();

    /** Returns a copy of this record with the given lifecycle fields. */
    T withMeta(RecordMeta meta);

    default String id() {
        return meta().id();
    }

    default long version() {
        return meta().version();
    }

    default boolean isDeleted() {
        return meta().isDeleted();
    }
}

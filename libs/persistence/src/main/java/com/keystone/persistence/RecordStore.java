package com.keystone.persistence;

import com.keystone.persistence.model.StoredRecord;
import java.util.List;
import java.util.Optional;

/**
 * Raw, tenant-unaware storage of records.
 *
 * <p>Application code never holds a store directly: it is handed to a {@link TenantScopedGateway},
 * which applies tenant scoping and soft-delete rules before calling it.
 *
 * <p>Implementations throw {@link RecordStoreException} when storage is unreachable.
 */
public interface RecordStore {

    /**
     * Stores a new record unless a stored record matches one of the constraints. The check and the
     * insert are one atomic step, so two concurrent inserts cannot both pass the same constraint.
     *
     * @throws DuplicateRecordException if a stored record matches a constraint
     * @throws IllegalStateException if a record with the same id already exists
     */
    <T extends StoredRecord<T>> T insert(Class<T> type, T record, List<UniqueConstraint<T>> constraints);

    <T extends StoredRecord<T>> Optional<T> findById(Class<T> type, String id);

    <T extends StoredRecord<T>> List<T> find(Class<T> type, Criteria<T> criteria);

    <T extends StoredRecord<T>> long count(Class<T> type, Criteria<T> criteria);

    /**
     * Replaces the stored record with the same id, atomically checking its version.
     *
     * @throws OptimisticConflictException if the stored version differs from {@code expectedVersion}
     * @throws RecordNotFoundException if no record has that id
     */
    <T extends StoredRecord<T>> T replace(Class<T> type, T record, long expectedVersion);

    /** Physically removes a record. Returns whether one was removed. */
    <T extends StoredRecord<T>> boolean remove(Class<T> type, String id);

    /**
     * A uniqueness rule for one insert: the insert fails when any stored record matches
     * {@code conflicts}.
     *
     * @param field     name of the unique field, reported in the {@link DuplicateRecordException}
     * @param value     the value being inserted
     * @param conflicts the records that would collide with it
     */
    record UniqueConstraint<T extends StoredRecord<T>>(String field, Object value, Criteria<T> conflicts) {
        public UniqueConstraint {
            if (field == null || conflicts == null) {
                throw new IllegalArgumentException("field and conflicts must not be null");
            }
        }
    }
}

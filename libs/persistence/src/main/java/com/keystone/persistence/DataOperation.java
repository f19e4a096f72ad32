package com.keystone.persistence;

import com.keystone.persistence.model.StoredRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;
import java.util.function.UnaryOperator;

/**
 * A tenant-unaware persistence operation, executed by {@link TenantScopedGateway#execute}. The
 * gateway adds tenant scoping and soft-delete handling; callers describe only what they want.
 *
 * @param <T> the record type
 * @param <R> the result type
 */
public sealed interface DataOperation<T extends StoredRecord<T>, R>
        permits DataOperation.Create, DataOperation.FindById, DataOperation.FindMany,
        DataOperation.Count, DataOperation.Aggregate, DataOperation.Update, DataOperation.Delete {

    Class<T> type();

    /** Short name used in logs and metrics. */
    String name();

    static <T extends StoredRecord<T>> Create<T> create(Class<T> type, T payload) {
        return new Create<>(type, payload, List.of());
    }

    static <T extends StoredRecord<T>> FindById<T> findById(Class<T> type, String id) {
        return new FindById<>(type, id, false);
    }

    static <T extends StoredRecord<T>> FindMany<T> findMany(Class<T> type, Criteria<T> criteria) {
        return new FindMany<>(type, criteria, false);
    }

    static <T extends StoredRecord<T>> Count<T> count(Class<T> type, Criteria<T> criteria) {
        return new Count<>(type, criteria, false);
    }

    static <T extends StoredRecord<T>> Aggregate<T> aggregate(
            Class<T> type, Criteria<T> criteria, AggregateFunction function, ToDoubleFunction<T> field) {
        return new Aggregate<>(type, criteria, function, field, false);
    }

    static <T extends StoredRecord<T>> Update<T> update(
            Class<T> type, String id, long expectedVersion, UnaryOperator<T> change) {
        return new Update<>(type, id, expectedVersion, change);
    }

    static <T extends StoredRecord<T>> Delete<T> delete(Class<T> type, String id) {
        return new Delete<>(type, id);
    }

    /**
     * Inserts a new record. Each unique key is checked against the records of the same tenant in the
     * same atomic step as the insert.
     */
    record Create<T extends StoredRecord<T>>(Class<T> type, T payload, List<UniqueKey<T>> uniqueKeys)
            implements DataOperation<T, T> {
        public Create {
            requireType(type);
            if (payload == null) {
                throw new IllegalArgumentException("payload must not be null");
            }
            uniqueKeys = uniqueKeys == null ? List.of() : List.copyOf(uniqueKeys);
        }

        /** Rejects the insert if a live record already has the same {@code field} value. */
        public Create<T> unique(String field, Function<? super T, ?> accessor) {
            return withKey(new UniqueKey<>(field, accessor, false));
        }

        /** Like {@link #unique}, but soft-deleted records keep their value reserved. */
        public Create<T> uniqueIncludingDeleted(String field, Function<? super T, ?> accessor) {
            return withKey(new UniqueKey<>(field, accessor, true));
        }

        private Create<T> withKey(UniqueKey<T> key) {
            List<UniqueKey<T>> keys = new ArrayList<>(uniqueKeys);
            keys.add(key);
            return new Create<>(type, payload, keys);
        }

        @Override
        public String name() {
            return "create";
        }
    }

    /** Loads one record by id. */
    record FindById<T extends StoredRecord<T>>(Class<T> type, String id, boolean deletedIncluded)
            implements DataOperation<T, Optional<T>> {
        public FindById {
            requireType(type);
            requireId(id);
        }

        public FindById<T> includeDeleted() {
            return new FindById<>(type, id, true);
        }

        @Override
        public String name() {
            return "findById";
        }
    }

    /** Loads every record matching the criteria. */
    record FindMany<T extends StoredRecord<T>>(Class<T> type, Criteria<T> criteria, boolean deletedIncluded)
            implements DataOperation<T, List<T>> {
        public FindMany {
            requireType(type);
            criteria = criteria == null ? Criteria.all() : criteria;
        }

        public FindMany<T> includeDeleted() {
            return new FindMany<>(type, criteria, true);
        }

        @Override
        public String name() {
            return "findMany";
        }
    }

    /** Counts records matching the criteria. */
    record Count<T extends StoredRecord<T>>(Class<T> type, Criteria<T> criteria, boolean deletedIncluded)
            implements DataOperation<T, Long> {
        public Count {
            requireType(type);
            criteria = criteria == null ? Criteria.all() : criteria;
        }

        public Count<T> includeDeleted() {
            return new Count<>(type, criteria, true);
        }

        @Override
        public String name() {
            return "count";
        }
    }

    /** Aggregates a numeric field over records matching the criteria; empty when none match. */
    record Aggregate<T extends StoredRecord<T>>(
            Class<T> type,
            Criteria<T> criteria,
            AggregateFunction function,
            ToDoubleFunction<T> field,
            boolean deletedIncluded) implements DataOperation<T, OptionalDouble> {
        public Aggregate {
            requireType(type);
            criteria = criteria == null ? Criteria.all() : criteria;
            if (function == null || field == null) {
                throw new IllegalArgumentException("function and field must not be null");
            }
        }

        public Aggregate<T> includeDeleted() {
            return new Aggregate<>(type, criteria, function, field, true);
        }

        @Override
        public String name() {
            return "aggregate";
        }
    }

    /**
     * Applies {@code change} to the live record with the given id, provided its version still equals
     * {@code expectedVersion}. The change may not alter id, tenant or lifecycle fields.
     */
    record Update<T extends StoredRecord<T>>(Class<T> type, String id, long expectedVersion, UnaryOperator<T> change)
            implements DataOperation<T, T> {
        public Update {
            requireType(type);
            requireId(id);
            if (change == null) {
                throw new IllegalArgumentException("change must not be null");
            }
        }

        @Override
        public String name() {
            return "update";
        }
    }

    /** Deletes the live record with the given id; result tells whether one was deleted. */
    record Delete<T extends StoredRecord<T>>(Class<T> type, String id) implements DataOperation<T, Boolean> {
        public Delete {
            requireType(type);
            requireId(id);
        }

        @Override
        public String name() {
            return "delete";
        }
    }

    /**
     * A field whose value must not repeat among the records of one tenant, or among all records for
     * types that are not tenant-scoped.
     */
    record UniqueKey<T>(String field, Function<? super T, ?> accessor, boolean deletedIncluded) {
        public UniqueKey {
            if (field == null || field.isBlank() || accessor == null) {
                throw new IllegalArgumentException("field and accessor must be given");
            }
        }
    }

    private static void requireType(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
    }
}

package com.keystone.persistence;

import com.keystone.persistence.model.StoredRecord;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RecordStore} backed by concurrent maps. Records are immutable, so reads hand out the
 * stored instances. Results of {@link #find} are ordered by creation time.
 *
 * <p>Writes to one record type hold that type's table lock, so a uniqueness check and the insert it
 * guards cannot interleave with another write.
 */
public class InMemoryRecordStore implements RecordStore {

    private final Map<Class<?>, ConcurrentHashMap<String, StoredRecord<?>>> tables = new ConcurrentHashMap<>();

    @Override
    public <T extends StoredRecord<T>> T insert(Class<T> type, T record, List<UniqueConstraint<T>> constraints) {
        if (!record.meta().isSaved()) {
            throw new IllegalArgumentException("record must have an id before it is stored");
        }
        ConcurrentHashMap<String, StoredRecord<?>> table = table(type);
        synchronized (table) {
            for (UniqueConstraint<T> constraint : constraints) {
                if (anyMatch(table, type, constraint.conflicts())) {
                    throw new DuplicateRecordException(type.getSimpleName(), constraint.field(), constraint.value());
                }
            }
            StoredRecord<?> existing = table.putIfAbsent(record.id(), record);
            if (existing != null) {
                throw new IllegalStateException("%s %s already exists".formatted(type.getSimpleName(), record.id()));
            }
        }
        return record;
    }

    @Override
    public <T extends StoredRecord<T>> Optional<T> findById(Class<T> type, String id) {
        return Optional.ofNullable(table(type).get(id)).map(type::cast);
    }

    @Override
    public <T extends StoredRecord<T>> List<T> find(Class<T> type, Criteria<T> criteria) {
        return table(type).values().stream()
                .map(type::cast)
                .filter(criteria::matches)
                .sorted(Comparator.comparing((T r) -> r.meta().createdAt()).thenComparing((T r) -> r.id()))
                .toList();
    }

    @Override
    public <T extends StoredRecord<T>> long count(Class<T> type, Criteria<T> criteria) {
        return table(type).values().stream()
                .map(type::cast)
                .filter(criteria::matches)
                .count();
    }

    @Override
    public <T extends StoredRecord<T>> T replace(Class<T> type, T record, long expectedVersion) {
        String name = type.getSimpleName();
        ConcurrentHashMap<String, StoredRecord<?>> table = table(type);
        synchronized (table) {
            table.compute(record.id(), (id, current) -> {
                if (current == null) {
                    throw new RecordNotFoundException(name, id);
                }
                if (current.meta().version() != expectedVersion) {
                    throw new OptimisticConflictException(name, id, expectedVersion, current.meta().version());
                }
                return record;
            });
        }
        return record;
    }

    @Override
    public <T extends StoredRecord<T>> boolean remove(Class<T> type, String id) {
        ConcurrentHashMap<String, StoredRecord<?>> table = table(type);
        synchronized (table) {
            return table.remove(id) != null;
        }
    }

    private static <T extends StoredRecord<T>> boolean anyMatch(
            Map<String, StoredRecord<?>> table, Class<T> type, Criteria<T> criteria) {
        return table.values().stream().map(type::cast).anyMatch(criteria::matches);
    }

    private ConcurrentHashMap<String, StoredRecord<?>> table(Class<?> type) {
        return tables.computeIfAbsent(type, t -> new ConcurrentHashMap<>());
    }
}

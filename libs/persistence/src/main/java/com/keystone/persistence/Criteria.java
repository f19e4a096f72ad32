package com.keystone.persistence;

import com.keystone.persistence.model.StoredRecord;
import com.keystone.persistence.model.TenantScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Conjunction of named field conditions over records of type {@code T}.
 *
 * <p>Conditions are named so that stores can translate them and so that the conditions the gateway
 * adds are visible in logs and tests.
 *
 * @param <T> the record type
 */
public final class Criteria<T extends StoredRecord<T>> {

    /** Field name of the tenant condition added by the gateway. */
    public static final String TENANT_FIELD = "tenantId";

    /** Field name of the soft-delete condition added by the gateway. */
    public static final String DELETED_AT_FIELD = "deletedAt";

    private final List<Condition<T>> conditions;

    private Criteria(List<Condition<T>> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    /** Criteria matching every record. */
    public static <T extends StoredRecord<T>> Criteria<T> all() {
        return new Criteria<>(List.of());
    }

    /** Criteria matching records whose {@code field} equals {@code value}. */
    public static <T extends StoredRecord<T>> Criteria<T> where(
            String field, Function<? super T, ?> accessor, Object value) {
        return Criteria.<T>all().and(field, accessor, value);
    }

    /** Adds the condition {@code field == value}. */
    public Criteria<T> and(String field, Function<? super T, ?> accessor, Object value) {
        List<Condition<T>> next = new ArrayList<>(conditions);
        next.add(new Condition<>(field, accessor, value));
        return new Criteria<>(next);
    }

    Criteria<T> andTenant(String tenantId) {
        return and(TENANT_FIELD, record -> ((TenantScoped<?>) record).tenantId(), tenantId);
    }

    Criteria<T> andNotDeleted() {
        return and(DELETED_AT_FIELD, record -> record.meta().deletedAt(), null);
    }

    public boolean matches(T record) {
        for (Condition<T> condition : conditions) {
            if (!condition.matches(record)) {
                return false;
            }
        }
        return true;
    }

    public List<Condition<T>> conditions() {
        return conditions;
    }

    /** Names of the constrained fields, in order. */
    public List<String> fields() {
        return conditions.stream().map(Condition::field).toList();
    }

    @Override
    public String toString() {
        return conditions.stream()
                .map(c -> c.field() + "=" + c.value())
                .collect(Collectors.joining(" AND ", "Criteria[", "]"));
    }

    /**
     * One equality condition. A null {@code value} matches a null field.
     */
    public record Condition<T>(String field, Function<? super T, ?> accessor, Object value) {

        public Condition {
            if (field == null || field.isBlank()) {
                throw new IllegalArgumentException("field must not be null or blank");
            }
            Objects.requireNonNull(accessor, "accessor");
        }

        public boolean matches(T record) {
            return Objects.equals(accessor.apply(record), value);
        }
    }
}

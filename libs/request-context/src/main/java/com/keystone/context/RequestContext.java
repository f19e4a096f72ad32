package com.keystone.context;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the values carried by one request.
 *
 * <p>Every write produces a new snapshot, so a snapshot handed to another thread can never be
 * changed underneath it. {@link RequestContextHolder} keeps the current snapshot per thread.
 */
public final class RequestContext {

    private static final RequestContext EMPTY = new RequestContext(new IdentityHashMap<>());

    private final Map<ContextKey<?>, Object> values;

    private RequestContext(Map<ContextKey<?>, Object> values) {
        this.values = values;
    }

    /** Returns a snapshot with no values. */
    public static RequestContext empty() {
        return EMPTY;
    }

    /**
     * Returns the value stored under {@code key}, or empty when absent. An absent value is never
     * replaced by a default.
     */
    public <T> Optional<T> get(ContextKey<T> key) {
        return Optional.ofNullable(key.cast(values.get(key)));
    }

    public boolean contains(ContextKey<?> key) {
        return values.containsKey(key);
    }

    /**
     * Returns a copy of this snapshot with {@code key} bound to {@code value}. A {@code null} value
     * removes the key.
     */
    public <T> RequestContext with(ContextKey<T> key, T value) {
        if (value == null) {
            return without(key);
        }
        if (!key.type().isInstance(value)) {
            throw new IllegalArgumentException(
                    "value of type %s does not match %s".formatted(value.getClass().getName(), key));
        }
        var copy = new IdentityHashMap<ContextKey<?>, Object>(values);
        copy.put(key, value);
        return new RequestContext(copy);
    }

    /** Returns a copy of this snapshot without {@code key}. */
    public RequestContext without(ContextKey<?> key) {
        if (!values.containsKey(key)) {
            return this;
        }
        var copy = new IdentityHashMap<ContextKey<?>, Object>(values);
        copy.remove(key);
        return new RequestContext(copy);
    }

    /** Number of bound keys. */
    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("RequestContext{");
        values.forEach((k, v) -> sb.append(k.name()).append('=').append(v).append(", "));
        if (!values.isEmpty()) {
            sb.setLength(sb.length() - 2);
        }
        return sb.append('}').toString();
    }
}

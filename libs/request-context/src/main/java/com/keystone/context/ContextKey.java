package com.keystone.context;

import java.util.Objects;

/**
 * Typed key for a value stored in a {@link RequestContext}.
 *
 * <p>Keys compare by identity: two keys with the same name are different keys. Declare them once
 * as constants (see {@link #REQUEST_ID}, {@link #TENANT_ID}, {@link #ACTOR_ID}) and share the
 * constant.
 *
 * @param <T> the type of the value stored under this key
 */
public final class ContextKey<T> {

    /** Opaque request identifier, generated (or propagated) when the context begins. */
    public static final ContextKey<String> REQUEST_ID = of("requestId", String.class);

    /** Resolved tenant identifier. Absent until the tenant resolver finds one. */
    public static final ContextKey<String> TENANT_ID = of("tenantId", String.class);

    /** Identifier of the authenticated caller. Absent for anonymous requests. */
    public static final ContextKey<String> ACTOR_ID = of("actorId", String.class);

    private final String name;
    private final Class<T> type;

    private ContextKey(String name, Class<T> type) {
        this.name = name;
        this.type = type;
    }

    /**
     * Creates a new key.
     *
     * @param name human-readable name, used in diagnostics only
     * @param type the value type; values are checked against it on write
     */
    public static <T> ContextKey<T> of(String name, Class<T> type) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        return new ContextKey<>(name, Objects.requireNonNull(type, "type"));
    }

    public String name() {
        return name;
    }

    public Class<T> type() {
        return type;
    }

    T cast(Object value) {
        return type.cast(value);
    }

    @Override
    public String toString() {
        return "ContextKey[" + name + "]";
    }
}

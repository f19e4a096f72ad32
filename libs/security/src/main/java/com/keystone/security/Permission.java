package com.keystone.security;

import java.util.Collection;
import java.util.List;

/**
 * A fine-grained permission: an action on a resource, written {@code resource:action}.
 *
 * <p>A grant whose action is {@value #MANAGE} covers every action on its resource.
 */
public record Permission(String resource, String action) {

    public static final String MANAGE = "manage";

    /** Resources known to the platform. */
    public static final List<String> RESOURCES =
            List.of("users", "roles", "tenants", "audit_logs", "api_keys", "subscriptions");

    /** Actions known to the platform. */
    public static final List<String> ACTIONS = List.of("create", "read", "update", "delete", MANAGE);

    public Permission {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource must not be null or blank");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action must not be null or blank");
        }
        resource = resource.strip();
        action = action.strip();
    }

    public static Permission of(String resource, String action) {
        return new Permission(resource, action);
    }

    /**
     * Parses {@code resource:action}.
     *
     * @throws IllegalArgumentException if the value is not of that form
     */
    public static Permission parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("permission must not be null");
        }
        int colon = value.indexOf(':');
        if (colon <= 0 || colon == value.length() - 1 || value.indexOf(':', colon + 1) >= 0) {
            throw new IllegalArgumentException(
                    "permission must have the form resource:action, got '%s'".formatted(value));
        }
        return new Permission(value.substring(0, colon), value.substring(colon + 1));
    }

    /** Whether holding this permission satisfies {@code required}. */
    public boolean covers(Permission required) {
        return resource.equals(required.resource)
                && (action.equals(required.action) || MANAGE.equals(action));
    }

    /** Whether any of {@code granted} covers {@code required}. */
    public static boolean anyCovers(Collection<Permission> granted, Permission required) {
        for (Permission permission : granted) {
            if (permission.covers(required)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return resource + ":" + action;
    }
}

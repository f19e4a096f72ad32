package com.keystone.security;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Roles defined by the platform. They are immutable and mean the same thing in every tenant;
 * tenants may define further roles of their own.
 */
public enum SystemRole {

    SUPER_ADMIN("super_admin"),
    ADMIN("admin"),
    USER("user"),
    GUEST("guest");

    private final String value;
    private final Set<Permission> grants;

    SystemRole(String value) {
        this.value = value;
        this.grants = Collections.unmodifiableSet(computeGrants(value));
    }

    /** The role name as it appears in credentials (e.g. "super_admin"). */
    public String value() {
        return value;
    }

    /** Permissions granted by this role. */
    public Set<Permission> grants() {
        return grants;
    }

    public static Optional<SystemRole> fromString(String value) {
        for (SystemRole role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    public static boolean isSystemRole(String value) {
        return fromString(value).isPresent();
    }

    private static Set<Permission> computeGrants(String role) {
        Set<Permission> result = new LinkedHashSet<>();
        for (String resource : Permission.RESOURCES) {
            for (String action : Permission.ACTIONS) {
                boolean granted = switch (role) {
                    case "super_admin" -> true;
                    case "admin" -> !"tenants".equals(resource);
                    case "user" -> "read".equals(action);
                    default -> false;
                };
                if (granted) {
                    result.add(new Permission(resource, action));
                }
            }
        }
        return result;
    }
}

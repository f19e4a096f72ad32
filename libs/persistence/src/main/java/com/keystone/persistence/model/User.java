package com.keystone.persistence.model;

import java.util.Locale;
import java.util.Set;

/** A member of a tenant. Emails are unique within a tenant and stored in lower case. */
public record User(
        RecordMeta meta,
        String tenantId,
        String email,
        String displayName,
        Set<String> roleNames,
        boolean active) implements TenantScoped<User> {

    public User {
        if (meta == null) {
            meta = RecordMeta.unsaved();
        }
        if (email == null || !email.contains("@")) {
            throw new IllegalArgumentException("email must be a valid address, got '%s'".formatted(email));
        }
        email = email.strip().toLowerCase(Locale.ROOT);
        roleNames = roleNames == null ? Set.of() : Set.copyOf(roleNames);
    }

    /** A new, active user. The tenant is stamped by the gateway. */
    public static User create(String email, String displayName, Set<String> roleNames) {
        return new User(RecordMeta.unsaved(), null, email, displayName, roleNames, true);
    }

    @Override
    public User withMeta(RecordMeta meta) {
        return new User(meta, tenantId, email, displayName, roleNames, active);
    }

    @Override
    public User withTenantId(String tenantId) {
        return new User(meta, tenantId, email, displayName, roleNames, active);
    }

    public User withDisplayName(String displayName) {
        return new User(meta, tenantId, email, displayName, roleNames, active);
    }

    public User withRoleNames(Set<String> roleNames) {
        return new User(meta, tenantId, email, displayName, roleNames, active);
    }

    public User withActive(boolean active) {
        return new User(meta, tenantId, email, displayName, roleNames, active);
    }
}

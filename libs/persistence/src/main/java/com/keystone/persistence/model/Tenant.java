package com.keystone.persistence.model;

import java.util.regex.Pattern;

/**
 * A customer organisation. Not tenant-scoped: tenants are not owned by a tenant.
 */
public record Tenant(RecordMeta meta, String slug, String name, boolean active) implements StoredRecord<Tenant> {

    private static final Pattern SLUG = Pattern.compile("[a-z0-9-]+");

    public Tenant {
        if (meta == null) {
            meta = RecordMeta.unsaved();
        }
        if (slug == null || !SLUG.matcher(slug).matches()) {
            throw new IllegalArgumentException("slug must match [a-z0-9-]+, got '%s'".formatted(slug));
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
    }

    public static Tenant create(String slug, String name) {
        return new Tenant(RecordMeta.unsaved(), slug, name, true);
    }

    @Override
    public Tenant withMeta(RecordMeta meta) {
        return new Tenant(meta, slug, name, active);
    }

    public Tenant withActive(boolean active) {
        return new Tenant(meta, slug, name, active);
    }

    public Tenant withName(String name) {
        return new Tenant(meta, slug, name, active);
    }
}

package com.keystone.persistence.model;

/**
 * Marks a record type owned by exactly one tenant. The data gateway scopes every operation on such
 * a type to the tenant of the current request; types without this marker are not scoped.
 *
 * <p>The tenant id is fixed when the record is created.
 *
 * @param <T> the concrete record type
 */
public interface TenantScoped<T extends StoredRecord<T>> extends StoredRecord<T> {

    /** The owning tenant, null only before the gateway stamps a new record. */
    String tenantId();

    T withTenantId(String tenantId);
}

package com.keystone.persistence.repository;

import com.keystone.persistence.Criteria;
import com.keystone.persistence.DataOperation;
import com.keystone.persistence.DuplicateRecordException;
import com.keystone.persistence.RecordNotFoundException;
import com.keystone.persistence.TenantScopedGateway;
import com.keystone.persistence.model.Tenant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Tenants. Tenants are not owned by a tenant, so these operations are never scoped; creating and
 * listing them is restricted to super administrators at the operation level.
 */
public class TenantRepository {

    private final TenantScopedGateway gateway;

    public TenantRepository(TenantScopedGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * Creates an active tenant.
     *
     * @throws DuplicateRecordException if the slug is taken, by a live or a deleted tenant
     */
    public Tenant create(String slug, String name) {
        Tenant tenant = Tenant.create(normalize(slug), name);
        return gateway.execute(DataOperation.create(Tenant.class, tenant).uniqueIncludingDeleted("slug", Tenant::slug));
    }

    public Optional<Tenant> findById(String id) {
        return gateway.execute(DataOperation.findById(Tenant.class, id));
    }

    public Optional<Tenant> findBySlug(String slug) {
        Criteria<Tenant> bySlug = Criteria.where("slug", Tenant::slug, normalize(slug));
        return gateway.execute(DataOperation.findMany(Tenant.class, bySlug)).stream().findFirst();
    }

    /** Resolves a slug to an active tenant. */
    public Optional<Tenant> findActiveBySlug(String slug) {
        return findBySlug(slug).filter(Tenant::active);
    }

    public List<Tenant> findAll() {
        return gateway.execute(DataOperation.findMany(Tenant.class, Criteria.all()));
    }

    public Tenant rename(String id, long expectedVersion, String name) {
        return gateway.execute(DataOperation.update(Tenant.class, id, expectedVersion, t -> t.withName(name)));
    }

    public Tenant setActive(String id, long expectedVersion, boolean active) {
        return gateway.execute(DataOperation.update(Tenant.class, id, expectedVersion, t -> t.withActive(active)));
    }

    /**
     * @throws RecordNotFoundException if no live tenant has that id
     */
    public void delete(String id) {
        if (!gateway.execute(DataOperation.delete(Tenant.class, id))) {
            throw new RecordNotFoundException("Tenant", id);
        }
    }

    private static String normalize(String slug) {
        return slug == null ? null : slug.strip().toLowerCase(Locale.ROOT);
    }
}

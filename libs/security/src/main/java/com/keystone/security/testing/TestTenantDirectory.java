package com.keystone.security.testing;

import com.keystone.security.tenant.TenantDirectory;
import com.keystone.security.tenant.TenantStatus;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Map-backed {@link TenantDirectory} for tests, counting slug lookups. */
public final class TestTenantDirectory implements TenantDirectory {

    private final Map<String, String> idsBySlug = new ConcurrentHashMap<>();
    private final Map<String, TenantStatus> statuses = new ConcurrentHashMap<>();
    private final AtomicInteger slugLookups = new AtomicInteger();

    public TestTenantDirectory withActiveTenant(String tenantId, String slug) {
        idsBySlug.put(slug, tenantId);
        statuses.put(tenantId, TenantStatus.ACTIVE);
        return this;
    }

    public TestTenantDirectory withActiveTenant(String tenantId) {
        statuses.put(tenantId, TenantStatus.ACTIVE);
        return this;
    }

    public TestTenantDirectory withInactiveTenant(String tenantId) {
        statuses.put(tenantId, TenantStatus.INACTIVE);
        return this;
    }

    @Override
    public Optional<String> findTenantIdBySlug(String slug) {
        slugLookups.incrementAndGet();
        String id = idsBySlug.get(slug);
        return id != null && statuses.get(id) == TenantStatus.ACTIVE ? Optional.of(id) : Optional.empty();
    }

    @Override
    public TenantStatus findStatus(String tenantId) {
        return statuses.getOrDefault(tenantId, TenantStatus.UNKNOWN);
    }

    public int slugLookups() {
        return slugLookups.get();
    }
}

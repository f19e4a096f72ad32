package com.keystone.persistence.repository;

import com.keystone.audit.AuditEmitter;
import com.keystone.audit.InMemoryAuditSink;
import com.keystone.context.ContextHandle;
import com.keystone.context.ContextKey;
import com.keystone.context.RequestContextHolder;
import com.keystone.observability.MetricFactory;
import com.keystone.persistence.DuplicateRecordException;
import com.keystone.persistence.InMemoryRecordStore;
import com.keystone.persistence.TenantScopedGateway;
import com.keystone.persistence.model.RoleDefinition;
import com.keystone.security.Permission;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RoleDefinitionRepository")
class RoleDefinitionRepositoryTest {

    private final RoleDefinitionRepository roles = new RoleDefinitionRepository(new TenantScopedGateway(
            new InMemoryRecordStore(), AuditEmitter.create(new InMemoryAuditSink()),
            new MetricFactory(new SimpleMeterRegistry(), "test"), Clock.systemUTC(), true));
    private ContextHandle handle;

    @BeforeEach
    void setUp() {
        handle = RequestContextHolder.begin();
        RequestContextHolder.set(ContextKey.TENANT_ID, "t1");
    }

    @AfterEach
    void tearDown() {
        handle.close();
    }

    @Test
    @DisplayName("reserves system role names")
    void reservesSystemNames() {
        assertThatThrownBy(() -> roles.create(RoleDefinition.create("admin", "clash", Set.of())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("system role");
    }

    @Test
    @DisplayName("keeps role names unique per tenant")
    void uniqueNames() {
        roles.create(RoleDefinition.create("billing", "Billing", Set.of(Permission.parse("subscriptions:manage"))));

        assertThatThrownBy(() -> roles.create(RoleDefinition.create("billing", "Again", Set.of())))
                .isInstanceOf(DuplicateRecordException.class);
    }

    @Test
    @DisplayName("finds the tenant's roles by name and replaces their permissions")
    void findByNames() {
        RoleDefinition billing = roles.create(RoleDefinition.create("billing", "Billing", Set.of()));
        roles.create(RoleDefinition.create("support", "Support", Set.of()));

        roles.updatePermissions(billing.id(), billing.version(), Set.of(Permission.parse("users:read")));

        assertThat(roles.findByNames(Set.of("billing", "ghost")))
                .singleElement()
                .satisfies(r -> assertThat(r.permissions()).containsExactly(Permission.parse("users:read")));
    }
}

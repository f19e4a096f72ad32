package com.keystone.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.keystone.context.ContextKey;
import com.keystone.context.RequestContext;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuditEntryFactory")
class AuditEntryFactoryTest {

    private final Instant now = Instant.parse("2026-03-01T10:00:00Z");
    private final AuditEntryFactory factory =
            new AuditEntryFactory(Clock.fixed(now, ZoneOffset.UTC));

    @Test
    @DisplayName("fills request, actor and tenant from the snapshot")
    void fillsFromSnapshot() {
        var snapshot = RequestContext.empty()
                .with(ContextKey.REQUEST_ID, "req-7")
                .with(ContextKey.TENANT_ID, "t7")
                .with(ContextKey.ACTOR_ID, "u7");

        var entry = factory.fromSnapshot(snapshot, AuditAction.CREATE, "Role",
                AuditOutcome.SUCCESS, null, false, Map.of());

        assertThat(entry.requestId()).isEqualTo("req-7");
        assertThat(entry.tenantId()).isEqualTo("t7");
        assertThat(entry.actorId()).isEqualTo("u7");
        assertThat(entry.occurredAt()).isEqualTo(now);
        assertThat(entry.entryId()).isNotBlank();
    }

    @Test
    @DisplayName("leaves fields null when the request is anonymous")
    void anonymous() {
        var entry = factory.fromContext(AuditAction.ACCESS, "Tenant", AuditOutcome.SUCCESS, null, null);

        assertThat(entry.actorId()).isNull();
        assertThat(entry.tenantId()).isNull();
        assertThat(entry.details()).isEmpty();
    }

    @Test
    @DisplayName("scope bypass is a successful security event")
    void bypassOutcome() {
        var entry = factory.securityEvent(AuditAction.TENANT_SCOPE_BYPASS, "User", "nightly job", null);

        assertThat(entry.securityEvent()).isTrue();
        assertThat(entry.outcome()).isEqualTo(AuditOutcome.SUCCESS);
    }

    @Test
    @DisplayName("entries are immutable")
    void immutable() {
        var entry = factory.fromContext(AuditAction.ACCESS, "User", AuditOutcome.SUCCESS, null,
                new java.util.HashMap<>(Map.of("k", "v")));

        assertThatThrownBy(() -> entry.details().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}

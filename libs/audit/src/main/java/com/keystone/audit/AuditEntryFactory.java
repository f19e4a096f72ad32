package com.keystone.audit;

import com.keystone.context.ContextKey;
import com.keystone.context.RequestContext;
import com.keystone.context.RequestContextHolder;
import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Builds {@link AuditEntry} instances, filling request id, actor and tenant from a
 * {@link RequestContext}.
 */
public final class AuditEntryFactory {

    private final Clock clock;

    public AuditEntryFactory() {
        this(Clock.systemUTC());
    }

    public AuditEntryFactory(Clock clock) {
        this.clock = clock;
    }

    /** Entry for an operation outcome, using the current thread's request context. */
    public AuditEntry fromContext(
            AuditAction action,
            String resource,
            AuditOutcome outcome,
            String reason,
            Map<String, Object> details) {
        return fromSnapshot(RequestContextHolder.snapshot(), action, resource, outcome, reason, false,
                details);
    }

    /** Security event for the current thread's request context. */
    public AuditEntry securityEvent(
            AuditAction action, String resource, String reason, Map<String, Object> details) {
        AuditOutcome outcome = action == AuditAction.TENANT_SCOPE_BYPASS
                ? AuditOutcome.SUCCESS
                : AuditOutcome.DENIED;
        return fromSnapshot(RequestContextHolder.snapshot(), action, resource, outcome, reason, true,
                details);
    }

    /** Entry built from an explicit snapshot, for work that runs outside the request thread. */
    public AuditEntry fromSnapshot(
            RequestContext snapshot,
            AuditAction action,
            String resource,
            AuditOutcome outcome,
            String reason,
            boolean securityEvent,
            Map<String, Object> details) {
        return new AuditEntry(
                UUID.randomUUID().toString(),
                clock.instant(),
                snapshot.get(ContextKey.REQUEST_ID).orElse(null),
                snapshot.get(ContextKey.ACTOR_ID).orElse(null),
                snapshot.get(ContextKey.TENANT_ID).orElse(null),
                action,
                resource,
                outcome,
                reason,
                securityEvent || action.isSecurityAction(),
                details);
    }
}

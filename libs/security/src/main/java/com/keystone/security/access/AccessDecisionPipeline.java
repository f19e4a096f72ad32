package com.keystone.security.access;

import com.keystone.audit.AuditAction;
import com.keystone.audit.AuditEmitter;
import com.keystone.observability.MetricFactory;
import com.keystone.security.AccessControlSettings;
import com.keystone.security.AccessDeniedException;
import com.keystone.security.DenialReason;
import com.keystone.security.TenantMismatchException;
import com.keystone.security.tenant.TenantDirectory;
import com.keystone.security.tenant.TenantLookupException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the access guards of a request in a fixed order and stops at the first denial.
 *
 * <p>The standard order is: public bypass, API key, authentication, tenant presence, tenant
 * match, tenant status, role, permission. A request is allowed when every guard allows or skips.
 * Tenant-mismatch denials are recorded as security events in the audit trail. Every decision is
 * counted in {@value #DECISIONS_METRIC}.
 */
public final class AccessDecisionPipeline {

    private static final Logger log = LoggerFactory.getLogger(AccessDecisionPipeline.class);

    public static final String DECISIONS_METRIC = "keystone.access.decisions";

    private final List<AccessGuard> guards;
    private final AuditEmitter audit;
    private final MetricFactory metrics;

    public AccessDecisionPipeline(List<AccessGuard> guards, AuditEmitter audit, MetricFactory metrics) {
        if (guards == null || guards.isEmpty()) {
            throw new IllegalArgumentException("guards must not be empty");
        }
        if (audit == null || metrics == null) {
            throw new IllegalArgumentException("audit and metrics must not be null");
        }
        this.guards = List.copyOf(guards);
        this.audit = audit;
        this.metrics = metrics;
    }

    /**
     * Builds the pipeline with the standard guard order.
     *
     * @param directory time-bounded tenant directory for status checks
     */
    public static AccessDecisionPipeline standard(
            AccessControlSettings settings,
            TenantDirectory directory,
            PermissionResolver permissions,
            AuditEmitter audit,
            MetricFactory metrics) {
        return new AccessDecisionPipeline(List.of(
                new PublicBypassGuard(),
                new ApiKeyGuard(settings.internalApiKey()),
                new AuthenticationGuard(),
                new TenantPresenceGuard(settings.strictTenantMode()),
                new TenantMatchGuard(),
                new TenantStatusGuard(directory),
                new RoleGuard(),
                new PermissionGuard(permissions)), audit, metrics);
    }

    /**
     * Evaluates the guards and returns the decision.
     *
     * @throws TenantLookupException if a tenant lookup could not complete, so no decision was made
     */
    public AccessDecision evaluate(AccessRequest request) {
        String operationId = request.policy().operationId();
        for (AccessGuard guard : guards) {
            GuardVerdict verdict;
            try {
                verdict = guard.evaluate(request);
            } catch (TenantLookupException e) {
                count("unavailable", "tenant_lookup");
                log.warn("Access to {} undecided, {} could not look up the tenant: {}",
                        operationId, guard.name(), e.getMessage());
                throw e;
            }
            if (verdict instanceof GuardVerdict.Deny deny) {
                AccessDecision decision = AccessDecision.denied(operationId, guard.name(), deny);
                onDenied(decision);
                return decision;
            }
        }
        count("allow", "none");
        log.debug("Access to {} allowed", operationId);
        return AccessDecision.allowed(operationId);
    }

    /**
     * Evaluates the guards and throws on denial.
     *
     * @throws TenantMismatchException if the principal's tenant differs from the requested tenant
     * @throws AccessDeniedException for any other denial, or the stored credential failure when a
     *     rejected credential caused an authentication denial
     * @throws TenantLookupException if a tenant lookup could not complete
     */
    public void enforce(AccessRequest request) {
        AccessDecision decision = evaluate(request);
        if (decision.isAllowed()) {
            return;
        }
        GuardVerdict.Deny deny = decision.denial();
        if (deny.reason() == DenialReason.TENANT_MISMATCH) {
            throw new TenantMismatchException(
                    (String) deny.details().get("principalTenantId"),
                    (String) deny.details().get("requestedTenantId"));
        }
        if (deny.reason() == DenialReason.UNAUTHENTICATED
                && "authentication".equals(decision.deniedBy())
                && request.credentialFailure().isPresent()) {
            throw request.credentialFailure().get();
        }
        throw new AccessDeniedException(deny.reason(), deny.message());
    }

    public List<AccessGuard> guards() {
        return guards;
    }

    private void onDenied(AccessDecision decision) {
        GuardVerdict.Deny deny = decision.denial();
        count("deny", deny.reason().code());
        if (deny.reason().isSecurityEvent()) {
            log.warn("Access to {} denied by {}: {} ({})",
                    decision.operationId(), decision.deniedBy(), deny.reason(), deny.message());
            audit.recordSecurityEvent(AuditAction.TENANT_MISMATCH, decision.operationId(),
                    deny.message(), deny.details());
        } else {
            log.info("Access to {} denied by {}: {} ({})",
                    decision.operationId(), decision.deniedBy(), deny.reason(), deny.message());
        }
    }

    private void count(String outcome, String reason) {
        metrics.counter(DECISIONS_METRIC, "Access decisions by outcome and reason",
                "outcome", outcome, "reason", reason).increment();
    }
}

package com.keystone.security.access;

import com.keystone.security.DenialReason;
import com.keystone.security.Principal;
import com.keystone.security.tenant.TenantResolution;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Denies a principal acting on another tenant. Compares the principal's tenant with the resolved
 * tenant and with a tenant header the caller presented, whichever source won resolution. Applies
 * to public operations and to super admins alike.
 */
public final class TenantMatchGuard implements AccessGuard {

    @Override
    public String name() {
        return "tenant-match";
    }

    @Override
    public GuardVerdict evaluate(AccessRequest request) {
        Optional<Principal> principal = request.principal();
        if (principal.isEmpty()) {
            return GuardVerdict.skip();
        }
        String own = principal.get().tenantId();
        Optional<String> resolved = request.tenantId();
        Optional<String> header = request.tenantResolution()
                .flatMap(TenantResolution::presentedHeaderTenantId);

        if (resolved.isPresent() && !own.equals(resolved.get())) {
            return mismatch(principal.get(), resolved.get(), request);
        }
        if (header.isPresent() && !own.equals(header.get())) {
            return mismatch(principal.get(), header.get(), request);
        }
        return resolved.isPresent() ? GuardVerdict.allow() : GuardVerdict.skip();
    }

    private static GuardVerdict mismatch(Principal principal, String requested, AccessRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", request.policy().operationId());
        details.put("principalId", principal.principalId());
        details.put("principalTenantId", principal.tenantId());
        details.put("requestedTenantId", requested);
        request.tenantResolution().ifPresent(r -> details.put("tenantSource", r.source().name()));
        details.put("path", request.request().path());
        return GuardVerdict.deny(DenialReason.TENANT_MISMATCH,
                "Principal of tenant '%s' cannot act on tenant '%s'"
                        .formatted(principal.tenantId(), requested),
                details);
    }
}

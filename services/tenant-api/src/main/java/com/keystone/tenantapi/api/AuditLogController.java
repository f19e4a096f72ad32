package com.keystone.tenantapi.api;

import com.keystone.audit.AuditEntry;
import com.keystone.audit.InMemoryAuditSink;
import com.keystone.context.ContextKey;
import com.keystone.context.RequestContextHolder;
import com.keystone.tenantapi.security.RequiresPermissions;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Audit trail of the caller's tenant, newest last. */
@RestController
@RequestMapping("/api/v1/audit")
public class AuditLogController {

    private final InMemoryAuditSink auditLog;

    public AuditLogController(InMemoryAuditSink auditLog) {
        this.auditLog = auditLog;
    }

    @RequiresPermissions("audit_logs:read")
    @GetMapping
    public List<AuditEntry> entries() {
        String tenantId = RequestContextHolder.get(ContextKey.TENANT_ID)
                .orElseThrow(() -> new IllegalStateException("tenant not resolved"));
        return auditLog.entriesForTenant(tenantId);
    }
}

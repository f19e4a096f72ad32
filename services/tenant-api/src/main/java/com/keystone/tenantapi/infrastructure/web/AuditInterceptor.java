package com.keystone.tenantapi.infrastructure.web;

import com.keystone.audit.AuditEmitter;
import com.keystone.audit.AuditOutcome;
import com.keystone.security.access.AuditSpec;
import com.keystone.security.access.OperationPolicy;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.async.AsyncRequestNotUsableException;
import org.springframework.web.servlet.DispatcherServlet;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Records the outcome of operations declared {@code @Audited} once the handler has completed.
 *
 * <p>Only operations that passed access control are recorded here; denials are reported by the
 * access decision pipeline. The entry is not written when the client aborted the request.
 */
@Component
public class AuditInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AuditInterceptor.class);

    private final AuditEmitter audit;

    public AuditInterceptor(AuditEmitter audit) {
        this.audit = audit;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler,
                                Exception ex) {
        if (!(request.getAttribute(AccessControlInterceptor.GRANTED_POLICY) instanceof OperationPolicy policy)) {
            return;
        }
        if (policy.auditSpec().isEmpty()) {
            return;
        }
        AuditSpec spec = policy.auditSpec().get();
        Throwable failure = ex != null ? ex : (Throwable) request.getAttribute(DispatcherServlet.EXCEPTION_ATTRIBUTE);
        if (isClientAbort(failure)) {
            log.info("Client aborted {}; no audit entry written", policy.operationId());
            return;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", policy.operationId());
        details.put("method", request.getMethod());
        details.put("path", request.getRequestURI());
        details.put("status", response.getStatus());

        boolean failed = failure != null || response.getStatus() >= 400;
        String reason = failed ? describe(failure, response.getStatus()) : null;
        audit.recordOutcome(spec.action(), spec.resource(),
                failed ? AuditOutcome.FAILURE : AuditOutcome.SUCCESS, reason, details);
    }

    static boolean isClientAbort(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof AsyncRequestNotUsableException
                    || "ClientAbortException".equals(t.getClass().getSimpleName())) {
                return true;
            }
            if (t instanceof IOException && t.getMessage() != null && t.getMessage().contains("Broken pipe")) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable failure, int status) {
        if (failure == null) {
            return "HTTP " + status;
        }
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }
}

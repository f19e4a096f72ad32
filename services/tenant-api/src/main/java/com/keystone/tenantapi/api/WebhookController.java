package com.keystone.tenantapi.api;

import com.keystone.audit.AuditAction;
import com.keystone.context.ContextKey;
import com.keystone.context.RequestContextHolder;
import com.keystone.security.access.TenantRequirement;
import com.keystone.tenantapi.api.dto.WebhookEvent;
import com.keystone.tenantapi.security.ApiKeyRequired;
import com.keystone.tenantapi.security.Audited;
import com.keystone.tenantapi.security.PublicOperation;
import jakarta.validation.Valid;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Service-to-service callbacks. Callers present the internal API key instead of a user credential
 * and name the tenant in the tenant header.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    @PublicOperation(tenant = TenantRequirement.REQUIRED)
    @ApiKeyRequired
    @Audited(action = AuditAction.ACCESS, resource = "Webhook")
    @PostMapping("/{provider}")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> receive(@PathVariable String provider, @Valid @RequestBody WebhookEvent event) {
        String tenantId = RequestContextHolder.get(ContextKey.TENANT_ID).orElseThrow();
        log.info("Accepted {} webhook {} for tenant {}", provider, event.type(), tenantId);
        return Map.of("accepted", true, "provider", provider, "type", event.type());
    }
}

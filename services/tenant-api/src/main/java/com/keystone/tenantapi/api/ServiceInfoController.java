package com.keystone.tenantapi.api;

import com.keystone.context.ContextKey;
import com.keystone.context.RequestContextHolder;
import com.keystone.security.access.TenantRequirement;
import com.keystone.tenantapi.config.KeystoneServiceProperties;
import com.keystone.tenantapi.security.PublicOperation;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Service info endpoint. Public and needs no tenant, even in strict tenant mode.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final KeystoneServiceProperties properties;

    public ServiceInfoController(KeystoneServiceProperties properties) {
        this.properties = properties;
    }

    @PublicOperation(tenant = TenantRequirement.OPTIONAL)
    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.name());
        info.put("environment", properties.environment());
        info.put("description", properties.description() != null ? properties.description() : "");
        info.put("status", "running");
        info.put("timestamp", Instant.now().toString());
        RequestContextHolder.get(ContextKey.REQUEST_ID).ifPresent(id -> info.put("requestId", id));
        return info;
    }
}

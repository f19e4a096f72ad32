package com.keystone.tenantapi.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code keystone.service.*}.
 *
 * <pre>
 * keystone:
 *   service:
 *     name: tenant-api
 *     environment: production
 *     description: Multi-tenant access-controlled API
 * </pre>
 *
 * @param name        service name, used as the {@code service} metric tag. Required.
 * @param environment deployment environment, defaults to {@code development}
 * @param description shown by {@code /api/v1/info}
 */
@ConfigurationProperties(prefix = "keystone.service")
@Validated
public record KeystoneServiceProperties(@NotBlank String name, String environment, String description) {

    public KeystoneServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}

package com.keystone.tenantapi.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Data and audit settings, bound from {@code keystone.data.*}.
 *
 * @param softDelete          whether deletes mark records instead of removing them (default true)
 * @param auditRetryCapacity  entries parked for retry when the audit sink fails (default 1000)
 */
@ConfigurationProperties(prefix = "keystone.data")
@Validated
public record KeystoneDataProperties(Boolean softDelete, @Min(1) Integer auditRetryCapacity) {

    public KeystoneDataProperties {
        if (softDelete == null) {
            softDelete = Boolean.TRUE;
        }
        if (auditRetryCapacity == null) {
            auditRetryCapacity = 1_000;
        }
    }
}

package com.keystone.tenantapi.api.dto;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

public record WebhookEvent(@NotBlank String type, Map<String, Object> payload) {
}

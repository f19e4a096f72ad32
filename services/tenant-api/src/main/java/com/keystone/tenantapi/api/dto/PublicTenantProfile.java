package com.keystone.tenantapi.api.dto;

/** What an anonymous visitor of a tenant's public page may see. */
public record PublicTenantProfile(String slug, String name) {
}

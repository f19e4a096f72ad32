package com.keystone.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AccessControlSettings")
class AccessControlSettingsTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    @Test
    @DisplayName("applies defaults")
    void defaults() {
        var settings = AccessControlSettings.builder(SECRET).build();

        assertThat(settings.tenantHeader()).isEqualTo("X-Tenant-ID");
        assertThat(settings.strictTenantMode()).isFalse();
        assertThat(settings.clockSkew()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.publicSlugRoute()).isEqualTo("/public/book/{slug}");
        assertThat(settings.internalApiKey()).isNull();
    }

    @Test
    @DisplayName("rejects secrets shorter than 32 bytes")
    void shortSecret() {
        assertThatThrownBy(() -> AccessControlSettings.builder("too-short").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("rejects a slug route without a slug placeholder")
    void slugRoute() {
        assertThatThrownBy(() -> AccessControlSettings.builder(SECRET).publicSlugRoute("/public").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("never prints the secret or the API key")
    void toStringRedacts() {
        var settings = AccessControlSettings.builder(SECRET).internalApiKey("k-123").build();

        assertThat(settings.toString()).doesNotContain(SECRET).doesNotContain("k-123");
    }
}

package com.keystone.security.tenant;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimeBoundedTenantDirectory")
class TimeBoundedTenantDirectoryTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final CountDownLatch release = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    @Test
    @DisplayName("returns the delegate's answer when it is fast enough")
    void fast() {
        var directory = new TimeBoundedTenantDirectory(new FixedDirectory(), Duration.ofSeconds(1), executor);

        assertThat(directory.findTenantIdBySlug("acme")).contains("t3");
        assertThat(directory.findStatus("t3")).isEqualTo(TenantStatus.ACTIVE);
    }

    @Test
    @DisplayName("fails a lookup that exceeds the timeout")
    void slow() {
        TenantDirectory hanging = new FixedDirectory() {
            @Override
            public TenantStatus findStatus(String tenantId) {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return TenantStatus.ACTIVE;
            }
        };
        var directory = new TimeBoundedTenantDirectory(hanging, Duration.ofMillis(50), executor);

        assertThatThrownBy(() -> directory.findStatus("t3"))
                .isInstanceOf(TenantLookupException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    @DisplayName("wraps delegate failures")
    void failing() {
        TenantDirectory broken = new FixedDirectory() {
            @Override
            public Optional<String> findTenantIdBySlug(String slug) {
                throw new IllegalStateException("connection refused");
            }
        };
        var directory = new TimeBoundedTenantDirectory(broken, Duration.ofSeconds(1), executor);

        assertThatThrownBy(() -> directory.findTenantIdBySlug("acme"))
                .isInstanceOf(TenantLookupException.class)
                .hasRootCauseMessage("connection refused");
    }

    private static class FixedDirectory implements TenantDirectory {
        @Override
        public Optional<String> findTenantIdBySlug(String slug) {
            return "acme".equals(slug) ? Optional.of("t3") : Optional.empty();
        }

        @Override
        public TenantStatus findStatus(String tenantId) {
            return TenantStatus.ACTIVE;
        }
    }
}

package com.keystone.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.keystone.context.ContextHandle;
import com.keystone.context.ContextKey;
import com.keystone.context.RequestContextHolder;
import com.keystone.observability.MetricFactory;
import com.keystone.observability.SensitiveDataRedactor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AuditEmitter")
class AuditEmitterTest {

    private final InMemoryAuditSink stored = new InMemoryAuditSink();
    private final FlakySink sink = new FlakySink(stored);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private RetryingAuditFailureHandler retries;
    private AuditEmitter emitter;
    private ContextHandle handle;

    @BeforeEach
    void setUp() {
        MetricFactory metrics = new MetricFactory(registry, "test");
        retries = new RetryingAuditFailureHandler(sink, 2, metrics);
        emitter = new AuditEmitter(sink, retries, metrics, new SensitiveDataRedactor(), new AuditEntryFactory());
        handle = RequestContextHolder.begin("req-1");
        RequestContextHolder.set(ContextKey.TENANT_ID, "t1");
        RequestContextHolder.set(ContextKey.ACTOR_ID, "u1");
    }

    @AfterEach
    void tearDown() {
        handle.close();
    }

    @Nested
    @DisplayName("audited()")
    class Audited {

        @Test
        @DisplayName("records success with actor, tenant and request id before returning")
        void recordsSuccess() throws Exception {
            String result = emitter.audited(AuditAction.DELETE, "User", () -> "deleted");

            assertThat(result).isEqualTo("deleted");
            assertThat(stored.entries()).singleElement().satisfies(e -> {
                assertThat(e.outcome()).isEqualTo(AuditOutcome.SUCCESS);
                assertThat(e.action()).isEqualTo(AuditAction.DELETE);
                assertThat(e.resource()).isEqualTo("User");
                assertThat(e.tenantId()).isEqualTo("t1");
                assertThat(e.actorId()).isEqualTo("u1");
                assertThat(e.requestId()).isEqualTo("req-1");
                assertThat(e.securityEvent()).isFalse();
            });
        }

        @Test
        @DisplayName("records failure and rethrows the original exception")
        void recordsFailure() {
            var boom = new IllegalStateException("user is locked");

            assertThatThrownBy(() -> emitter.audited(AuditAction.UPDATE, "User", () -> {
                        throw boom;
                    }))
                    .isSameAs(boom);
            assertThat(stored.entries()).singleElement().satisfies(e -> {
                assertThat(e.outcome()).isEqualTo(AuditOutcome.FAILURE);
                assertThat(e.reason()).isEqualTo("user is locked");
            });
        }

        @Test
        @DisplayName("a failed audit write does not change a successful business outcome")
        void auditFailureKeepsResult() throws Exception {
            sink.failing.set(true);

            String result = emitter.audited(AuditAction.CREATE, "User", () -> "created");

            assertThat(result).isEqualTo("created");
            assertThat(stored.entries()).isEmpty();
            assertThat(retries.pendingCount()).isEqualTo(1);
            assertThat(registry.get("keystone.audit.write.failures").counter().count())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("record()")
    class Record {

        @Test
        @DisplayName("redacts credential-bearing details")
        void redactsDetails() {
            emitter.recordOutcome(AuditAction.LOGIN, "Session", AuditOutcome.SUCCESS, null,
                    Map.of("authorization", "Bearer abc", "ip", "10.0.0.1"));

            assertThat(stored.entries().get(0).details())
                    .containsEntry("authorization", SensitiveDataRedactor.REDACTED)
                    .containsEntry("ip", "10.0.0.1");
        }

        @Test
        @DisplayName("reports a failed write distinctly")
        void reportsFailure() {
            sink.failing.set(true);
            boolean written = emitter.recordSecurityEvent(
                    AuditAction.TENANT_MISMATCH, "User", "tenant mismatch", Map.of());

            assertThat(written).isFalse();
            assertThat(retries.pendingCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("security actions are always flagged as security events")
        void securityFlag() {
            emitter.recordSecurityEvent(AuditAction.TENANT_MISMATCH, "User", "mismatch", Map.of());

            assertThat(stored.securityEvents()).singleElement()
                    .satisfies(e -> assertThat(e.outcome()).isEqualTo(AuditOutcome.DENIED));
        }
    }

    @Nested
    @DisplayName("retry queue")
    class RetryQueue {

        @Test
        @DisplayName("parked entries are written once the sink recovers")
        void retriesAfterRecovery() {
            sink.failing.set(true);
            emitter.recordOutcome(AuditAction.EXPORT, "AuditLog", AuditOutcome.SUCCESS, null, Map.of());
            sink.failing.set(false);

            assertThat(retries.retryPending()).isEqualTo(1);
            assertThat(stored.entries()).hasSize(1);
            assertThat(retries.pendingCount()).isZero();
        }

        @Test
        @DisplayName("drops the oldest entry when full and publishes the drop count")
        void dropsOldestWhenFull() {
            sink.failing.set(true);
            for (String resource : List.of("first", "second", "third")) {
                emitter.recordOutcome(AuditAction.ACCESS, resource, AuditOutcome.SUCCESS, null, Map.of());
            }
            sink.failing.set(false);

            assertThat(retries.pendingCount()).isEqualTo(2);
            assertThat(retries.droppedCount()).isEqualTo(1);
            assertThat(registry.get(RetryingAuditFailureHandler.DROPPED_METRIC)
                    .tag("action", AuditAction.ACCESS.value()).counter().count()).isEqualTo(1.0);

            retries.retryPending();

            assertThat(stored.entries()).extracting(AuditEntry::resource).containsExactly("second", "third");
        }

        @Test
        @DisplayName("retries an entry only against the sinks that failed to store it")
        void retriesOnlyFailedSinks() {
            InMemoryAuditSink healthy = new InMemoryAuditSink();
            InMemoryAuditSink recovered = new InMemoryAuditSink();
            FlakySink flaky = new FlakySink(recovered);
            CompositeAuditSink composite = new CompositeAuditSink(List.of(healthy, flaky));
            MetricFactory metrics = new MetricFactory(registry, "test");
            RetryingAuditFailureHandler compositeRetries = new RetryingAuditFailureHandler(composite, 10, metrics);
            AuditEmitter fanOut = new AuditEmitter(composite, compositeRetries, metrics,
                    new SensitiveDataRedactor(), new AuditEntryFactory());

            flaky.failing.set(true);
            fanOut.recordOutcome(AuditAction.CREATE, "User", AuditOutcome.SUCCESS, null, Map.of());
            flaky.failing.set(false);

            assertThat(compositeRetries.retryPending()).isEqualTo(1);
            assertThat(healthy.entries()).hasSize(1);
            assertThat(recovered.entries()).singleElement()
                    .satisfies(e -> assertThat(e.entryId()).isEqualTo(healthy.entries().get(0).entryId()));
        }
    }

    private static final class FlakySink implements AuditSink {
        private final AuditSink delegate;
        private final AtomicBoolean failing = new AtomicBoolean();

        private FlakySink(AuditSink delegate) {
            this.delegate = delegate;
        }

        @Override
        public void write(AuditEntry entry) {
            if (failing.get()) {
                throw new AuditWriteException("audit store offline");
            }
            delegate.write(entry);
        }
    }
}

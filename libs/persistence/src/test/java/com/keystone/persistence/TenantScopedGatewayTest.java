package com.keystone.persistence;

import com.keystone.audit.AuditAction;
import com.keystone.audit.AuditEmitter;
import com.keystone.audit.AuditEntry;
import com.keystone.audit.AuditEntryFactory;
import com.keystone.audit.InMemoryAuditSink;
import com.keystone.audit.RetryingAuditFailureHandler;
import com.keystone.context.ContextHandle;
import com.keystone.context.ContextKey;
import com.keystone.context.RequestContextHolder;
import com.keystone.observability.MetricFactory;
import com.keystone.observability.SensitiveDataRedactor;
import com.keystone.persistence.model.Tenant;
import com.keystone.persistence.model.User;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TenantScopedGateway")
class TenantScopedGatewayTest {

    private final RecordingRecordStore store = new RecordingRecordStore();
    private final InMemoryAuditSink auditSink = new InMemoryAuditSink();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MetricFactory metrics = new MetricFactory(registry, "test");
    private final AuditEmitter audit = new AuditEmitter(auditSink,
            new RetryingAuditFailureHandler(auditSink, 10, metrics), metrics, new SensitiveDataRedactor(),
            new AuditEntryFactory());
    private final TenantScopedGateway gateway =
            new TenantScopedGateway(store, audit, metrics, Clock.systemUTC(), true);

    private static <T> T inTenant(String tenantId, Supplier<T> work) {
        try (ContextHandle ignored = RequestContextHolder.begin()) {
            RequestContextHolder.set(ContextKey.TENANT_ID, tenantId);
            return work.get();
        }
    }

    private User createUser(String tenantId, String email) {
        return inTenant(tenantId, () -> gateway.execute(
                DataOperation.create(User.class, User.create(email, "Someone", Set.of("user")))));
    }

    private List<User> usersOf(String tenantId) {
        return inTenant(tenantId, () -> gateway.execute(DataOperation.findMany(User.class, Criteria.all())));
    }

    @Nested
    @DisplayName("tenant scoping")
    class Scoping {

        @Test
        @DisplayName("stamps the ambient tenant and lifecycle fields into created records")
        void stampsTenantOnCreate() {
            User user = createUser("t1", "Ada@Example.com");

            assertThat(user.tenantId()).isEqualTo("t1");
            assertThat(user.id()).isNotBlank();
            assertThat(user.version()).isEqualTo(1);
            assertThat(user.meta().createdAt()).isNotNull();
            assertThat(user.email()).isEqualTo("ada@example.com");
        }

        @Test
        @DisplayName("adds tenant and soft-delete conditions to the caller's criteria")
        void injectsConditions() {
            inTenant("t1", () -> gateway.execute(DataOperation.findMany(User.class,
                    Criteria.where("active", User::active, true))));

            assertThat(store.lastQuery().fields())
                    .containsExactly("active", Criteria.TENANT_FIELD, Criteria.DELETED_AT_FIELD);
            assertThat(store.lastQuery().conditions().get(1).value()).isEqualTo("t1");
        }

        @Test
        @DisplayName("checks unique keys of a create within the created record's tenant")
        void scopesUniqueKeys() {
            inTenant("t1", () -> gateway.execute(DataOperation.create(User.class,
                    User.create("ada@example.com", "Ada", Set.of())).unique("email", User::email)));
            User other = inTenant("t2", () -> gateway.execute(DataOperation.create(User.class,
                    User.create("ada@example.com", "Ada", Set.of())).unique("email", User::email)));

            assertThat(other.tenantId()).isEqualTo("t2");
            RecordStore.UniqueConstraint<?> last = store.uniqueChecks().get(1);
            assertThat(last.field()).isEqualTo("email");
            assertThat(last.value()).isEqualTo("ada@example.com");
            assertThat(last.conflicts().fields())
                    .containsExactly("email", Criteria.TENANT_FIELD, Criteria.DELETED_AT_FIELD);
            assertThat(last.conflicts().conditions().get(1).value()).isEqualTo("t2");
        }

        @Test
        @DisplayName("never returns, counts or finds records of another tenant")
        void isolatesReads() {
            User alice = createUser("t1", "alice@t1.io");
            createUser("t2", "bob@t2.io");

            assertThat(usersOf("t1")).extracting(User::email).containsExactly("alice@t1.io");
            assertThat(usersOf("t2")).extracting(User::email).containsExactly("bob@t2.io");
            assertThat(inTenant("t2", () -> gateway.execute(DataOperation.findById(User.class, alice.id()))))
                    .isEmpty();
            assertThat(inTenant("t2", () -> gateway.execute(DataOperation.count(User.class, Criteria.all()))))
                    .isEqualTo(1L);
        }

        @Test
        @DisplayName("cannot update or delete a record of another tenant")
        void isolatesWrites() {
            User alice = createUser("t1", "alice@t1.io");

            assertThatThrownBy(() -> inTenant("t2", () -> gateway.execute(
                    DataOperation.update(User.class, alice.id(), 1, u -> u.withDisplayName("hijacked")))))
                    .isInstanceOf(RecordNotFoundException.class);
            assertThat(inTenant("t2", () -> gateway.execute(DataOperation.delete(User.class, alice.id()))))
                    .isFalse();
            assertThat(usersOf("t1")).singleElement()
                    .satisfies(u -> assertThat(u.displayName()).isEqualTo("Someone"));
        }

        @Test
        @DisplayName("passes types that are not tenant-scoped through without a tenant")
        void leavesUnscopedTypesAlone() {
            Tenant tenant = gateway.execute(DataOperation.create(Tenant.class, Tenant.create("acme", "Acme")));
            List<Tenant> all = gateway.execute(DataOperation.findMany(Tenant.class, Criteria.all()));

            assertThat(all).containsExactly(tenant);
            assertThat(store.lastQuery().fields()).containsExactly(Criteria.DELETED_AT_FIELD);
            assertThat(auditSink.entries()).isEmpty();
        }
    }

    @Nested
    @DisplayName("scope violations")
    class Violations {

        @Test
        @DisplayName("rejects tenant-scoped reads with no request context and audits them")
        void rejectsWithoutContext() {
            assertThatThrownBy(() -> gateway.execute(DataOperation.findMany(User.class, Criteria.all())))
                    .isInstanceOf(TenantScopeViolationException.class)
                    .hasMessageContaining("User");

            assertThat(store.queries()).isEmpty();
            assertThat(auditSink.securityEvents()).singleElement().satisfies(e -> {
                assertThat(e.action()).isEqualTo(AuditAction.TENANT_SCOPE_VIOLATION);
                assertThat(e.details()).containsEntry("recordType", "User");
            });
        }

        @Test
        @DisplayName("rejects tenant-scoped writes in a request whose tenant was not resolved")
        void rejectsWithoutTenant() {
            try (ContextHandle ignored = RequestContextHolder.begin("req-9")) {
                assertThatThrownBy(() -> gateway.execute(
                        DataOperation.create(User.class, User.create("x@y.io", "X", Set.of()))))
                        .isInstanceOf(TenantScopeViolationException.class);
            }
            assertThat(auditSink.securityEvents()).singleElement()
                    .extracting(AuditEntry::requestId).isEqualTo("req-9");
        }

        @Test
        @DisplayName("rejects a create whose payload names a different tenant")
        void rejectsForeignPayload() {
            User foreign = User.create("x@y.io", "X", Set.of()).withTenantId("t2");

            assertThatThrownBy(() -> inTenant("t1", () -> gateway.execute(DataOperation.create(User.class, foreign))))
                    .isInstanceOf(TenantScopeViolationException.class);
            assertThat(usersOf("t2")).isEmpty();
        }

        @Test
        @DisplayName("rejects an update that moves a record to another tenant")
        void rejectsTenantChange() {
            User alice = createUser("t1", "alice@t1.io");

            assertThatThrownBy(() -> inTenant("t1", () -> gateway.execute(
                    DataOperation.update(User.class, alice.id(), 1, u -> u.withTenantId("t2")))))
                    .isInstanceOf(TenantScopeViolationException.class);
            assertThat(usersOf("t1")).singleElement().extracting(User::version).isEqualTo(1L);
        }
    }

    @Nested
    @DisplayName("withoutTenantScope()")
    class EscapeHatch {

        @Test
        @DisplayName("sees every tenant and restores the ambient tenant afterwards")
        void crossTenantRead() {
            createUser("t1", "alice@t1.io");
            createUser("t2", "bob@t2.io");

            try (ContextHandle ignored = RequestContextHolder.begin()) {
                RequestContextHolder.set(ContextKey.TENANT_ID, "t1");

                List<User> all = gateway.withoutTenantScope("nightly report", () -> {
                    assertThat(RequestContextHolder.get(ContextKey.TENANT_ID)).isEmpty();
                    assertThat(TenantScopedGateway.isScopeBypassed()).isTrue();
                    return gateway.execute(DataOperation.findMany(User.class, Criteria.all()));
                });

                assertThat(all).hasSize(2);
                assertThat(RequestContextHolder.get(ContextKey.TENANT_ID)).contains("t1");
                assertThat(TenantScopedGateway.isScopeBypassed()).isFalse();
            }
        }

        @Test
        @DisplayName("restores the absence of any context")
        void restoresAbsentContext() {
            gateway.withoutTenantScope("startup check", () -> {
                gateway.execute(DataOperation.count(User.class, Criteria.all()));
            });

            assertThat(RequestContextHolder.isActive()).isFalse();
        }

        @Test
        @DisplayName("restores the ambient tenant when the work throws")
        void restoresOnThrow() {
            Supplier<String> failing = () -> {
                throw new IllegalStateException("boom");
            };
            try (ContextHandle ignored = RequestContextHolder.begin()) {
                RequestContextHolder.set(ContextKey.TENANT_ID, "t1");

                assertThatThrownBy(() -> gateway.withoutTenantScope("cleanup", failing))
                        .isInstanceOf(IllegalStateException.class);

                assertThat(RequestContextHolder.get(ContextKey.TENANT_ID)).contains("t1");
                assertThat(RequestContextHolder.get(TenantScopedGateway.SCOPE_BYPASS)).isEmpty();
            }
        }

        @Test
        @DisplayName("audits every use with its reason")
        void auditsBypass() {
            inTenant("t1", () -> gateway.withoutTenantScope("nightly report", () -> "done"));

            assertThat(auditSink.securityEvents()).singleElement().satisfies(e -> {
                assertThat(e.action()).isEqualTo(AuditAction.TENANT_SCOPE_BYPASS);
                assertThat(e.reason()).isEqualTo("nightly report");
                assertThat(e.details()).containsEntry("previousTenantId", "t1");
            });
        }

        @Test
        @DisplayName("requires a reason")
        void requiresReason() {
            assertThatThrownBy(() -> gateway.withoutTenantScope(" ", () -> "x"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(auditSink.entries()).isEmpty();
        }

        @Test
        @DisplayName("creates tenant-scoped records only when the payload names the tenant")
        void createRequiresExplicitTenant() {
            User seeded = gateway.withoutTenantScope("seed", () -> gateway.execute(DataOperation.create(User.class,
                    User.create("seed@t3.io", "Seed", Set.of("admin")).withTenantId("t3"))));

            assertThat(seeded.tenantId()).isEqualTo("t3");
            assertThatThrownBy(() -> gateway.withoutTenantScope("seed", () -> gateway.execute(
                    DataOperation.create(User.class, User.create("orphan@x.io", "Orphan", Set.of())))))
                    .isInstanceOf(TenantScopeViolationException.class);
        }
    }

    @Nested
    @DisplayName("soft delete")
    class SoftDelete {

        @Test
        @DisplayName("marks the record deleted and hides it from default reads")
        void hidesDeleted() {
            User alice = createUser("t1", "alice@t1.io");

            assertThat(inTenant("t1", () -> gateway.execute(DataOperation.delete(User.class, alice.id())))).isTrue();

            assertThat(usersOf("t1")).isEmpty();
            assertThat(inTenant("t1", () -> gateway.execute(DataOperation.findById(User.class, alice.id()))))
                    .isEmpty();
            assertThat(inTenant("t1", () -> gateway.execute(DataOperation.count(User.class, Criteria.all()))))
                    .isZero();
        }

        @Test
        @DisplayName("keeps deleted records readable on request")
        void includeDeleted() {
            User alice = createUser("t1", "alice@t1.io");
            inTenant("t1", () -> gateway.execute(DataOperation.delete(User.class, alice.id())));

            Optional<User> deleted = inTenant("t1", () -> gateway.execute(
                    DataOperation.findById(User.class, alice.id()).includeDeleted()));
            long counted = inTenant("t1", () -> gateway.execute(
                    DataOperation.count(User.class, Criteria.all()).includeDeleted()));

            assertThat(deleted).hasValueSatisfying(u -> {
                assertThat(u.isDeleted()).isTrue();
                assertThat(u.version()).isEqualTo(2);
            });
            assertThat(counted).isEqualTo(1);
        }

        @Test
        @DisplayName("treats a deleted record as gone for deletes and updates")
        void deletedIsGone() {
            User alice = createUser("t1", "alice@t1.io");
            inTenant("t1", () -> gateway.execute(DataOperation.delete(User.class, alice.id())));

            assertThat(inTenant("t1", () -> gateway.execute(DataOperation.delete(User.class, alice.id())))).isFalse();
            assertThatThrownBy(() -> inTenant("t1", () -> gateway.execute(
                    DataOperation.update(User.class, alice.id(), 2, u -> u.withActive(false)))))
                    .isInstanceOf(RecordNotFoundException.class);
        }

        @Test
        @DisplayName("removes the record when soft delete is off")
        void hardDelete() {
            var hard = new TenantScopedGateway(store, audit, metrics, Clock.systemUTC(), false);
            User alice = createUser("t1", "alice@t1.io");

            inTenant("t1", () -> hard.execute(DataOperation.delete(User.class, alice.id())));

            assertThat(inTenant("t1", () -> hard.execute(
                    DataOperation.findById(User.class, alice.id()).includeDeleted()))).isEmpty();
        }
    }

    @Nested
    @DisplayName("optimistic concurrency")
    class Versioning {

        @Test
        @DisplayName("increments the version on every update and rejects stale versions")
        void rejectsStaleVersion() {
            User alice = createUser("t1", "alice@t1.io");

            User renamed = inTenant("t1", () -> gateway.execute(
                    DataOperation.update(User.class, alice.id(), 1, u -> u.withDisplayName("Alice"))));

            assertThat(renamed.version()).isEqualTo(2);
            assertThat(renamed.meta().updatedAt()).isAfterOrEqualTo(alice.meta().updatedAt());
            assertThatThrownBy(() -> inTenant("t1", () -> gateway.execute(
                    DataOperation.update(User.class, alice.id(), 1, u -> u.withDisplayName("Stale")))))
                    .isInstanceOfSatisfying(OptimisticConflictException.class, e -> {
                        assertThat(e.expectedVersion()).isEqualTo(1);
                        assertThat(e.actualVersion()).isEqualTo(2);
                    });
        }

        @Test
        @DisplayName("lets exactly one of several concurrent updates of the same version win")
        void oneConcurrentWinner() throws Exception {
            User alice = createUser("t1", "alice@t1.io");
            ExecutorService pool = Executors.newFixedThreadPool(4);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<User>> futures = new ArrayList<>();

            try (ContextHandle ignored = RequestContextHolder.begin()) {
                RequestContextHolder.set(ContextKey.TENANT_ID, "t1");
                for (int i = 0; i < 8; i++) {
                    String name = "writer-" + i;
                    Callable<User> update = () -> {
                        start.await();
                        return gateway.execute(DataOperation.update(User.class, alice.id(), 1,
                                u -> u.withDisplayName(name)));
                    };
                    futures.add(pool.submit(RequestContextHolder.wrap(update)));
                }
            }
            start.countDown();

            int winners = 0;
            int conflicts = 0;
            for (Future<User> future : futures) {
                try {
                    future.get(5, TimeUnit.SECONDS);
                    winners++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(OptimisticConflictException.class);
                    conflicts++;
                }
            }
            pool.shutdown();

            assertThat(winners).isEqualTo(1);
            assertThat(conflicts).isEqualTo(7);
            assertThat(usersOf("t1")).singleElement().extracting(User::version).isEqualTo(2L);
        }

        @Test
        @DisplayName("rejects changes to lifecycle fields")
        void rejectsMetaChange() {
            User alice = createUser("t1", "alice@t1.io");

            assertThatThrownBy(() -> inTenant("t1", () -> gateway.execute(DataOperation.update(User.class,
                    alice.id(), 1, u -> u.withMeta(u.meta().updated(u.meta().createdAt()))))))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("executeAsync()")
    class Async {

        @Test
        @DisplayName("uses the tenant captured at submission, not the one of the running thread")
        void snapshotsTenant() throws Exception {
            createUser("t1", "alice@t1.io");
            createUser("t2", "bob@t2.io");
            List<Runnable> pending = new ArrayList<>();

            CompletableFuture<List<User>> future = inTenant("t1", () -> gateway.executeAsync(
                    DataOperation.findMany(User.class, Criteria.all()), pending::add));
            inTenant("t2", () -> {
                pending.forEach(Runnable::run);
                return null;
            });

            assertThat(future.get(1, TimeUnit.SECONDS)).extracting(User::email).containsExactly("alice@t1.io");
        }

        @Test
        @DisplayName("rejects submission without a tenant before anything is scheduled")
        void rejectsSynchronously() {
            List<Runnable> pending = new ArrayList<>();

            assertThatThrownBy(() -> gateway.executeAsync(DataOperation.findMany(User.class, Criteria.all()),
                    pending::add))
                    .isInstanceOf(TenantScopeViolationException.class);
            assertThat(pending).isEmpty();
        }
    }

    @Nested
    @DisplayName("aggregates")
    class Aggregates {

        @Test
        @DisplayName("aggregate only the tenant's records")
        void scopedSum() {
            inTenant("t1", () -> gateway.execute(DataOperation.create(User.class,
                    User.create("a@t1.io", "A", Set.of("user", "admin")))));
            createUser("t1", "b@t1.io");
            createUser("t2", "c@t2.io");

            OptionalDouble roles = inTenant("t1", () -> gateway.execute(DataOperation.aggregate(User.class,
                    Criteria.all(), AggregateFunction.SUM, u -> u.roleNames().size())));

            assertThat(roles).hasValue(3.0);
        }

        @Test
        @DisplayName("are empty when nothing matches")
        void emptyWhenNoRows() {
            OptionalDouble max = inTenant("t9", () -> gateway.execute(DataOperation.aggregate(User.class,
                    Criteria.all(), AggregateFunction.MAX, u -> u.roleNames().size())));

            assertThat(max).isEmpty();
        }
    }

    @Nested
    @DisplayName("store failures")
    class Failures {

        @Test
        @DisplayName("surface as UnavailableException, distinct from scope violations")
        void wrapsStoreFailures() {
            store.failing(true);

            assertThatThrownBy(() -> usersOf("t1"))
                    .isInstanceOf(UnavailableException.class)
                    .hasCauseInstanceOf(RecordStoreException.class);
            assertThat(auditSink.securityEvents()).isEmpty();
        }

        @Test
        @DisplayName("are timed with an unavailable outcome")
        void timesFailures() {
            createUser("t1", "alice@t1.io");
            store.failing(true);
            try {
                usersOf("t1");
            } catch (UnavailableException expected) {
                assertThat(expected).hasMessageContaining("findMany");
            }

            Timer failed = registry.find(TenantScopedGateway.OPERATIONS_METRIC)
                    .tag("operation", "findMany").tag("outcome", "unavailable").timer();
            Timer created = registry.find(TenantScopedGateway.OPERATIONS_METRIC)
                    .tag("operation", "create").tag("outcome", "success").tag("tenant", "t1").timer();
            assertThat(failed).isNotNull();
            assertThat(failed.count()).isEqualTo(1);
            assertThat(created).isNotNull();
            assertThat(created.count()).isEqualTo(1);
        }
    }
}

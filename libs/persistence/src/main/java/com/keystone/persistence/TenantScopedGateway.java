package com.keystone.persistence;

import com.keystone.audit.AuditAction;
import com.keystone.audit.AuditEmitter;
import com.keystone.context.ContextKey;
import com.keystone.context.RequestContext;
import com.keystone.context.RequestContextHolder;
import com.keystone.observability.MetricFactory;
import com.keystone.persistence.model.StoredRecord;
import com.keystone.persistence.model.TenantScoped;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.stream.DoubleStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The only path from application code to the {@link RecordStore}.
 *
 * <p>For record types marked {@link TenantScoped} every operation is confined to the tenant of the
 * current request: the tenant is added to the criteria of reads, updates and deletes, and stamped
 * into created records. Running such an operation with no resolved tenant fails with
 * {@link TenantScopeViolationException} and is recorded as a security event. Other record types
 * pass through unscoped.
 *
 * <p>Unique keys of a create are checked among the records of the created record's tenant, in the
 * same atomic store step as the insert.
 *
 * <p>With soft delete enabled, deletes set the record's {@code deletedAt} marker instead of
 * removing it, and reads skip marked records unless the operation asks for them.
 *
 * <p>System code that must work across tenants calls {@link #withoutTenantScope(String, Supplier)};
 * every such call is audited.
 */
public final class TenantScopedGateway {

    private static final Logger log = LoggerFactory.getLogger(TenantScopedGateway.class);

    /** Reason of the active tenant-scope bypass, present only inside {@link #withoutTenantScope}. */
    public static final ContextKey<String> SCOPE_BYPASS = ContextKey.of("tenantScopeBypass", String.class);

    static final String OPERATIONS_METRIC = "keystone.gateway.operations";

    private final RecordStore store;
    private final AuditEmitter audit;
    private final MetricFactory metrics;
    private final Clock clock;
    private final boolean softDelete;

    public TenantScopedGateway(RecordStore store, AuditEmitter audit, MetricFactory metrics, Clock clock,
                               boolean softDelete) {
        if (store == null || audit == null || metrics == null || clock == null) {
            throw new IllegalArgumentException("store, audit, metrics and clock must not be null");
        }
        this.store = store;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
        this.softDelete = softDelete;
    }

    /**
     * Runs {@code operation} in the scope of the current request.
     *
     * @throws TenantScopeViolationException if the type is tenant-scoped and no tenant is resolved
     * @throws OptimisticConflictException   if an update names a stale version
     * @throws RecordNotFoundException       if an update targets no live record in scope
     * @throws UnavailableException          if the store fails
     */
    public <T extends StoredRecord<T>, R> R execute(DataOperation<T, R> operation) {
        Scope scope = scopeFor(operation);
        return run(operation, scope);
    }

    /**
     * Runs {@code operation} on {@code executor}. The scope is captured before this method returns,
     * so the operation never reads the request context of whatever thread runs it.
     *
     * @throws TenantScopeViolationException synchronously, as {@link #execute}
     */
    public <T extends StoredRecord<T>, R> CompletableFuture<R> executeAsync(
            DataOperation<T, R> operation, Executor executor) {
        Scope scope = scopeFor(operation);
        return CompletableFuture.supplyAsync(() -> run(operation, scope), executor);
    }

    /**
     * Runs {@code work} with tenant scoping switched off. The ambient tenant is cleared for the
     * duration of the call and the previous state, including "no tenant", is restored afterwards,
     * whether {@code work} returns or throws.
     *
     * @param reason why cross-tenant access is needed; recorded in the audit trail
     */
    public <T> T withoutTenantScope(String reason, Supplier<T> work) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason must not be null or blank");
        }
        RequestContext current = RequestContextHolder.snapshot();
        Map<String, Object> details = new LinkedHashMap<>();
        current.get(ContextKey.TENANT_ID).ifPresent(t -> details.put("previousTenantId", t));
        audit.recordSecurityEvent(AuditAction.TENANT_SCOPE_BYPASS, "TenantScope", reason, details);
        log.info("Tenant scope bypassed: {}", reason);

        RequestContext unscoped = current.without(ContextKey.TENANT_ID).with(SCOPE_BYPASS, reason);
        return RequestContextHolder.supplyWithContext(unscoped, work);
    }

    public void withoutTenantScope(String reason, Runnable work) {
        withoutTenantScope(reason, () -> {
            work.run();
            return null;
        });
    }

    /** Whether the current thread runs inside {@link #withoutTenantScope}. */
    public static boolean isScopeBypassed() {
        return RequestContextHolder.get(SCOPE_BYPASS).isPresent();
    }

    public boolean softDeleteEnabled() {
        return softDelete;
    }

    private Scope scopeFor(DataOperation<?, ?> operation) {
        Class<?> type = operation.type();
        if (!TenantScoped.class.isAssignableFrom(type)) {
            return Scope.UNSCOPED;
        }
        Optional<String> tenantId = RequestContextHolder.get(ContextKey.TENANT_ID);
        if (tenantId.isPresent()) {
            return new Scope(true, tenantId.get());
        }
        if (isScopeBypassed()) {
            return Scope.UNSCOPED;
        }
        throw violation(type, operation.name() + " on tenant-scoped " + type.getSimpleName()
                + " without a resolved tenant");
    }

    private <T extends StoredRecord<T>, R> R run(DataOperation<T, R> operation, Scope scope) {
        Timer.Sample sample = Timer.start(metrics.registry());
        try {
            R result = dispatch(operation, scope);
            sample.stop(timer(operation, "success"));
            return result;
        } catch (RecordStoreException e) {
            sample.stop(timer(operation, "unavailable"));
            throw new UnavailableException("Record store failed during %s on %s"
                    .formatted(operation.name(), operation.type().getSimpleName()), e);
        } catch (RuntimeException e) {
            sample.stop(timer(operation, "failure"));
            throw e;
        }
    }

    @SuppressWarnings("unchecked")
    private <T extends StoredRecord<T>, R> R dispatch(DataOperation<T, R> operation, Scope scope) {
        if (operation instanceof DataOperation.Create) {
            return (R) create((DataOperation.Create<T>) operation, scope);
        }
        if (operation instanceof DataOperation.FindById) {
            var findById = (DataOperation.FindById<T>) operation;
            return (R) findLive(findById.type(), findById.id(), scope, findById.deletedIncluded());
        }
        if (operation instanceof DataOperation.FindMany) {
            var findMany = (DataOperation.FindMany<T>) operation;
            return (R) store.find(findMany.type(), scoped(findMany.criteria(), scope, findMany.deletedIncluded()));
        }
        if (operation instanceof DataOperation.Count) {
            var count = (DataOperation.Count<T>) operation;
            return (R) Long.valueOf(store.count(count.type(), scoped(count.criteria(), scope, count.deletedIncluded())));
        }
        if (operation instanceof DataOperation.Aggregate) {
            return (R) aggregate((DataOperation.Aggregate<T>) operation, scope);
        }
        if (operation instanceof DataOperation.Update) {
            return (R) update((DataOperation.Update<T>) operation, scope);
        }
        if (operation instanceof DataOperation.Delete) {
            return (R) Boolean.valueOf(delete((DataOperation.Delete<T>) operation, scope));
        }
        throw new IllegalArgumentException("Unsupported operation " + operation);
    }

    private <T extends StoredRecord<T>> T create(DataOperation.Create<T> create, Scope scope) {
        T payload = create.payload();
        if (payload.meta().isSaved()) {
            throw new IllegalArgumentException("create payload must not carry an id");
        }
        if (payload instanceof TenantScoped<?> scopedPayload) {
            String payloadTenant = scopedPayload.tenantId();
            if (scope.scoped()) {
                if (payloadTenant != null && !payloadTenant.equals(scope.tenantId())) {
                    throw violation(create.type(), "create of %s for tenant '%s' inside tenant '%s'"
                            .formatted(create.type().getSimpleName(), payloadTenant, scope.tenantId()));
                }
                payload = stampTenant(payload, scope.tenantId());
            } else if (payloadTenant == null) {
                throw violation(create.type(), "create of tenant-scoped %s without a tenant"
                        .formatted(create.type().getSimpleName()));
            }
        }
        T stored = payload.withMeta(payload.meta().created(UUID.randomUUID().toString(), clock.instant()));
        List<RecordStore.UniqueConstraint<T>> constraints = new ArrayList<>();
        for (DataOperation.UniqueKey<T> key : create.uniqueKeys()) {
            Object value = key.accessor().apply(stored);
            Criteria<T> conflicts = Criteria.<T>where(key.field(), key.accessor(), value);
            if (stored instanceof TenantScoped<?> scopedRecord) {
                conflicts = conflicts.andTenant(scopedRecord.tenantId());
            }
            if (softDelete && !key.deletedIncluded()) {
                conflicts = conflicts.andNotDeleted();
            }
            constraints.add(new RecordStore.UniqueConstraint<>(key.field(), value, conflicts));
        }
        return store.insert(create.type(), stored, constraints);
    }

    @SuppressWarnings("unchecked")
    private static <T extends StoredRecord<T>> T stampTenant(T payload, String tenantId) {
        return (T) ((TenantScoped<?>) payload).withTenantId(tenantId);
    }

    private <T extends StoredRecord<T>> OptionalDouble aggregate(DataOperation.Aggregate<T> aggregate, Scope scope) {
        List<T> rows = store.find(aggregate.type(), scoped(aggregate.criteria(), scope, aggregate.deletedIncluded()));
        if (rows.isEmpty()) {
            return OptionalDouble.empty();
        }
        DoubleStream values = rows.stream().mapToDouble(aggregate.field());
        return switch (aggregate.function()) {
            case SUM -> OptionalDouble.of(values.sum());
            case MIN -> values.min();
            case MAX -> values.max();
            case AVG -> values.average();
        };
    }

    private <T extends StoredRecord<T>> T update(DataOperation.Update<T> update, Scope scope) {
        String typeName = update.type().getSimpleName();
        T current = findLive(update.type(), update.id(), scope, false)
                .orElseThrow(() -> new RecordNotFoundException(typeName, update.id()));
        if (current.version() != update.expectedVersion()) {
            throw new OptimisticConflictException(typeName, update.id(), update.expectedVersion(), current.version());
        }
        T changed = update.change().apply(current);
        if (changed == null || !current.meta().equals(changed.meta())) {
            throw new IllegalArgumentException("update of %s must not change its lifecycle fields".formatted(typeName));
        }
        if (current instanceof TenantScoped<?> before
                && !before.tenantId().equals(((TenantScoped<?>) changed).tenantId())) {
            throw violation(update.type(), "update of %s %s tried to move it to another tenant"
                    .formatted(typeName, update.id()));
        }
        T next = changed.withMeta(current.meta().updated(clock.instant()));
        return store.replace(update.type(), next, update.expectedVersion());
    }

    private <T extends StoredRecord<T>> boolean delete(DataOperation.Delete<T> delete, Scope scope) {
        Optional<T> current = findLive(delete.type(), delete.id(), scope, false);
        if (current.isEmpty()) {
            return false;
        }
        if (softDelete) {
            T record = current.get();
            store.replace(delete.type(), record.withMeta(record.meta().deleted(clock.instant())), record.version());
            return true;
        }
        return store.remove(delete.type(), delete.id());
    }

    private <T extends StoredRecord<T>> Optional<T> findLive(Class<T> type, String id, Scope scope, boolean includeDeleted) {
        return store.findById(type, id)
                .filter(record -> !scope.scoped() || scope.tenantId().equals(((TenantScoped<?>) record).tenantId()))
                .filter(record -> includeDeleted || !softDelete || !record.isDeleted());
    }

    private <T extends StoredRecord<T>> Criteria<T> scoped(Criteria<T> criteria, Scope scope, boolean includeDeleted) {
        Criteria<T> result = criteria;
        if (scope.scoped()) {
            result = result.andTenant(scope.tenantId());
        }
        if (softDelete && !includeDeleted) {
            result = result.andNotDeleted();
        }
        return result;
    }

    private TenantScopeViolationException violation(Class<?> type, String message) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("recordType", type.getSimpleName());
        audit.recordSecurityEvent(AuditAction.TENANT_SCOPE_VIOLATION, type.getSimpleName(), message, details);
        log.error("Tenant scope violation: {}", message);
        return new TenantScopeViolationException(type.getSimpleName(), message);
    }

    private Timer timer(DataOperation<?, ?> operation, String outcome) {
        return metrics.timer(OPERATIONS_METRIC, "Data gateway operations",
                "operation", operation.name(), "type", operation.type().getSimpleName(), "outcome", outcome);
    }

    private record Scope(boolean scoped, String tenantId) {
        static final Scope UNSCOPED = new Scope(false, null);
    }
}

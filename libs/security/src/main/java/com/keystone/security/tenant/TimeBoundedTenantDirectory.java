package com.keystone.security.tenant;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds every lookup of a delegate {@link TenantDirectory} by a timeout. A lookup that fails,
 * times out or is interrupted surfaces as {@link TenantLookupException}.
 */
public final class TimeBoundedTenantDirectory implements TenantDirectory {

    private final TenantDirectory delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public TimeBoundedTenantDirectory(TenantDirectory delegate, Duration timeout, ExecutorService executor) {
        if (delegate == null || timeout == null || executor == null) {
            throw new IllegalArgumentException("delegate, timeout and executor must not be null");
        }
        this.delegate = delegate;
        this.timeout = timeout;
        this.executor = executor;
    }

    @Override
    public Optional<String> findTenantIdBySlug(String slug) {
        return await("slug " + slug, () -> delegate.findTenantIdBySlug(slug));
    }

    @Override
    public TenantStatus findStatus(String tenantId) {
        return await("status of " + tenantId, () -> delegate.findStatus(tenantId));
    }

    private <T> T await(String what, Callable<T> lookup) {
        Future<T> future = executor.submit(lookup);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TenantLookupException("Tenant lookup (%s) timed out after %d ms"
                    .formatted(what, timeout.toMillis()), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TenantLookupException("Tenant lookup (%s) interrupted".formatted(what), e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TenantLookupException lookupFailure) {
                throw lookupFailure;
            }
            throw new TenantLookupException("Tenant lookup (%s) failed".formatted(what), e.getCause());
        }
    }
}

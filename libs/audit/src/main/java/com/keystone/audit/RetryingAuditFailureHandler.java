package com.keystone.audit;

import com.keystone.observability.MetricFactory;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parks failed entries in a bounded queue so they can be written again later via
 * {@link #retryPending()}, typically from a scheduled job.
 *
 * <p>An entry is retried only against the sinks that failed to store it, as reported by
 * {@link AuditWriteException#failedSinks()}. When the queue is full the oldest parked entry is
 * dropped to make room, logged at ERROR and counted in {@value #DROPPED_METRIC}.
 */
public class RetryingAuditFailureHandler implements AuditFailureHandler {

    private static final Logger log = LoggerFactory.getLogger(RetryingAuditFailureHandler.class);

    static final String DROPPED_METRIC = "keystone.audit.dropped";

    private final AuditSink sink;
    private final int capacity;
    private final MetricFactory metrics;
    private final Deque<Pending> pending = new ArrayDeque<>();
    private final AtomicLong dropped = new AtomicLong();

    /**
     * @param sink     sink to retry against when a failure does not name the sinks that failed
     * @param capacity maximum number of parked entries
     * @param metrics  factory for the dropped-entries counter
     */
    public RetryingAuditFailureHandler(AuditSink sink, int capacity, MetricFactory metrics) {
        if (sink == null || metrics == null) {
            throw new IllegalArgumentException("sink and metrics must not be null");
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.sink = sink;
        this.capacity = capacity;
        this.metrics = metrics;
    }

    @Override
    public void onWriteFailure(AuditEntry entry, RuntimeException cause) {
        park(entry, cause, sink);
    }

    /**
     * Attempts every parked entry once. Entries that fail again are parked again.
     *
     * @return number of entries written
     */
    public int retryPending() {
        List<Pending> batch;
        synchronized (pending) {
            batch = new ArrayList<>(pending);
            pending.clear();
        }
        int written = 0;
        for (Pending parked : batch) {
            try {
                parked.target().write(parked.entry());
                written++;
            } catch (RuntimeException e) {
                log.warn("Audit entry {} still cannot be written: {}", parked.entry().entryId(), e.getMessage());
                park(parked.entry(), e, parked.target());
            }
        }
        return written;
    }

    public int pendingCount() {
        synchronized (pending) {
            return pending.size();
        }
    }

    public long droppedCount() {
        return dropped.get();
    }

    private void park(AuditEntry entry, RuntimeException cause, AuditSink fallback) {
        AuditSink target = retryTarget(cause, fallback);
        Pending evicted = null;
        synchronized (pending) {
            if (pending.size() >= capacity) {
                evicted = pending.pollFirst();
            }
            pending.addLast(new Pending(entry, target));
        }
        if (evicted != null) {
            dropped.incrementAndGet();
            metrics.counter(DROPPED_METRIC, "Audit entries dropped from a full retry queue",
                    "action", evicted.entry().action().value()).increment();
            log.error("Audit retry queue full, dropping oldest entry {} ({} {})",
                    evicted.entry().entryId(), evicted.entry().action().value(), evicted.entry().resource());
        }
    }

    private static AuditSink retryTarget(RuntimeException cause, AuditSink fallback) {
        if (cause instanceof AuditWriteException writeFailure && !writeFailure.failedSinks().isEmpty()) {
            List<AuditSink> failed = writeFailure.failedSinks();
            return failed.size() == 1 ? failed.get(0) : new CompositeAuditSink(failed);
        }
        return fallback;
    }

    private record Pending(AuditEntry entry, AuditSink target) {
    }
}

package com.keystone.audit;

import com.keystone.observability.MetricFactory;
import com.keystone.observability.SensitiveDataRedactor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records audit entries without letting an audit failure change the outcome of the audited
 * operation.
 *
 * <p>{@link #record(AuditEntry)} redacts the entry's details and writes it to the sink. A sink
 * failure is logged at ERROR, counted in {@code keystone.audit.write.failures} and handed to the
 * {@link AuditFailureHandler}; it is never thrown to the caller.
 *
 * <p>{@link #audited} wraps a business operation: the entry is written before control returns,
 * and the operation's own result or exception is passed through unchanged.
 */
public class AuditEmitter {

    private static final Logger log = LoggerFactory.getLogger(AuditEmitter.class);

    static final String WRITE_FAILURES_METRIC = "keystone.audit.write.failures";

    private final AuditSink sink;
    private final AuditFailureHandler failureHandler;
    private final MetricFactory metrics;
    private final SensitiveDataRedactor redactor;
    private final AuditEntryFactory entries;

    public AuditEmitter(
            AuditSink sink,
            AuditFailureHandler failureHandler,
            MetricFactory metrics,
            SensitiveDataRedactor redactor,
            AuditEntryFactory entries) {
        if (sink == null) {
            throw new IllegalArgumentException("sink must not be null");
        }
        if (failureHandler == null) {
            throw new IllegalArgumentException("failureHandler must not be null");
        }
        this.sink = sink;
        this.failureHandler = failureHandler;
        this.metrics = metrics;
        this.redactor = redactor;
        this.entries = entries;
    }

    /** Emitter with a bounded retry queue, default redaction and a private meter registry. */
    public static AuditEmitter create(AuditSink sink) {
        MetricFactory metrics = new MetricFactory(new SimpleMeterRegistry(), "keystone");
        return new AuditEmitter(
                sink,
                new RetryingAuditFailureHandler(sink, 1_000, metrics),
                metrics,
                new SensitiveDataRedactor(),
                new AuditEntryFactory());
    }

    /**
     * Writes {@code entry}.
     *
     * @return true if the sink stored it, false if it was handed to the failure handler
     */
    public boolean record(AuditEntry entry) {
        AuditEntry redacted = entry.withDetails(redactor.redact(entry.details()));
        try {
            sink.write(redacted);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to write audit entry {} ({} {} {})",
                    redacted.entryId(), redacted.action().value(), redacted.resource(),
                    redacted.outcome(), e);
            metrics.counter(WRITE_FAILURES_METRIC, "Audit entries the sink failed to store",
                    "action", redacted.action().value()).increment();
            failureHandler.onWriteFailure(redacted, e);
            return false;
        }
    }

    /** Records a security event for the current request. */
    public boolean recordSecurityEvent(
            AuditAction action, String resource, String reason, Map<String, Object> details) {
        return record(entries.securityEvent(action, resource, reason, details));
    }

    /** Records the outcome of an operation for the current request. */
    public boolean recordOutcome(
            AuditAction action, String resource, AuditOutcome outcome, String reason,
            Map<String, Object> details) {
        return record(entries.fromContext(action, resource, outcome, reason, details));
    }

    /**
     * Runs {@code operation} and records its outcome before returning. The operation's result or
     * exception reaches the caller unchanged, whatever happens to the audit write.
     */
    public <T> T audited(AuditAction action, String resource, Callable<T> operation) throws Exception {
        T result;
        try {
            result = operation.call();
        } catch (Exception e) {
            recordOutcome(action, resource, AuditOutcome.FAILURE, describe(e), Map.of());
            throw e;
        }
        recordOutcome(action, resource, AuditOutcome.SUCCESS, null, Map.of());
        return result;
    }

    public AuditEntryFactory entryFactory() {
        return entries;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}

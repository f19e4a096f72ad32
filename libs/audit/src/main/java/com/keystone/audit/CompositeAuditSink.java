package com.keystone.audit;

import java.util.ArrayList;
import java.util.List;

/**
 * Fans an entry out to several sinks. Every sink is attempted; if any of them fails, an
 * {@link AuditWriteException} naming the failed sinks is thrown afterwards, with the other failures
 * suppressed into it.
 */
public class CompositeAuditSink implements AuditSink {

    private final List<AuditSink> sinks;

    public CompositeAuditSink(List<AuditSink> sinks) {
        if (sinks == null || sinks.isEmpty()) {
            throw new IllegalArgumentException("sinks must not be null or empty");
        }
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public void write(AuditEntry entry) {
        List<AuditSink> failed = new ArrayList<>();
        List<RuntimeException> causes = new ArrayList<>();
        for (AuditSink sink : sinks) {
            try {
                sink.write(entry);
            } catch (RuntimeException e) {
                failed.add(sink);
                causes.add(e);
            }
        }
        if (failed.isEmpty()) {
            return;
        }
        AuditWriteException failure = new AuditWriteException(
                "Audit sink " + failed.get(0).getClass().getSimpleName() + " failed", causes.get(0), failed);
        causes.stream().skip(1).forEach(failure::addSuppressed);
        throw failure;
    }
}

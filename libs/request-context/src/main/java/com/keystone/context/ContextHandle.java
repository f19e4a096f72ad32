package com.keystone.context;

/**
 * Handle returned by {@link RequestContextHolder#begin()}. Closing it ends the context and
 * restores whatever context was active before it began.
 *
 * <pre>
 * try (ContextHandle handle = RequestContextHolder.begin()) {
 *     RequestContextHolder.set(ContextKey.TENANT_ID, "t1");
 *     ...
 * }
 * </pre>
 */
public final class ContextHandle implements AutoCloseable {

    private final String requestId;
    private final Thread owner;
    private boolean ended;

    ContextHandle(String requestId, Thread owner) {
        this.requestId = requestId;
        this.owner = owner;
    }

    public String requestId() {
        return requestId;
    }

    Thread owner() {
        return owner;
    }

    boolean isEnded() {
        return ended;
    }

    void markEnded() {
        ended = true;
    }

    @Override
    public void close() {
        RequestContextHolder.end(this);
    }
}

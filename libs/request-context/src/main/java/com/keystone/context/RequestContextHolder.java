package com.keystone.context;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Thread-local store for the {@link RequestContext} of the request running on the current thread,
 * with an SLF4J MDC bridge.
 *
 * <p>Contexts are kept as a stack of frames. {@link #begin()} pushes a frame, {@link #end} pops it
 * and restores the enclosing frame, so a pooled thread returns to exactly the state it had before
 * the request. Each frame holds an immutable snapshot; {@link #set} replaces the snapshot of the
 * current frame only.
 *
 * <p>Work handed to another thread must carry a snapshot explicitly: use {@link #wrap(Runnable)},
 * {@link #wrap(Callable)}, {@link #propagating(Executor)} or
 * {@link #runWithContext(RequestContext, Runnable)}. The receiving thread starts its own frame from
 * the snapshot, so writes on either side stay invisible to the other.
 *
 * <p>MDC keys {@code requestId}, {@code tenantId} and {@code actorId} always mirror the current
 * frame and are removed when no frame is active.
 */
public final class RequestContextHolder {

    /** MDC key for the request id. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for the tenant id. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for the actor id. */
    public static final String MDC_ACTOR_ID = "actorId";

    private static final ThreadLocal<Frame> CURRENT = new ThreadLocal<>();

    private RequestContextHolder() {
        // utility class
    }

    /** Begins a new context with a random request id. */
    public static ContextHandle begin() {
        return begin(UUID.randomUUID().toString());
    }

    /**
     * Begins a new context on the current thread, seeded with the given request id.
     *
     * @param requestId opaque request id (must not be blank)
     * @return handle that must be passed to {@link #end} (or closed) on the same thread
     */
    public static ContextHandle begin(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be null or blank");
        }
        var handle = new ContextHandle(requestId, Thread.currentThread());
        push(handle, RequestContext.empty().with(ContextKey.REQUEST_ID, requestId));
        return handle;
    }

    /**
     * Ends the context opened by {@code handle} and restores the enclosing one. Ending an already
     * ended handle is a no-op.
     *
     * @throws IllegalStateException if called from another thread, or if a nested context opened
     *     after {@code handle} is still active
     */
    public static void end(ContextHandle handle) {
        if (handle == null || handle.isEnded()) {
            return;
        }
        if (handle.owner() != Thread.currentThread()) {
            throw new IllegalStateException("context handle must be ended on the thread that began it");
        }
        Frame frame = CURRENT.get();
        if (frame == null || frame.handle != handle) {
            throw new IllegalStateException(
                    "context " + handle.requestId() + " is not the innermost active context");
        }
        handle.markEnded();
        pop(frame);
    }

    /** Whether a context is active on the current thread. */
    public static boolean isActive() {
        return CURRENT.get() != null;
    }

    /**
     * Binds {@code value} under {@code key} in the current context. A {@code null} value removes
     * the key.
     *
     * @throws IllegalStateException if no context is active
     */
    public static <T> void set(ContextKey<T> key, T value) {
        Frame frame = requireFrame();
        frame.context = frame.context.with(key, value);
        syncMdc(frame.context);
    }

    /** Removes {@code key} from the current context, if a context is active. */
    public static void clear(ContextKey<?> key) {
        Frame frame = CURRENT.get();
        if (frame != null) {
            frame.context = frame.context.without(key);
            syncMdc(frame.context);
        }
    }

    /**
     * Returns the value bound to {@code key} in the current context. Empty when the key is unset
     * or no context is active.
     */
    public static <T> Optional<T> get(ContextKey<T> key) {
        Frame frame = CURRENT.get();
        return frame == null ? Optional.empty() : frame.context.get(key);
    }

    /** Returns the current snapshot, or an empty snapshot when no context is active. */
    public static RequestContext snapshot() {
        Frame frame = CURRENT.get();
        return frame == null ? RequestContext.empty() : frame.context;
    }

    /** Returns the current snapshot, if a context is active. */
    public static Optional<RequestContext> current() {
        return Optional.ofNullable(CURRENT.get()).map(f -> f.context);
    }

    /**
     * Runs {@code runnable} with {@code context} as the current context, then restores the previous
     * state of this thread.
     */
    public static void runWithContext(RequestContext context, Runnable runnable) {
        Frame frame = push(null, context);
        try {
            runnable.run();
        } finally {
            pop(frame);
        }
    }

    /**
     * Calls {@code callable} with {@code context} as the current context, then restores the
     * previous state of this thread.
     */
    public static <T> T callWithContext(RequestContext context, Callable<T> callable) throws Exception {
        Frame frame = push(null, context);
        try {
            return callable.call();
        } finally {
            pop(frame);
        }
    }

    /**
     * Like {@link #callWithContext} for work that throws no checked exceptions.
     */
    public static <T> T supplyWithContext(RequestContext context, Supplier<T> supplier) {
        Frame frame = push(null, context);
        try {
            return supplier.get();
        } finally {
            pop(frame);
        }
    }

    /** Captures the current snapshot now and returns a runnable that runs under it. */
    public static Runnable wrap(Runnable runnable) {
        RequestContext captured = snapshot();
        return () -> runWithContext(captured, runnable);
    }

    /** Captures the current snapshot now and returns a callable that runs under it. */
    public static <T> Callable<T> wrap(Callable<T> callable) {
        RequestContext captured = snapshot();
        return () -> callWithContext(captured, callable);
    }

    /**
     * Returns an executor that captures the submitting thread's snapshot at submission time and
     * installs it for the duration of each task.
     */
    public static Executor propagating(Executor delegate) {
        return command -> delegate.execute(wrap(command));
    }

    /** Drops every frame on this thread. Test support only. */
    static void reset() {
        CURRENT.remove();
        clearMdc();
    }

    private static Frame requireFrame() {
        Frame frame = CURRENT.get();
        if (frame == null) {
            throw new IllegalStateException("no request context is active on this thread");
        }
        return frame;
    }

    private static Frame push(ContextHandle handle, RequestContext context) {
        var frame = new Frame(handle, context == null ? RequestContext.empty() : context, CURRENT.get());
        CURRENT.set(frame);
        syncMdc(frame.context);
        return frame;
    }

    private static void pop(Frame frame) {
        Frame parent = frame.parent;
        if (parent == null) {
            CURRENT.remove();
            clearMdc();
        } else {
            CURRENT.set(parent);
            syncMdc(parent.context);
        }
    }

    private static void syncMdc(RequestContext context) {
        setMdc(MDC_REQUEST_ID, context.get(ContextKey.REQUEST_ID).orElse(null));
        setMdc(MDC_TENANT_ID, context.get(ContextKey.TENANT_ID).orElse(null));
        setMdc(MDC_ACTOR_ID, context.get(ContextKey.ACTOR_ID).orElse(null));
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(MDC_REQUEST_ID);
        MDC.remove(MDC_TENANT_ID);
        MDC.remove(MDC_ACTOR_ID);
    }

    private static final class Frame {
        private final ContextHandle handle;
        private final Frame parent;
        private RequestContext context;

        private Frame(ContextHandle handle, RequestContext context, Frame parent) {
            this.handle = handle;
            this.context = context;
            this.parent = parent;
        }
    }
}

package com.edushield.observability;

import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link TraceContext} with SLF4J MDC bridge.
 * <p>
 * Setting a context populates the MDC keys traceId, userId, role and sessionId; clearing
 * it removes them. Work handed to another thread must carry the context explicitly,
 * for example through {@link #callWithContext(TraceContext, Supplier)}.
 */
public final class TraceContextHolder {

    private static final ThreadLocal<TraceContext> CONTEXT = new ThreadLocal<>();

    private TraceContextHolder() {
        // utility class
    }

    /**
     * Sets the trace context for the current thread and populates SLF4J MDC.
     *
     * @param context the trace context (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(TraceContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's trace context, if set.
     */
    public static Optional<TraceContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Returns the current trace id, if a context is set.
     */
    public static Optional<String> currentTraceId() {
        return get().map(TraceContext::traceId);
    }

    /**
     * Clears the trace context and removes its MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Runs {@code runnable} with the given context set, then restores the previous
     * context (or clears if there was none).
     */
    public static void runWithContext(TraceContext context, Runnable runnable) {
        callWithContext(context, () -> {
            runnable.run();
            return null;
        });
    }

    /**
     * Calls {@code supplier} with the given context set, then restores the previous
     * context (or clears if there was none).
     *
     * @return the supplier's result
     */
    public static <T> T callWithContext(TraceContext context, Supplier<T> supplier) {
        TraceContext previous = CONTEXT.get();
        try {
            set(context);
            return supplier.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(TraceContext ctx) {
        setMdc(TraceContext.MDC_TRACE_ID, ctx.traceId());
        setMdc(TraceContext.MDC_USER_ID, ctx.userId());
        setMdc(TraceContext.MDC_ROLE, ctx.role());
        setMdc(TraceContext.MDC_SESSION_ID, ctx.sessionId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(TraceContext.MDC_TRACE_ID);
        MDC.remove(TraceContext.MDC_USER_ID);
        MDC.remove(TraceContext.MDC_ROLE);
        MDC.remove(TraceContext.MDC_SESSION_ID);
    }
}

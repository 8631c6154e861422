package com.tally.observability;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link CorrelationContext} with an SLF4J MDC bridge.
 *
 * <p>Setting a context populates the MDC keys; clearing it removes them. Servlet containers reuse
 * threads, so callers must clear in a {@code finally} block. Work handed to another thread must
 * carry the context explicitly, e.g. through {@link #runWithContext(CorrelationContext, Runnable)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        putOrRemove(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        putOrRemove(CorrelationContext.MDC_REQUEST_ID, context.requestId());
        putOrRemove(CorrelationContext.MDC_CLIENT_ADDRESS, context.clientAddress());
    }

    /** Returns the current thread's context, if any. */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Returns the current correlation ID, if a context is set. */
    public static Optional<String> correlationId() {
        return get().map(CorrelationContext::correlationId);
    }

    /** Clears the context and its MDC keys for the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_CLIENT_ADDRESS);
    }

    /**
     * Runs {@code runnable} with {@code context} set, then restores whatever was set before (or
     * clears if nothing was).
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}

package com.caseflow.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * When a correlation context is set, the MDC keys (correlationId, aggregateId, actorId,
 * requestId) are populated so that every log statement on this thread includes them. When
 * cleared, all MDC keys are removed.
 * <p>
 * Work handed to a thread pool does not inherit the context; use {@link #wrap(Runnable)} or
 * {@link #runWithContext(CorrelationContext, Runnable)} to carry it across.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // Utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @param context the correlation context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's correlation context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the correlation context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Executes a {@link Runnable} with the given correlation context set, then restores
     * the previous context (or clears if there was none).
     *
     * @param context the correlation context for the duration of the runnable
     * @param runnable the work to execute
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        callWithContext(
                context,
                () -> {
                    runnable.run();
                    return null;
                });
    }

    /**
     * Like {@link #runWithContext} but returns the work's result.
     *
     * @param context the correlation context for the duration of the call
     * @param work the work to execute
     */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> work) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /**
     * Captures the current thread's context and returns a runnable that runs the given work
     * under it, for submission to an executor. Returns the work unchanged when no context is set.
     */
    public static Runnable wrap(Runnable runnable) {
        CorrelationContext captured = CONTEXT.get();
        if (captured == null) {
            return runnable;
        }
        return () -> runWithContext(captured, runnable);
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_AGGREGATE_ID, ctx.aggregateId());
        setMdc(CorrelationContext.MDC_ACTOR_ID, ctx.actorId());
        setMdc(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_AGGREGATE_ID);
        MDC.remove(CorrelationContext.MDC_ACTOR_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
    }
}

package com.lumen.observability;

import org.slf4j.MDC;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Holds the {@link CorrelationContext} of the gateway operation running on the current thread and
 * mirrors it into the SLF4J MDC.
 * <p>
 * The servlet thread of a request gets its context from the web filter. A streaming run outlives
 * that thread: its events, cancellation and completion are signalled on scheduler threads where
 * nothing is set. The dispatcher therefore captures the context when it opens the run and re-enters
 * it around each callback with {@link #runWithContext} or {@link #bind}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private static final Map<String, Function<CorrelationContext, String>> MDC_FIELDS = Map.of(
            CorrelationContext.MDC_CORRELATION_ID, CorrelationContext::correlationId,
            CorrelationContext.MDC_USER_ID, CorrelationContext::userId,
            CorrelationContext.MDC_OPERATION, CorrelationContext::operation,
            CorrelationContext.MDC_REQUEST_ID, CorrelationContext::requestId);

    private CorrelationContextHolder() {
    }

    /**
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        MDC_FIELDS.forEach((key, field) -> {
            String value = field.apply(context);
            if (value != null) {
                MDC.put(key, value);
            } else {
                MDC.remove(key);
            }
        });
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Removes the context and its MDC keys. Servlet threads are pooled, so every request ends here. */
    public static void clear() {
        CONTEXT.remove();
        MDC_FIELDS.keySet().forEach(MDC::remove);
    }

    /**
     * Runs {@code work} under {@code context}, then puts back whatever the thread held before.
     */
    public static void runWithContext(CorrelationContext context, Runnable work) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            work.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /** Wraps {@code work} so that it runs under {@code context} on whichever thread invokes it. */
    public static Runnable bind(CorrelationContext context, Runnable work) {
        return () -> runWithContext(context, work);
    }
}

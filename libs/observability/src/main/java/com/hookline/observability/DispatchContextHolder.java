package com.hookline.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * The {@link DispatchContext} of the delivery being dispatched on the current thread, mirrored into
 * the SLF4J MDC so handler log lines carry {@code eventName}, {@code eventAction},
 * {@code repository} and {@code deliveryId}.
 *
 * <p>Dispatch opens a scope per delivery:
 *
 * <pre>{@code
 * try (DispatchContextHolder.Scope ignored = DispatchContextHolder.open(context)) {
 *     runHooks();
 * }
 * }</pre>
 *
 * Closing the scope puts back whatever context was current before it, so a hook that dispatches
 * a nested delivery does not lose the outer one.
 */
public final class DispatchContextHolder {

    private static final ThreadLocal<DispatchContext> CURRENT = new ThreadLocal<>();

    private DispatchContextHolder() {
        // utility class
    }

    /** A dispatch scope; closing it restores the previous context. Never throws on close. */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * Makes {@code context} current until the returned scope is closed.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static Scope open(DispatchContext context) {
        DispatchContext previous = CURRENT.get();
        set(context);
        return () -> restore(previous);
    }

    /** Runs {@code runnable} inside a scope for {@code context}. */
    public static void runWithContext(DispatchContext context, Runnable runnable) {
        try (Scope ignored = open(context)) {
            runnable.run();
        }
    }

    /**
     * Replaces the current context without a scope. Prefer {@link #open}.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(DispatchContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CURRENT.set(context);
        mdc(DispatchContext.MDC_EVENT_NAME, context.eventName());
        mdc(DispatchContext.MDC_EVENT_ACTION, context.action());
        mdc(DispatchContext.MDC_REPOSITORY, context.repository());
        mdc(DispatchContext.MDC_DELIVERY_ID, context.deliveryId());
    }

    public static Optional<DispatchContext> get() {
        return Optional.ofNullable(CURRENT.get());
    }

    /** Drops the current context and its MDC keys. */
    public static void clear() {
        CURRENT.remove();
        mdc(DispatchContext.MDC_EVENT_NAME, null);
        mdc(DispatchContext.MDC_EVENT_ACTION, null);
        mdc(DispatchContext.MDC_REPOSITORY, null);
        mdc(DispatchContext.MDC_DELIVERY_ID, null);
    }

    private static void restore(DispatchContext previous) {
        if (previous == null) {
            clear();
        } else {
            set(previous);
        }
    }

    private static void mdc(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}

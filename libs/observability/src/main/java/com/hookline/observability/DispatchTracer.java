package com.hookline.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.concurrent.Callable;

/**
 * Wraps each handler invocation in an OpenTelemetry span.
 * <p>
 * Only the API is used; exporters, samplers and resources are the host's concern. Spans carry
 * {@code hookline.event}, {@code hookline.handler} and, when a {@link DispatchContext} is set,
 * the action, repository and delivery id.
 */
public final class DispatchTracer {

    public static final String INSTRUMENTATION_NAME = "com.hookline";

    public static final String ATTR_EVENT = "hookline.event";
    public static final String ATTR_HANDLER = "hookline.handler";
    public static final String ATTR_ACTION = "hookline.action";
    public static final String ATTR_REPOSITORY = "hookline.repository";
    public static final String ATTR_DELIVERY_ID = "hookline.delivery_id";

    private final Tracer tracer;

    public DispatchTracer(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    public static DispatchTracer of(OpenTelemetry openTelemetry) {
        return new DispatchTracer(openTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    /** A tracer whose spans go nowhere. */
    public static DispatchTracer noop() {
        return of(OpenTelemetry.noop());
    }

    /**
     * Runs one handler inside a span named {@code hook <handlerName>}. The span ends when the
     * work returns or throws; a thrown exception is recorded and rethrown.
     *
     * @throws Exception whatever {@code work} throws
     */
    public <T> T traceHandler(String eventName, String handlerName, Callable<T> work) throws Exception {
        Span span = tracer.spanBuilder("hook " + handlerName)
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(ATTR_EVENT, eventName)
                .setAttribute(ATTR_HANDLER, handlerName)
                .startSpan();

        DispatchContextHolder.get().ifPresent(ctx -> {
            if (ctx.action() != null) {
                span.setAttribute(ATTR_ACTION, ctx.action());
            }
            if (ctx.repository() != null) {
                span.setAttribute(ATTR_REPOSITORY, ctx.repository());
            }
            if (ctx.deliveryId() != null) {
                span.setAttribute(ATTR_DELIVERY_ID, ctx.deliveryId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.call();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public Tracer tracer() {
        return tracer;
    }
}

package com.hookline.hooks;

import com.hookline.eventmodel.EventEnvelope;
import com.hookline.eventmodel.EventFactory;
import com.hookline.observability.DispatchContext;
import com.hookline.observability.DispatchContextHolder;
import com.hookline.observability.DispatchMetrics;
import com.hookline.observability.DispatchTracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parses a delivery and runs the hooks the {@link HookRegistry} selects for it.
 *
 * <p>Hooks run one after another on the calling thread, in registration order. A hook that throws
 * is logged at ERROR and recorded in the {@link DispatchReport}; the remaining hooks still run and
 * the exception never reaches the caller. While hooks run, the delivery's
 * {@link DispatchContext} is in the MDC.
 *
 * <p>There is no timeout: a hook that never returns blocks its {@code dispatch} call.
 */
public final class HookDispatcher {

    private static final Logger log = LoggerFactory.getLogger(HookDispatcher.class);

    private final EventFactory factory;
    private final HookRegistry registry;
    private final DispatchMetrics metrics;
    private final DispatchTracer tracer;

    public HookDispatcher(EventFactory factory, HookRegistry registry) {
        this(factory, registry, DispatchMetrics.noop(), DispatchTracer.noop());
    }

    public HookDispatcher(
            EventFactory factory, HookRegistry registry, DispatchMetrics metrics, DispatchTracer tracer) {
        if (factory == null) {
            throw new IllegalArgumentException("factory must not be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.factory = factory;
        this.registry = registry;
        this.metrics = metrics;
        this.tracer = tracer;
    }

    public DispatchReport dispatch(String eventName, Map<String, ?> payload) {
        return dispatch(eventName, payload, null);
    }

    /**
     * Parses and dispatches one delivery.
     *
     * @param eventName the {@code X-GitHub-Event} header value
     * @param payload the decoded JSON body
     * @param deliveryId the {@code X-GitHub-Delivery} header value, or null
     * @return which hooks ran and which failed
     */
    public DispatchReport dispatch(String eventName, Map<String, ?> payload, String deliveryId) {
        return dispatch(factory.parse(eventName, payload), deliveryId);
    }

    /** Dispatches an already parsed delivery. */
    public DispatchReport dispatch(EventEnvelope envelope, String deliveryId) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope must not be null");
        }
        String eventName = envelope.eventName();
        metrics.eventDispatched(eventName, envelope.fallback());

        HookRegistry.Selection selection =
                registry.select(eventName, envelope.action(), envelope.repositoryFullName());
        if (selection.debugOverride()) {
            log.info("Debug hooks found for event '{}', running only those", eventName);
        }

        DispatchContext context = new DispatchContext(
                eventName,
                envelope.action().orElse(null),
                envelope.repositoryFullName().orElse(null),
                deliveryId);
        List<String> invoked = new ArrayList<>();
        List<HandlerFailure> failures = new ArrayList<>();
        try (DispatchContextHolder.Scope ignored = DispatchContextHolder.open(context)) {
            for (HookRegistration hook : selection.hooks()) {
                invoked.add(hook.name());
                invoke(hook, envelope).ifPresent(failures::add);
            }
        }
        if (selection.hooks().isEmpty()) {
            log.debug("No hooks matched event '{}'", eventName);
        }
        return new DispatchReport(envelope, invoked, failures, selection.debugOverride());
    }

    private Optional<HandlerFailure> invoke(HookRegistration hook, EventEnvelope envelope) {
        String eventName = envelope.eventName();
        log.debug("Evaluating hook '{}'", hook.name());
        long start = System.nanoTime();
        try {
            tracer.traceHandler(eventName, hook.name(), () -> {
                hook.handler().handle(envelope);
                return null;
            });
            metrics.handlerInvoked(eventName, true);
            return Optional.empty();
        } catch (Exception e) {
            log.error("Hook '{}' failed while handling event '{}'", hook.name(), eventName, e);
            metrics.handlerInvoked(eventName, false);
            return Optional.of(new HandlerFailure(hook.name(), e));
        } finally {
            metrics.handlerTimer(eventName).record(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    public HookRegistry registry() {
        return registry;
    }

    public EventFactory factory() {
        return factory;
    }
}

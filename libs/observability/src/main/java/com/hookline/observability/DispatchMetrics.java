package com.hookline.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;

/**
 * Micrometer meters for webhook dispatch.
 * <p>
 * Every meter carries a {@code service} tag. Event names are a closed set (the GitHub event
 * list plus whatever a host maps), so tagging by event keeps cardinality bounded; handler names
 * are deliberately not a tag.
 */
public final class DispatchMetrics {

    public static final String EVENTS_DISPATCHED = "hookline.events.dispatched";
    public static final String HANDLERS_INVOKED = "hookline.handlers.invoked";
    public static final String HANDLER_DURATION = "hookline.handler.duration";

    public static final String TAG_SERVICE = "service";
    public static final String TAG_EVENT = "event";
    public static final String TAG_FALLBACK = "fallback";
    public static final String TAG_OUTCOME = "outcome";

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry the meter registry to publish to
     * @param serviceName logical service name included as the {@code service} tag
     */
    public DispatchMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /** Metrics that record nothing: a composite registry with no children. */
    public static DispatchMetrics noop() {
        return new DispatchMetrics(new CompositeMeterRegistry(), "hookline");
    }

    /** Counts one parsed delivery. */
    public void eventDispatched(String eventName, boolean fallback) {
        Counter.builder(EVENTS_DISPATCHED)
                .description("Webhook deliveries dispatched")
                .tags(baseTags(TAG_EVENT, eventName, TAG_FALLBACK, String.valueOf(fallback)))
                .register(registry)
                .increment();
    }

    /** Counts one handler invocation. */
    public void handlerInvoked(String eventName, boolean success) {
        Counter.builder(HANDLERS_INVOKED)
                .description("Hook handler invocations")
                .tags(baseTags(TAG_EVENT, eventName, TAG_OUTCOME, success ? OUTCOME_SUCCESS : OUTCOME_FAILURE))
                .register(registry)
                .increment();
    }

    /** Timer for handler run time, per event. */
    public Timer handlerTimer(String eventName) {
        return Timer.builder(HANDLER_DURATION)
                .description("Time spent in hook handlers")
                .tags(baseTags(TAG_EVENT, eventName))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        return Tags.of(TAG_SERVICE, serviceName).and(extraTags);
    }
}

package com.hookline.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DispatchMetrics")
class DispatchMetricsTest {

    private SimpleMeterRegistry registry;
    private DispatchMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DispatchMetrics(registry, "webhooks");
    }

    @Test
    @DisplayName("counts dispatched events by event and fallback")
    void eventsDispatched() {
        metrics.eventDispatched("label", false);
        metrics.eventDispatched("label", false);
        metrics.eventDispatched("label", true);

        assertThat(registry.get(DispatchMetrics.EVENTS_DISPATCHED)
                .tags("service", "webhooks", "event", "label", "fallback", "false")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get(DispatchMetrics.EVENTS_DISPATCHED)
                .tags("fallback", "true")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("counts handler outcomes")
    void handlersInvoked() {
        metrics.handlerInvoked("push", true);
        metrics.handlerInvoked("push", false);

        assertThat(registry.get(DispatchMetrics.HANDLERS_INVOKED).tags("outcome", "success").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get(DispatchMetrics.HANDLERS_INVOKED).tags("outcome", "failure").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("handler timer is shared per event")
    void timer() {
        metrics.handlerTimer("push").record(Duration.ofMillis(5));
        metrics.handlerTimer("push").record(Duration.ofMillis(7));

        assertThat(registry.get(DispatchMetrics.HANDLER_DURATION).tags("event", "push").timer().count())
                .isEqualTo(2);
    }

    @Test
    @DisplayName("noop metrics accept calls")
    void noop() {
        DispatchMetrics noop = DispatchMetrics.noop();

        noop.eventDispatched("push", false);
        noop.handlerTimer("push").record(Duration.ofMillis(1));

        assertThat(noop.serviceName()).isEqualTo("hookline");
    }

    @Test
    @DisplayName("rejects a blank service name")
    void validation() {
        assertThatThrownBy(() -> new DispatchMetrics(registry, " ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DispatchMetrics(null, "x")).isInstanceOf(IllegalArgumentException.class);
    }
}

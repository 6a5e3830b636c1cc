package com.hookline.hooks;

import com.hookline.eventmodel.EventCatalog;
import com.hookline.eventmodel.EventEnvelope;
import com.hookline.eventmodel.EventFactory;
import com.hookline.eventmodel.view.RecordViews;
import com.hookline.observability.DispatchMetrics;
import com.hookline.observability.DispatchTracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point bundling the event factory, the hook registry and the dispatcher.
 *
 * <pre>{@code
 * Hookline hookline = Hookline.create();
 * hookline.setup(new TriageHooks(), new ReleaseHooks());
 * hookline.handle(request.getHeader("X-GitHub-Event"), PayloadCodec.readObject(body));
 * }</pre>
 *
 * <p>{@link #setup} is meant to run once. Calling it again logs a warning and replaces the
 * previously installed hooks.
 */
public final class Hookline {

    private static final Logger log = LoggerFactory.getLogger(Hookline.class);

    private final EventFactory factory;
    private final HookRegistry registry;
    private final HookDispatcher dispatcher;
    private final AtomicBoolean setUp = new AtomicBoolean();

    public Hookline(HookDispatcher dispatcher) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher must not be null");
        }
        this.dispatcher = dispatcher;
        this.factory = dispatcher.factory();
        this.registry = dispatcher.registry();
    }

    /** Bundled GitHub catalog, default views, no metrics or tracing. */
    public static Hookline create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public void setup(HookModule... modules) {
        setup(Arrays.asList(modules));
    }

    /** Installs the given modules, replacing whatever an earlier {@code setup} installed. */
    public void setup(Collection<? extends HookModule> modules) {
        if (setUp.getAndSet(true)) {
            log.warn("Hookline.setup called more than once; replacing previously registered hooks");
            registry.reset();
        }
        for (HookModule module : modules) {
            registry.install(module);
        }
        log.info("Hookline set up with {} hooks from {} modules", registry.size(), modules.size());
    }

    /** Clears every hook so {@link #setup} starts from scratch. */
    public void reset() {
        registry.reset();
        setUp.set(false);
    }

    public EventEnvelope parse(String eventName, Map<String, ?> payload) {
        return factory.parse(eventName, payload);
    }

    public DispatchReport handle(String eventName, Map<String, ?> payload) {
        return dispatcher.dispatch(eventName, payload);
    }

    public DispatchReport handle(String eventName, Map<String, ?> payload, String deliveryId) {
        return dispatcher.dispatch(eventName, payload, deliveryId);
    }

    public boolean isSetUp() {
        return setUp.get();
    }

    public EventFactory factory() {
        return factory;
    }

    public HookRegistry registry() {
        return registry;
    }

    public HookDispatcher dispatcher() {
        return dispatcher;
    }

    /** Assembles a {@link Hookline}; every part has a default. */
    public static final class Builder {

        private EventCatalog catalog;
        private RecordViews views = RecordViews.defaults();
        private HookRegistry registry;
        private DispatchMetrics metrics = DispatchMetrics.noop();
        private DispatchTracer tracer = DispatchTracer.noop();

        private Builder() {}

        public Builder catalog(EventCatalog value) {
            this.catalog = value;
            return this;
        }

        public Builder views(RecordViews value) {
            this.views = value;
            return this;
        }

        public Builder registry(HookRegistry value) {
            this.registry = value;
            return this;
        }

        public Builder metrics(DispatchMetrics value) {
            this.metrics = value;
            return this;
        }

        public Builder tracer(DispatchTracer value) {
            this.tracer = value;
            return this;
        }

        public Hookline build() {
            EventFactory factory = new EventFactory(catalog != null ? catalog : EventCatalog.github(), views);
            HookRegistry hooks = registry != null ? registry : new HookRegistry();
            return new Hookline(new HookDispatcher(factory, hooks, metrics, tracer));
        }
    }
}

package com.hookline.hooks;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.hookline.eventmodel.EventAction;
import com.hookline.eventmodel.EventFactory;
import com.hookline.eventmodel.EventType;
import com.hookline.eventmodel.testing.TestPayloadFactory;
import com.hookline.hooks.testing.RecordingHandler;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HookRegistry")
class HookRegistryTest {

    private HookRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new HookRegistry();
    }

    private static HookRegistry.Selection select(HookRegistry registry, String event, String action, String repo) {
        return registry.select(event, Optional.ofNullable(action), Optional.ofNullable(repo));
    }

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        @DisplayName("starts empty")
        void empty() {
            assertThat(registry.isEmpty()).isTrue();
            assertThat(registry.epoch()).isZero();
        }

        @Test
        @DisplayName("builder defaults to unfiltered, non-debug hooks with generated names")
        void defaults() {
            HookRegistration hook = registry.on(EventType.LABEL).handle(new RecordingHandler());

            assertThat(hook.name()).isEqualTo("label#1");
            assertThat(hook.actions().isAny()).isTrue();
            assertThat(hook.repositories().isAny()).isTrue();
            assertThat(hook.debug()).isFalse();
        }

        @Test
        @DisplayName("registering the same handler twice keeps both registrations")
        void duplicates() {
            RecordingHandler handler = new RecordingHandler();
            registry.on("label").handle(handler);
            registry.on("label").handle(handler);

            assertThat(select(registry, "label", "created", null).hooks()).hasSize(2);
        }

        @Test
        @DisplayName("custom event names are accepted")
        void customEvent() {
            registry.on("deployment_review").named("review").handle(new RecordingHandler());

            assertThat(select(registry, "deployment_review", null, null).hooks())
                    .extracting(HookRegistration::name).containsExactly("review");
        }

        @Test
        @DisplayName("rejects a blank event name")
        void blankEvent() {
            assertThatThrownBy(() -> registry.on(" "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("eventName");
        }
    }

    @Nested
    @DisplayName("select")
    class Select {

        @Test
        @DisplayName("keeps registration order and ignores other events")
        void order() {
            registry.on("label").named("a").handle(new RecordingHandler());
            registry.on("issues").named("other").handle(new RecordingHandler());
            registry.on("label").named("b").handle(new RecordingHandler());

            assertThat(select(registry, "label", "created", null).hooks())
                    .extracting(HookRegistration::name).containsExactly("a", "b");
        }

        @Test
        @DisplayName("action filters exclude other actions and absent actions")
        void actionFilter() {
            registry.on(EventType.PULL_REQUEST).actions(EventAction.OPENED).named("opened").handle(new RecordingHandler());
            registry.on(EventType.PULL_REQUEST).named("all").handle(new RecordingHandler());

            assertThat(select(registry, "pull_request", "opened", null).hooks())
                    .extracting(HookRegistration::name).containsExactly("opened", "all");
            assertThat(select(registry, "pull_request", "closed", null).hooks())
                    .extracting(HookRegistration::name).containsExactly("all");
            assertThat(select(registry, "pull_request", null, null).hooks())
                    .extracting(HookRegistration::name).containsExactly("all");
        }

        @Test
        @DisplayName("repository filters skip other repositories")
        void repositoryFilter() {
            registry.on("push").repositories("octo-org/hello-world").named("scoped").handle(new RecordingHandler());

            assertThat(select(registry, "push", null, "octo-org/hello-world").hooks()).hasSize(1);
            assertThat(select(registry, "push", null, "octo-org/other").hooks()).isEmpty();
            assertThat(select(registry, "push", null, null).hooks()).isEmpty();
        }

        @Test
        @DisplayName("debug hooks replace all other hooks for their event, ignoring filters")
        void debugOverride() {
            registry.on("label").named("first").handle(new RecordingHandler());
            registry.on("label").named("second").handle(new RecordingHandler());
            registry.on("label").actions("deleted").repositories("x/y").debug().named("debug").handle(new RecordingHandler());

            HookRegistry.Selection selection = select(registry, "label", "created", "octo-org/hello-world");

            assertThat(selection.debugOverride()).isTrue();
            assertThat(selection.hooks()).extracting(HookRegistration::name).containsExactly("debug");
        }

        @Test
        @DisplayName("debug hooks on one event leave other events alone")
        void debugScope() {
            registry.on("label").debug().handle(new RecordingHandler());
            registry.on("issues").named("normal").handle(new RecordingHandler());

            HookRegistry.Selection selection = select(registry, "issues", "opened", null);

            assertThat(selection.debugOverride()).isFalse();
            assertThat(selection.hooks()).extracting(HookRegistration::name).containsExactly("normal");
        }
    }

    @Nested
    @DisplayName("modules")
    class Modules {

        private final AtomicInteger registrations = new AtomicInteger();

        private final HookModule module = new HookModule() {
            @Override
            public void register(HookRegistry target) {
                registrations.incrementAndGet();
                target.on("label").handle(new RecordingHandler());
            }

            @Override
            public String moduleName() {
                return "labels";
            }
        };

        @Test
        @DisplayName("a module is installed once per epoch")
        void once() {
            assertThat(registry.install(module)).isTrue();
            assertThat(registry.install(module)).isFalse();

            assertThat(registrations).hasValue(1);
            assertThat(registry.size()).isEqualTo(1);
            assertThat(registry.isInstalled("labels")).isTrue();
        }

        @Test
        @DisplayName("reset empties the registry and allows reinstalling")
        void reset() {
            registry.install(module);

            registry.reset();

            assertThat(registry.isEmpty()).isTrue();
            assertThat(registry.isInstalled("labels")).isFalse();
            assertThat(registry.epoch()).isEqualTo(1);
            assertThat(registry.install(module)).isTrue();
            assertThat(registrations).hasValue(2);
        }

        @Test
        @DisplayName("reset is idempotent")
        void resetTwice() {
            registry.reset();
            registry.reset();

            assertThat(registry.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("concurrent access")
    class Concurrency {

        private static final int HOOKS_PER_ROUND = 20;
        private static final int ROUNDS = 200;

        private static List<String> prefix(int size) {
            return IntStream.range(0, size).mapToObj(i -> "h" + i).toList();
        }

        @Test
        @DisplayName("selection and dispatch see registration-order prefixes while hooks are added and reset")
        void consistentSnapshots() throws Exception {
            HookDispatcher dispatcher = new HookDispatcher(EventFactory.github(), registry);
            RecordingHandler handler = new RecordingHandler();
            AtomicBoolean writing = new AtomicBoolean(true);
            ConcurrentLinkedQueue<String> violations = new ConcurrentLinkedQueue<>();
            AtomicInteger checks = new AtomicInteger();
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(3);
            try {
                Future<?> writer = pool.submit(() -> {
                    start.await();
                    try {
                        for (int round = 0; round < ROUNDS; round++) {
                            for (int i = 0; i < HOOKS_PER_ROUND; i++) {
                                registry.on("label").named("h" + i).handle(handler);
                            }
                            registry.reset();
                        }
                    } finally {
                        writing.set(false);
                    }
                    return null;
                });
                Future<?> selector = pool.submit(() -> {
                    start.await();
                    while (writing.get()) {
                        List<String> names = select(registry, "label", "created", null).hooks().stream()
                                .map(HookRegistration::name).toList();
                        if (!names.equals(prefix(names.size()))) {
                            violations.add("select " + names);
                        }
                        checks.incrementAndGet();
                    }
                    return null;
                });
                Future<?> dispatching = pool.submit(() -> {
                    start.await();
                    while (writing.get()) {
                        DispatchReport report = dispatcher.dispatch("label",
                                TestPayloadFactory.labelEvent("created", TestPayloadFactory.DEFAULT_REPOSITORY));
                        if (!report.invoked().equals(prefix(report.invokedCount()))) {
                            violations.add("dispatch " + report.invoked());
                        }
                        checks.incrementAndGet();
                    }
                    return null;
                });

                start.countDown();
                writer.get(30, TimeUnit.SECONDS);
                selector.get(30, TimeUnit.SECONDS);
                dispatching.get(30, TimeUnit.SECONDS);
            } finally {
                pool.shutdownNow();
            }

            assertThat(violations).isEmpty();
            assertThat(checks.get()).isPositive();
            assertThat(registry.isEmpty()).isTrue();
            assertThat(registry.epoch()).isEqualTo(ROUNDS);
        }
    }
}

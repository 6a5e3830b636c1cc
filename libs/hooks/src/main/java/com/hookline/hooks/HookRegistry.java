package com.hookline.hooks;

import com.hookline.eventmodel.EventAction;
import com.hookline.eventmodel.EventType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The registered hooks, in registration order.
 *
 * <p>Starts empty, fills through {@link #register}, {@link #on} and {@link #install}, and is
 * emptied by {@link #reset()}. Each reset starts a new epoch, forgetting which modules were
 * installed so the same modules can be installed again.
 *
 * <p>Thread-safe: selection takes a read lock and sees a consistent set of registrations.
 */
public final class HookRegistry {

    private static final Logger log = LoggerFactory.getLogger(HookRegistry.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<HookRegistration> registrations = new ArrayList<>();
    private final Set<String> installedModules = new HashSet<>();
    private long epoch;

    /** Appends a registration. Registering the same handler twice runs it twice. */
    public HookRegistration register(HookRegistration registration) {
        if (registration == null) {
            throw new IllegalArgumentException("registration must not be null");
        }
        lock.writeLock().lock();
        try {
            registrations.add(registration);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Registered hook '{}' for event '{}' actions={} repositories={} debug={}",
                registration.name(), registration.eventName(), registration.actions(),
                registration.repositories(), registration.debug());
        return registration;
    }

    /** Starts a fluent registration for a known event. */
    public HookBuilder on(EventType eventType) {
        return on(eventType.value());
    }

    /** Starts a fluent registration for any wire event name. */
    public HookBuilder on(String eventName) {
        return new HookBuilder(eventName);
    }

    /**
     * Installs a module unless a module with the same {@link HookModule#moduleName()} is already
     * installed in this epoch.
     *
     * @return true if the module registered its hooks, false if it was already installed
     */
    public boolean install(HookModule module) {
        if (module == null) {
            throw new IllegalArgumentException("module must not be null");
        }
        lock.writeLock().lock();
        try {
            if (!installedModules.add(module.moduleName())) {
                log.debug("Hook module {} already installed, skipping", module.moduleName());
                return false;
            }
            // write lock is reentrant, so the module may call register() from here
            module.register(this);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Installed hook module {}", module.moduleName());
        return true;
    }

    /** Removes every registration and installed-module record. Idempotent. */
    public void reset() {
        lock.writeLock().lock();
        try {
            registrations.clear();
            installedModules.clear();
            epoch++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Registrations in order, as an immutable copy. */
    public List<HookRegistration> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(registrations);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Picks the hooks to run for one delivery. If any debug hook listens to the event, exactly
     * the debug hooks are returned, unfiltered. Otherwise hooks whose action and repository
     * filters accept the delivery are returned. Order is registration order.
     */
    public Selection select(String eventName, Optional<String> action, Optional<String> repository) {
        List<HookRegistration> forEvent = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (HookRegistration registration : registrations) {
                if (registration.eventName().equals(eventName)) {
                    forEvent.add(registration);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        List<HookRegistration> debug = forEvent.stream().filter(HookRegistration::debug).toList();
        if (!debug.isEmpty()) {
            return new Selection(debug, true);
        }
        List<HookRegistration> matching = forEvent.stream()
                .filter(r -> r.actions().matches(action) && r.repositories().matches(repository))
                .toList();
        return new Selection(matching, false);
    }

    public boolean isInstalled(String moduleName) {
        lock.readLock().lock();
        try {
            return installedModules.contains(moduleName);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Incremented by every {@link #reset()}. */
    public long epoch() {
        lock.readLock().lock();
        try {
            return epoch;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return registrations.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Hooks chosen for a delivery.
     *
     * @param hooks hooks to run, in order
     * @param debugOverride true if debug hooks replaced the normal selection
     */
    public record Selection(List<HookRegistration> hooks, boolean debugOverride) {}

    /** Fluent registration; nothing is registered until {@link #handle}. */
    public final class HookBuilder {

        private final String eventName;
        private MatchFilter actions = MatchFilter.any();
        private MatchFilter repositories = MatchFilter.any();
        private boolean debug;
        private String name;

        private HookBuilder(String eventName) {
            if (eventName == null || eventName.isBlank()) {
                throw new IllegalArgumentException("eventName must not be null or blank");
            }
            this.eventName = eventName;
        }

        public HookBuilder actions(EventAction... values) {
            this.actions = MatchFilter.actions(values);
            return this;
        }

        public HookBuilder actions(String... values) {
            this.actions = MatchFilter.of(values);
            return this;
        }

        public HookBuilder repositories(String... fullNames) {
            this.repositories = MatchFilter.of(fullNames);
            return this;
        }

        public HookBuilder debug() {
            this.debug = true;
            return this;
        }

        public HookBuilder named(String hookName) {
            this.name = hookName;
            return this;
        }

        /** Registers the hook. Unnamed hooks are called {@code <event>#<n>}. */
        public HookRegistration handle(WebhookHandler handler) {
            String hookName = name != null ? name : eventName + "#" + (size() + 1);
            return register(new HookRegistration(hookName, eventName, actions, repositories, debug, handler));
        }
    }
}

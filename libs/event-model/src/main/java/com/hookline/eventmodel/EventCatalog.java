package com.hookline.eventmodel;

import com.hookline.recordmodel.DescriptorCatalog;
import com.hookline.recordmodel.DescriptorLoader;
import com.hookline.recordmodel.RecordDescriptor;
import com.hookline.recordmodel.RecordValidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Descriptors for every GitHub payload shape plus the event-name → descriptor table.
 *
 * <p>{@link #github()} loads the bundled resources once. Callers that need different shapes (a
 * stricter {@code PullRequest}, an event GitHub added last week) build their own catalog with
 * {@link #withDescriptors(DescriptorCatalog)} and {@link #withEvent(String, String)}; every
 * mapping is checked at construction so a typo fails at start-up.
 */
public final class EventCatalog {

    public static final String RECORDS_RESOURCE = "hookline/descriptors/github-records.json";
    public static final String EVENTS_RESOURCE = "hookline/descriptors/github-events.json";

    /** Descriptor used when the event name is unknown or the payload does not match its type. */
    public static final String FALLBACK_DESCRIPTOR = "WebhookEvent";

    /** Last-resort descriptor; accepts any JSON object. */
    public static final String RAW_FALLBACK_DESCRIPTOR = "RawWebhookEvent";

    private final DescriptorCatalog descriptors;
    private final Map<String, String> events;
    private final RecordValidator validator;

    /**
     * @param descriptors every record and event descriptor, including both fallbacks
     * @param events wire event name → descriptor name
     * @throws IllegalArgumentException if a fallback or any mapped descriptor is missing
     */
    public EventCatalog(DescriptorCatalog descriptors, Map<String, String> events) {
        if (descriptors == null) {
            throw new IllegalArgumentException("descriptors must not be null");
        }
        if (events == null) {
            throw new IllegalArgumentException("events must not be null");
        }
        List<String> missing = new ArrayList<>();
        for (String required : List.of(FALLBACK_DESCRIPTOR, RAW_FALLBACK_DESCRIPTOR)) {
            if (!descriptors.contains(required)) {
                missing.add(required);
            }
        }
        events.forEach((event, descriptor) -> {
            if (!descriptors.contains(descriptor)) {
                missing.add(event + " -> " + descriptor);
            }
        });
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Event catalog references missing descriptors: " + missing);
        }
        this.descriptors = descriptors;
        this.events = Collections.unmodifiableMap(new LinkedHashMap<>(events));
        this.validator = new RecordValidator(descriptors);
    }

    /** The bundled GitHub catalog, loaded on first use. */
    public static EventCatalog github() {
        return GithubHolder.INSTANCE;
    }

    /** Loads the bundled resources into a new catalog. */
    public static EventCatalog loadGithub() {
        DescriptorCatalog descriptors = DescriptorLoader.fromClasspath(RECORDS_RESOURCE, EVENTS_RESOURCE);
        return new EventCatalog(descriptors, defaultEventTable());
    }

    /** {@link EventType} wire names mapped to their descriptors. */
    public static Map<String, String> defaultEventTable() {
        Map<String, String> table = new LinkedHashMap<>();
        for (EventType type : EventType.values()) {
            table.put(type.value(), type.descriptorName());
        }
        return table;
    }

    /**
     * Returns a copy whose descriptors are replaced or extended by {@code overrides}.
     *
     * @throws IllegalArgumentException if the merged catalog has dangling references
     */
    public EventCatalog withDescriptors(DescriptorCatalog overrides) {
        return new EventCatalog(descriptors.merge(overrides), events);
    }

    /** Returns a copy that maps one more (or a remapped) event name. */
    public EventCatalog withEvent(String eventName, String descriptorName) {
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("eventName must not be null or blank");
        }
        Map<String, String> table = new LinkedHashMap<>(events);
        table.put(eventName, descriptorName);
        return new EventCatalog(descriptors, table);
    }

    public DescriptorCatalog descriptors() {
        return descriptors;
    }

    public Map<String, String> events() {
        return events;
    }

    public RecordValidator validator() {
        return validator;
    }

    /** Descriptor for a wire event name, or empty when the name is not mapped. */
    public Optional<RecordDescriptor> descriptorFor(String eventName) {
        return Optional.ofNullable(events.get(eventName)).map(descriptors::require);
    }

    public RecordDescriptor fallback() {
        return descriptors.require(FALLBACK_DESCRIPTOR);
    }

    public RecordDescriptor rawFallback() {
        return descriptors.require(RAW_FALLBACK_DESCRIPTOR);
    }

    private static final class GithubHolder {
        private static final EventCatalog INSTANCE = loadGithub();
    }
}

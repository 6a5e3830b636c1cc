package com.hookline.eventmodel;

import com.hookline.eventmodel.view.RecordViews;
import com.hookline.recordmodel.RecordDescriptor;
import com.hookline.recordmodel.ValidationResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Turns a webhook delivery (event name plus decoded body) into an {@link EventEnvelope}.
 *
 * <p>Parsing never fails for a non-null body. An unknown event name, or a payload that does not
 * match its event's descriptor, degrades to the {@code WebhookEvent} fallback; a payload that
 * does not even match that (say {@code sender} is a string) degrades to {@code RawWebhookEvent},
 * which accepts any object. The only exception is a catalog whose raw fallback rejects a map,
 * which is a packaging bug.
 */
public final class EventFactory {

    private static final Logger log = LoggerFactory.getLogger(EventFactory.class);

    private final EventCatalog catalog;
    private final RecordViews views;

    public EventFactory(EventCatalog catalog) {
        this(catalog, RecordViews.defaults());
    }

    public EventFactory(EventCatalog catalog, RecordViews views) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog must not be null");
        }
        if (views == null) {
            throw new IllegalArgumentException("views must not be null");
        }
        this.catalog = catalog;
        this.views = views;
    }

    /** A factory over the bundled GitHub catalog with default views. */
    public static EventFactory github() {
        return new EventFactory(EventCatalog.github());
    }

    public EventCatalog catalog() {
        return catalog;
    }

    public RecordViews views() {
        return views;
    }

    /**
     * Parses a delivery.
     *
     * @param eventName the {@code X-GitHub-Event} header value
     * @param payload the decoded JSON body
     * @return the envelope; {@link EventEnvelope#fallback()} tells whether the typed descriptor
     *     was used
     * @throws IllegalStateException if even the raw fallback rejects the payload
     */
    public EventEnvelope parse(String eventName, Map<String, ?> payload) {
        if (eventName == null) {
            throw new IllegalArgumentException("eventName must not be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        Optional<RecordDescriptor> descriptor = catalog.descriptorFor(eventName);
        if (descriptor.isEmpty()) {
            log.info("Unknown event type '{}', using {}", eventName, EventCatalog.FALLBACK_DESCRIPTOR);
            return fallback(eventName, payload);
        }
        ValidationResult result = catalog.validator().validate(descriptor.get(), payload);
        if (!result.valid()) {
            log.warn("Payload for event '{}' does not match {}, using {}: {}",
                    eventName, descriptor.get().name(), EventCatalog.FALLBACK_DESCRIPTOR, result.errorMessages());
            return fallback(eventName, payload);
        }
        logDrift(eventName, result);
        return new EventEnvelope(eventName, result.record(), false, views);
    }

    private EventEnvelope fallback(String eventName, Map<String, ?> payload) {
        ValidationResult result = catalog.validator().validate(catalog.fallback(), payload);
        if (result.valid()) {
            return new EventEnvelope(eventName, result.record(), true, views);
        }
        log.warn("Payload for event '{}' does not match {} either, using {}: {}",
                eventName, EventCatalog.FALLBACK_DESCRIPTOR, EventCatalog.RAW_FALLBACK_DESCRIPTOR,
                result.errorMessages());
        ValidationResult raw = catalog.validator().validate(catalog.rawFallback(), payload);
        if (!raw.valid()) {
            throw new IllegalStateException("Fallback descriptor " + EventCatalog.RAW_FALLBACK_DESCRIPTOR
                    + " rejected a payload for '" + eventName + "': " + raw.errorMessages());
        }
        return new EventEnvelope(eventName, raw.record(), true, views);
    }

    private static void logDrift(String eventName, ValidationResult result) {
        if (log.isDebugEnabled() && result.record().hasUnrecognizedFields()) {
            log.debug("Event '{}' carries undeclared fields {}",
                    eventName, result.record().unrecognizedFields().keySet());
        }
    }
}

package com.hookline.eventmodel;

import com.hookline.eventmodel.view.RecordView;
import com.hookline.eventmodel.view.RecordViews;
import com.hookline.eventmodel.view.Repository;
import com.hookline.eventmodel.view.User;
import com.hookline.recordmodel.ValidatedRecord;

import java.util.Map;
import java.util.Optional;

/**
 * A parsed webhook delivery.
 *
 * <p>The common accessors ({@link #action()}, {@link #sender()}, {@link #repository()} ...) are
 * all {@code Optional} and never throw: they work the same for typed events, for the
 * {@code WebhookEvent} fallback, for the raw fallback (where the fields are untyped) and for the
 * {@code security_advisory} event, whose payload carries none of them.
 *
 * @param eventName wire event name as received
 * @param record the validated payload
 * @param fallback true if the payload was validated against a fallback descriptor instead of the
 *     event's own
 * @param views view constructors used by {@link #view(String, Class)}
 */
public record EventEnvelope(String eventName, ValidatedRecord record, boolean fallback, RecordViews views) {

    public EventEnvelope {
        if (eventName == null) {
            throw new IllegalArgumentException("eventName must not be null");
        }
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }
        if (views == null) {
            views = RecordViews.defaults();
        }
    }

    public EventEnvelope(String eventName, ValidatedRecord record, boolean fallback) {
        this(eventName, record, fallback, RecordViews.defaults());
    }

    /** The known event type, or empty for names outside {@link EventType}. */
    public Optional<EventType> type() {
        return EventType.fromString(eventName);
    }

    /** Name of the descriptor the payload was validated against. */
    public String descriptorName() {
        return record.descriptorName();
    }

    public Optional<String> action() {
        return field("action").filter(String.class::isInstance).map(String.class::cast);
    }

    public Optional<ValidatedRecord> sender() {
        return nested("sender");
    }

    public Optional<ValidatedRecord> repository() {
        return nested("repository");
    }

    public Optional<ValidatedRecord> organization() {
        return nested("organization");
    }

    public Optional<ValidatedRecord> enterprise() {
        return nested("enterprise");
    }

    public Optional<ValidatedRecord> installation() {
        return nested("installation");
    }

    /**
     * {@code repository.full_name}, also read from the untyped map a raw fallback holds, so
     * repository filters keep working on payloads that failed validation.
     */
    public Optional<String> repositoryFullName() {
        Optional<Object> repository = field("repository");
        Object fullName = null;
        if (repository.isPresent() && repository.get() instanceof ValidatedRecord typed) {
            fullName = typed.find("full_name").orElse(null);
        } else if (repository.isPresent() && repository.get() instanceof Map<?, ?> raw) {
            fullName = raw.get("full_name");
        }
        return fullName instanceof String name ? Optional.of(name) : Optional.empty();
    }

    public Optional<User> senderView() {
        return view("sender", User.class);
    }

    public Optional<Repository> repositoryView() {
        return view("repository", Repository.class);
    }

    /** Wraps a nested record field of the payload in a view. Empty if the field is absent or untyped. */
    public <V extends RecordView> Optional<V> view(String field, Class<V> type) {
        return nested(field).map(nested -> views.wrap(type, nested));
    }

    private Optional<Object> field(String name) {
        return record.find(name);
    }

    private Optional<ValidatedRecord> nested(String name) {
        return field(name).filter(ValidatedRecord.class::isInstance).map(ValidatedRecord.class::cast);
    }
}

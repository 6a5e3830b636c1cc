package com.hookline.eventmodel.view;

import com.hookline.recordmodel.ValidatedRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registry from view type to constructor.
 *
 * <p>Immutable; {@link #override} returns a modified copy. Swapping in a subtype is checked at
 * compile time:
 *
 * <pre>{@code
 * RecordViews views = RecordViews.defaults().override(PullRequest.class, MyPullRequest::new);
 * }</pre>
 */
public final class RecordViews {

    /** Creates a view over a record. */
    @FunctionalInterface
    public interface Factory<V extends RecordView> {
        V create(ValidatedRecord record, RecordViews views);
    }

    private static final RecordViews DEFAULTS = new RecordViews(Map.of())
            .override(User.class, User::new)
            .override(Repository.class, Repository::new)
            .override(Organization.class, Organization::new)
            .override(Team.class, Team::new)
            .override(Issue.class, Issue::new)
            .override(PullRequest.class, PullRequest::new)
            .override(Label.class, Label::new);

    private final Map<Class<?>, Factory<?>> factories;

    private RecordViews(Map<Class<?>, Factory<?>> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    /** Views for the built-in types. */
    public static RecordViews defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a copy in which {@code type} is built by {@code factory}.
     *
     * @param type the view type callers ask for
     * @param factory creates that type or a subtype of it
     */
    public <V extends RecordView> RecordViews override(Class<V> type, Factory<? extends V> factory) {
        if (type == null || factory == null) {
            throw new IllegalArgumentException("type and factory must not be null");
        }
        Map<Class<?>, Factory<?>> copy = new LinkedHashMap<>(factories);
        copy.put(type, factory);
        return new RecordViews(copy);
    }

    /**
     * Wraps a record in the view registered for {@code type}.
     *
     * @throws IllegalArgumentException if no factory is registered for the type
     */
    public <V extends RecordView> V wrap(Class<V> type, ValidatedRecord record) {
        Factory<?> factory = factories.get(type);
        if (factory == null) {
            throw new IllegalArgumentException("No view registered for " + type.getName());
        }
        return type.cast(factory.create(record, this));
    }

    public boolean supports(Class<? extends RecordView> type) {
        return factories.containsKey(type);
    }
}

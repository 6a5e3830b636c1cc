package com.hookline.hooks;

import com.hookline.eventmodel.EventAction;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * A set of accepted values, or "any" when the set is empty.
 *
 * <p>A non-empty filter never matches an absent value: a hook for {@code opened} pull requests
 * does not run for a payload without an action.
 */
public final class MatchFilter {

    private static final MatchFilter ANY = new MatchFilter(Set.of());

    private final Set<String> values;

    private MatchFilter(Set<String> values) {
        this.values = values;
    }

    public static MatchFilter any() {
        return ANY;
    }

    public static MatchFilter of(String... values) {
        return of(Arrays.asList(values));
    }

    public static MatchFilter of(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return ANY;
        }
        Set<String> copy = new LinkedHashSet<>();
        for (String value : values) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("filter values must not be null or blank");
            }
            copy.add(value);
        }
        return new MatchFilter(Collections.unmodifiableSet(copy));
    }

    public static MatchFilter actions(EventAction... actions) {
        return of(Arrays.stream(actions).map(EventAction::value).toList());
    }

    public boolean isAny() {
        return values.isEmpty();
    }

    public Set<String> values() {
        return values;
    }

    public boolean matches(Optional<String> value) {
        return isAny() || value.map(values::contains).orElse(false);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MatchFilter other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return isAny() ? "*" : values.toString();
    }
}

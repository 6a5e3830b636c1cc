package com.hookline.recordmodel;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable record produced by {@link RecordValidator}.
 *
 * <p>Values are keyed by field name (not wire alias). Nested records are {@code ValidatedRecord}s,
 * lists and open maps are unmodifiable deep copies. Payload keys the descriptor does not declare are
 * kept in {@link #unrecognizedFields()} so schema drift stays visible.
 *
 * <p>Only the validator constructs instances; there is no way to mutate one after it is returned.
 */
public final class ValidatedRecord {

    private final RecordDescriptor descriptor;
    private final Map<String, Object> values;
    private final Map<String, Object> unrecognizedFields;
    private final Set<String> presentFields;

    ValidatedRecord(
            RecordDescriptor descriptor,
            Map<String, Object> values,
            Map<String, Object> unrecognizedFields,
            Set<String> presentFields) {
        this.descriptor = descriptor;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.unrecognizedFields = Immutables.freezeMap(unrecognizedFields);
        this.presentFields = Set.copyOf(presentFields);
    }

    public String descriptorName() {
        return descriptor.name();
    }

    public RecordDescriptor descriptor() {
        return descriptor;
    }

    /** Declared field values in declaration order (absent optional fields map to their default). */
    public Map<String, Object> values() {
        return values;
    }

    /** Payload keys that the descriptor does not declare, with their raw values. */
    public Map<String, Object> unrecognizedFields() {
        return unrecognizedFields;
    }

    public boolean hasUnrecognizedFields() {
        return !unrecognizedFields.isEmpty();
    }

    /**
     * True if the payload carried the field, even as an explicit null. False for optional fields
     * that were filled in with their default.
     */
    public boolean isPresent(String field) {
        return presentFields.contains(field);
    }

    /** True if the field is declared and holds a non-null value. */
    public boolean has(String field) {
        return values.get(field) != null;
    }

    /**
     * Returns the value of a declared field.
     *
     * @throws IllegalArgumentException if the descriptor does not declare the field
     */
    public Object get(String field) {
        requireDeclared(field);
        return values.get(field);
    }

    /** Returns the value of a field if it is declared and non-null. */
    public Optional<Object> find(String field) {
        return Optional.ofNullable(values.get(field));
    }

    public String getString(String field) {
        return as(field, String.class, "string");
    }

    /** Integer fields as {@code long}; null when absent. */
    public Long getLong(String field) {
        Object value = get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof BigInteger big) {
            return big.longValueExact();
        }
        if (ScalarType.INTEGER.accepts(value)) {
            return ((Number) value).longValue();
        }
        throw wrongKind(field, "integer", value);
    }

    public Number getNumber(String field) {
        return as(field, Number.class, "number");
    }

    public Boolean getBoolean(String field) {
        return as(field, Boolean.class, "boolean");
    }

    public ValidatedRecord getRecord(String field) {
        return as(field, ValidatedRecord.class, "record");
    }

    /** Records of a list field; an empty list when the field is absent or null. */
    public List<ValidatedRecord> getRecords(String field) {
        return listOf(field, ValidatedRecord.class);
    }

    /** Strings of a list field; an empty list when the field is absent or null. */
    public List<String> getStrings(String field) {
        return listOf(field, String.class);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String field) {
        return as(field, Map.class, "map");
    }

    /**
     * Expands the URL template held by a string field.
     *
     * @param field name of the field holding the template (e.g. "following_url")
     * @param params placeholder values in declaration order
     * @return the expanded URL
     * @throws IllegalStateException if the field holds no template
     * @see UrlTemplates#interpolate(String, List)
     */
    public String expandUrl(String field, UrlParam... params) {
        String template = getString(field);
        if (template == null) {
            throw new IllegalStateException(
                    "%s has no value for URL template field '%s'".formatted(descriptorName(), field));
        }
        return UrlTemplates.interpolate(template, Arrays.asList(params));
    }

    private <T> T as(String field, Class<T> type, String label) {
        Object value = get(field);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw wrongKind(field, label, value);
        }
        return type.cast(value);
    }

    @SuppressWarnings("unchecked")
    private <T> List<T> listOf(String field, Class<T> elementType) {
        Object value = get(field);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw wrongKind(field, "list", value);
        }
        for (Object element : list) {
            if (element != null && !elementType.isInstance(element)) {
                throw wrongKind(field, "list of " + elementType.getSimpleName(), value);
            }
        }
        return (List<T>) list;
    }

    private void requireDeclared(String field) {
        if (!descriptor.hasField(field)) {
            throw new IllegalArgumentException(
                    "%s declares no field '%s'".formatted(descriptorName(), field));
        }
    }

    private IllegalArgumentException wrongKind(String field, String requested, Object value) {
        String held = value instanceof ValidatedRecord ? "record" : ScalarType.kindOf(value);
        return new IllegalArgumentException(
                "%s.%s holds %s, not %s".formatted(descriptorName(), field, held, requested));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValidatedRecord other)) {
            return false;
        }
        return descriptor.name().equals(other.descriptor.name())
                && values.equals(other.values)
                && unrecognizedFields.equals(other.unrecognizedFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(descriptor.name(), values, unrecognizedFields);
    }

    @Override
    public String toString() {
        return descriptorName() + values;
    }
}

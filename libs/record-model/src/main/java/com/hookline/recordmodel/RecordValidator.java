package com.hookline.recordmodel;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns an untyped decoded-JSON map into an immutable {@link ValidatedRecord}.
 *
 * <p>Rules, applied to every declared field:
 *
 * <ul>
 *   <li>the value is read from the wire alias, falling back to the bare field name;
 *   <li>a missing required field is an error, a missing optional one takes its default (optional
 *       lists get a fresh empty list);
 *   <li>types are matched strictly, with no coercion between kinds;
 *   <li>nested records and list elements are validated recursively and their errors are wrapped
 *       with the parent path;
 *   <li>open maps pass through unvalidated.
 * </ul>
 *
 * <p>Undeclared payload keys never fail validation; they land in
 * {@link ValidatedRecord#unrecognizedFields()}. All errors are collected, not just the first.
 *
 * <p>Stateless apart from the immutable catalog: safe to share between threads. Performs no I/O and
 * no logging.
 */
public final class RecordValidator {

    private final DescriptorCatalog catalog;

    /**
     * @param catalog resolves {@link FieldSpec#recordRef()} names for nested fields
     */
    public RecordValidator(DescriptorCatalog catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog must not be null");
        }
        this.catalog = catalog;
    }

    public DescriptorCatalog catalog() {
        return catalog;
    }

    /**
     * Validates a payload against the named descriptor.
     *
     * @throws IllegalArgumentException if the catalog has no such descriptor
     */
    public ValidationResult validate(String descriptorName, Map<String, ?> raw) {
        return validate(catalog.require(descriptorName), raw);
    }

    /**
     * Validates a payload against a descriptor.
     *
     * @param descriptor the expected shape
     * @param raw decoded JSON object
     * @return {@link ValidationResult#ok} with the record, or {@link ValidationResult#fail} with
     *     every field error
     */
    public ValidationResult validate(RecordDescriptor descriptor, Map<String, ?> raw) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor must not be null");
        }
        if (raw == null) {
            throw new IllegalArgumentException("raw payload must not be null");
        }
        List<FieldError> errors = new ArrayList<>();
        ValidatedRecord record = validateRecord(descriptor, raw, errors);
        return errors.isEmpty() ? ValidationResult.ok(record) : ValidationResult.fail(errors);
    }

    private ValidatedRecord validateRecord(
            RecordDescriptor descriptor, Map<?, ?> raw, List<FieldError> errors) {
        Map<String, Object> values = new LinkedHashMap<>();
        Set<String> consumed = new HashSet<>();
        Set<String> present = new HashSet<>();

        for (FieldSpec field : descriptor.fields()) {
            String key = presentKey(field, raw);
            if (key == null) {
                if (field.required()) {
                    errors.add(FieldError.missing(field.name()));
                } else {
                    values.put(field.name(), defaultFor(field));
                }
                continue;
            }
            consumed.add(key);
            present.add(field.name());
            values.put(field.name(), validateValue(field, raw.get(key), errors));
        }

        Map<String, Object> unrecognized = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (!consumed.contains(key)) {
                unrecognized.put(key, entry.getValue());
            }
        }
        return new ValidatedRecord(descriptor, values, unrecognized, present);
    }

    private static String presentKey(FieldSpec field, Map<?, ?> raw) {
        if (raw.containsKey(field.wireAlias())) {
            return field.wireAlias();
        }
        if (field.aliased() && raw.containsKey(field.name())) {
            return field.name();
        }
        return null;
    }

    private static Object defaultFor(FieldSpec field) {
        if (field.defaultValue() != null) {
            return field.defaultValue();
        }
        return field.kind().isList() ? Immutables.emptyList() : null;
    }

    private Object validateValue(FieldSpec field, Object value, List<FieldError> errors) {
        String path = field.name();
        if (value == null) {
            if (!field.nullable()) {
                errors.add(FieldError.typeMismatch(path, field.typeLabel(), null));
            }
            return null;
        }
        return switch (field.kind()) {
            case SCALAR -> checkScalar(path, field.scalarType(), value, errors);
            case OPEN_MAP -> {
                if (value instanceof Map<?, ?> map) {
                    yield Immutables.freezeMap(map);
                }
                errors.add(FieldError.typeMismatch(path, "map", value));
                yield null;
            }
            case RECORD -> nested(path, field.recordRef(), value, errors);
            case RECORD_LIST, SCALAR_LIST -> validateList(field, value, errors);
        };
    }

    private static Object checkScalar(
            String path, ScalarType type, Object value, List<FieldError> errors) {
        if (type.accepts(value)) {
            return Immutables.freeze(value);
        }
        errors.add(FieldError.typeMismatch(path, type.label(), value));
        return null;
    }

    private ValidatedRecord nested(
            String segment, String descriptorName, Object value, List<FieldError> errors) {
        if (!(value instanceof Map<?, ?> map)) {
            errors.add(FieldError.typeMismatch(segment, descriptorName, value));
            return null;
        }
        List<FieldError> childErrors = new ArrayList<>();
        ValidatedRecord child = validateRecord(catalog.require(descriptorName), map, childErrors);
        for (FieldError childError : childErrors) {
            errors.add(childError.nestedUnder(segment));
        }
        return childErrors.isEmpty() ? child : null;
    }

    private List<Object> validateList(FieldSpec field, Object value, List<FieldError> errors) {
        if (!(value instanceof List<?> list)) {
            errors.add(FieldError.typeMismatch(field.name(), field.typeLabel(), value));
            return null;
        }
        List<Object> elements = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            String segment = field.name() + "[" + i + "]";
            Object element = list.get(i);
            if (field.kind() == FieldKind.RECORD_LIST) {
                elements.add(nested(segment, field.recordRef(), element, errors));
            } else if (element == null) {
                errors.add(FieldError.typeMismatch(segment, field.scalarType().label(), null));
            } else {
                elements.add(checkScalar(segment, field.scalarType(), element, errors));
            }
        }
        return Immutables.freezeList(elements);
    }
}

package com.hookline.recordmodel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declarative shape of one record type: an ordered list of {@link FieldSpec}s.
 *
 * <p>Descriptors carry no logic. They are loaded once (see {@link DescriptorLoader}) and consumed by
 * {@link RecordValidator}. Field names are unique within a descriptor.
 */
public final class RecordDescriptor {

    private final String name;
    private final List<FieldSpec> fields;
    private final Map<String, FieldSpec> fieldsByName;

    /**
     * Creates a descriptor.
     *
     * @param name descriptor name referenced by {@link FieldSpec#recordRef()}
     * @param fields field declarations in payload order
     * @throws IllegalArgumentException if the name is blank or a field name repeats
     */
    public RecordDescriptor(String name, List<FieldSpec> fields) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (fields == null) {
            throw new IllegalArgumentException("fields must not be null");
        }
        Map<String, FieldSpec> byName = new LinkedHashMap<>();
        for (FieldSpec field : fields) {
            if (byName.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException(
                        "Duplicate field '%s' in descriptor %s".formatted(field.name(), name));
            }
        }
        this.name = name;
        this.fields = List.copyOf(fields);
        this.fieldsByName = Collections.unmodifiableMap(byName);
    }

    /** Convenience factory. */
    public static RecordDescriptor of(String name, FieldSpec... fields) {
        return new RecordDescriptor(name, Arrays.asList(fields));
    }

    public String name() {
        return name;
    }

    /** Fields in declaration order. */
    public List<FieldSpec> fields() {
        return fields;
    }

    public Optional<FieldSpec> field(String fieldName) {
        return Optional.ofNullable(fieldsByName.get(fieldName));
    }

    public boolean hasField(String fieldName) {
        return fieldsByName.containsKey(fieldName);
    }

    /** Names of fields that must be present in every payload. */
    public List<String> requiredFieldNames() {
        List<String> required = new ArrayList<>();
        for (FieldSpec field : fields) {
            if (field.required()) {
                required.add(field.name());
            }
        }
        return required;
    }

    /**
     * Returns a copy of this descriptor under a new name with extra fields. A field whose name
     * already exists replaces the inherited declaration at the same position.
     *
     * @param childName name of the derived descriptor
     * @param extraFields fields added or redeclared by the child
     * @return the derived descriptor
     */
    public RecordDescriptor extend(String childName, List<FieldSpec> extraFields) {
        Map<String, FieldSpec> merged = new LinkedHashMap<>(fieldsByName);
        for (FieldSpec field : extraFields) {
            merged.put(field.name(), field);
        }
        return new RecordDescriptor(childName, new ArrayList<>(merged.values()));
    }

    @Override
    public String toString() {
        return "RecordDescriptor[" + name + ", " + fields.size() + " fields]";
    }
}

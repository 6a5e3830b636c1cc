package com.hookline.recordmodel;

/**
 * Declaration of one field of a {@link RecordDescriptor}.
 *
 * <p>Instances are immutable; the {@code with*}/{@code optional()} methods return modified copies so
 * specs can be written fluently:
 *
 * <pre>{@code
 * FieldSpec.scalar("login", ScalarType.STRING)
 * FieldSpec.record("owner", "User").optional()
 * FieldSpec.openMap("links").withAlias("_links").optional()
 * }</pre>
 *
 * @param name field name, unique within its descriptor; values are keyed by it
 * @param wireAlias key looked up in the raw payload; defaults to {@code name}
 * @param required whether the key must be present
 * @param nullable whether an explicit JSON null is accepted; always true for optional fields
 * @param defaultValue value used when an optional field is absent (frozen on construction)
 * @param kind the value shape
 * @param scalarType element type for {@link FieldKind#SCALAR} and {@link FieldKind#SCALAR_LIST}
 * @param recordRef descriptor name for {@link FieldKind#RECORD} and {@link FieldKind#RECORD_LIST}
 */
public record FieldSpec(
        String name,
        String wireAlias,
        boolean required,
        boolean nullable,
        Object defaultValue,
        FieldKind kind,
        ScalarType scalarType,
        String recordRef) {

    public FieldSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null for field " + name);
        }
        if (wireAlias == null || wireAlias.isBlank()) {
            wireAlias = name;
        }
        if (!required) {
            nullable = true;
        }
        switch (kind) {
            case SCALAR, SCALAR_LIST -> {
                if (scalarType == null) {
                    throw new IllegalArgumentException("scalarType is required for field " + name);
                }
                recordRef = null;
            }
            case RECORD, RECORD_LIST -> {
                if (recordRef == null || recordRef.isBlank()) {
                    throw new IllegalArgumentException("recordRef is required for field " + name);
                }
                scalarType = null;
            }
            case OPEN_MAP -> {
                scalarType = null;
                recordRef = null;
            }
        }
        defaultValue = Immutables.freeze(defaultValue);
    }

    /** A required scalar field. */
    public static FieldSpec scalar(String name, ScalarType type) {
        return new FieldSpec(name, name, true, false, null, FieldKind.SCALAR, type, null);
    }

    /** A required nested record field. */
    public static FieldSpec record(String name, String descriptorName) {
        return new FieldSpec(name, name, true, false, null, FieldKind.RECORD, null, descriptorName);
    }

    /** A required list-of-records field. */
    public static FieldSpec recordList(String name, String descriptorName) {
        return new FieldSpec(name, name, true, false, null, FieldKind.RECORD_LIST, null, descriptorName);
    }

    /** A required list-of-scalars field. */
    public static FieldSpec scalarList(String name, ScalarType type) {
        return new FieldSpec(name, name, true, false, null, FieldKind.SCALAR_LIST, type, null);
    }

    /** A required unstructured object field. */
    public static FieldSpec openMap(String name) {
        return new FieldSpec(name, name, true, false, null, FieldKind.OPEN_MAP, null, null);
    }

    /** Copy that may be absent (and null) in the payload. */
    public FieldSpec optional() {
        return new FieldSpec(name, wireAlias, false, true, defaultValue, kind, scalarType, recordRef);
    }

    /** Copy that must be present but may be an explicit JSON null. */
    public FieldSpec asNullable() {
        return new FieldSpec(name, wireAlias, required, true, defaultValue, kind, scalarType, recordRef);
    }

    /** Copy read from a different payload key. */
    public FieldSpec withAlias(String alias) {
        return new FieldSpec(name, alias, required, nullable, defaultValue, kind, scalarType, recordRef);
    }

    /** Copy with a default for when the field is absent. */
    public FieldSpec withDefault(Object value) {
        return new FieldSpec(name, wireAlias, required, nullable, value, kind, scalarType, recordRef);
    }

    /** Whether the payload key differs from the field name. */
    public boolean aliased() {
        return !wireAlias.equals(name);
    }

    /** Type label as written in descriptor resources, e.g. "integer", "User", "[Label]", "map". */
    public String typeLabel() {
        return switch (kind) {
            case SCALAR -> scalarType.label();
            case RECORD -> recordRef;
            case RECORD_LIST -> "[" + recordRef + "]";
            case SCALAR_LIST -> "[" + scalarType.label() + "]";
            case OPEN_MAP -> "map";
        };
    }
}

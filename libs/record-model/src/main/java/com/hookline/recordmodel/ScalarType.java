package com.hookline.recordmodel;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * JSON scalar kinds a {@link FieldSpec} can declare.
 *
 * <p>Matching is strict: a numeric string is not an {@link #INTEGER} and an integral double is not
 * an {@link #INTEGER} either. {@link #NUMBER} accepts any {@link Number}.
 */
public enum ScalarType {
    STRING("string"),
    INTEGER("integer"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    ANY("any");

    private final String label;

    ScalarType(String label) {
        this.label = label;
    }

    /** The name used in descriptor resources and error messages (e.g. "integer"). */
    public String label() {
        return label;
    }

    /**
     * Checks whether a non-null decoded JSON value belongs to this kind.
     *
     * @param value the value to check
     * @return true if the value may be stored in a field of this kind without conversion
     */
    public boolean accepts(Object value) {
        return switch (this) {
            case STRING -> value instanceof String;
            case INTEGER -> value instanceof Integer
                    || value instanceof Long
                    || value instanceof Short
                    || value instanceof Byte
                    || value instanceof BigInteger;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case ANY -> true;
        };
    }

    /**
     * Describes the JSON kind of a decoded value, for error messages.
     *
     * @param value any decoded JSON value, possibly null
     * @return one of "null", "string", "integer", "number", "boolean", "object", "array", or the
     *     simple class name for values that are not JSON-native
     */
    public static String kindOf(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return STRING.label;
        }
        if (value instanceof Boolean) {
            return BOOLEAN.label;
        }
        if (INTEGER.accepts(value)) {
            return INTEGER.label;
        }
        if (value instanceof Number) {
            return NUMBER.label;
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        if (value instanceof List<?>) {
            return "array";
        }
        return value.getClass().getSimpleName();
    }

    /**
     * Looks up a scalar type by its label.
     *
     * @param label e.g. "string"
     * @return the matching type, or null if the label is not a scalar kind
     */
    static ScalarType fromLabel(String label) {
        for (ScalarType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        return null;
    }
}

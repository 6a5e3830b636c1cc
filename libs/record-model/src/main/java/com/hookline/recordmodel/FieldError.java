package com.hookline.recordmodel;

/**
 * One field-level validation error.
 *
 * <p>Errors raised inside nested records are wrapped as {@link ErrorKind#NESTED_VALIDATION_FAILURE}
 * with the parent path prepended, keeping the original error as {@code cause}. Paths use dots for
 * nesting and brackets for list indexes: {@code pull_request.labels[1].name}.
 *
 * @param kind error category
 * @param path full field path from the validated root
 * @param expected expected type label (e.g. "integer", "User"); null for missing fields
 * @param actual JSON kind actually found (e.g. "string"); null for missing fields
 * @param cause the wrapped child error for nested failures, otherwise null
 */
public record FieldError(ErrorKind kind, String path, String expected, String actual, FieldError cause) {

    public FieldError {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be null or blank");
        }
    }

    /** Creates a missing-required-field error. */
    public static FieldError missing(String path) {
        return new FieldError(ErrorKind.MISSING_REQUIRED_FIELD, path, null, null, null);
    }

    /** Creates a type-mismatch error. */
    public static FieldError typeMismatch(String path, String expected, Object actualValue) {
        return new FieldError(
                ErrorKind.TYPE_MISMATCH, path, expected, ScalarType.kindOf(actualValue), null);
    }

    /**
     * Wraps this error as raised under a parent segment.
     *
     * @param parentSegment the parent field name, or field name plus index ("commits[2]")
     * @return a nested failure whose path is {@code parentSegment + "." + path}
     */
    public FieldError nestedUnder(String parentSegment) {
        return new FieldError(
                ErrorKind.NESTED_VALIDATION_FAILURE,
                parentSegment + "." + path,
                expected,
                actual,
                this);
    }

    /** The innermost error: a {@link ErrorKind#MISSING_REQUIRED_FIELD} or {@link ErrorKind#TYPE_MISMATCH}. */
    public FieldError rootCause() {
        FieldError current = this;
        while (current.cause != null) {
            current = current.cause;
        }
        return current;
    }

    /** Human-readable message, e.g. {@code "sender.id: expected integer but was string"}. */
    public String message() {
        FieldError root = rootCause();
        if (root.kind == ErrorKind.MISSING_REQUIRED_FIELD) {
            return path + ": missing required field";
        }
        return "%s: expected %s but was %s".formatted(path, root.expected, root.actual);
    }

    @Override
    public String toString() {
        return message();
    }
}

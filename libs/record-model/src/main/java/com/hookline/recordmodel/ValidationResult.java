package com.hookline.recordmodel;

import java.util.List;

/**
 * Result of validating a raw payload against a {@link RecordDescriptor}.
 *
 * <p>Schema drift is routine for webhook payloads, so failures are values rather than exceptions.
 *
 * @param valid true if validation passed with no errors
 * @param record the validated record; null when invalid
 * @param errors every field error found (empty when valid)
 */
public record ValidationResult(boolean valid, ValidatedRecord record, List<FieldError> errors) {

    /** Convenience factory for a successful validation. */
    public static ValidationResult ok(ValidatedRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }
        return new ValidationResult(true, record, List.of());
    }

    /** Convenience factory for a failed validation. */
    public static ValidationResult fail(List<FieldError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("a failed validation needs at least one error");
        }
        return new ValidationResult(false, null, List.copyOf(errors));
    }

    /** Error messages, one per field error. */
    public List<String> errorMessages() {
        return errors.stream().map(FieldError::message).toList();
    }

    /**
     * Returns the record, failing loudly if validation did not pass.
     *
     * @throws IllegalStateException if this result is a failure
     */
    public ValidatedRecord orElseThrow() {
        if (!valid) {
            throw new IllegalStateException("Validation failed: " + String.join("; ", errorMessages()));
        }
        return record;
    }
}

package com.hookline.recordmodel;

/** Categories of {@link FieldError}. */
public enum ErrorKind {

    /** A required field is absent from the payload. */
    MISSING_REQUIRED_FIELD,

    /** A field is present but its value has the wrong JSON kind. */
    TYPE_MISMATCH,

    /** A nested record or list element failed; the cause carries the original error. */
    NESTED_VALIDATION_FAILURE
}

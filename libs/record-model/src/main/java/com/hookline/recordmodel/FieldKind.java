package com.hookline.recordmodel;

/** Shape of the value a {@link FieldSpec} holds. */
public enum FieldKind {

    /** A single JSON scalar, typed by {@link ScalarType}. */
    SCALAR,

    /** A nested object validated against another descriptor. */
    RECORD,

    /** An array of objects, each validated against another descriptor. */
    RECORD_LIST,

    /** An array of scalars of one {@link ScalarType}. */
    SCALAR_LIST,

    /** An unstructured object passed through without validation. */
    OPEN_MAP;

    /** True for the two array kinds. */
    public boolean isList() {
        return this == RECORD_LIST || this == SCALAR_LIST;
    }
}

package com.hookline.recordmodel;

/**
 * One placeholder binding for {@link UrlTemplates#interpolate(String, java.util.List)}.
 *
 * @param name placeholder name, as it appears between braces in the template
 * @param value replacement; {@code null} and {@code ""} mark the parameter as absent
 */
public record UrlParam(String name, Object value) {

    public UrlParam {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
    }

    public static UrlParam of(String name, Object value) {
        return new UrlParam(name, value);
    }

    /** Whether this binding counts as "not supplied". */
    public boolean absent() {
        return value == null || "".equals(value);
    }
}

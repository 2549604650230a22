package io.reactiveactions.core;

import java.util.Objects;

/**
 * A single rejected field.
 *
 * @param field field name (required)
 * @param code machine-readable error code, e.g. {@code "nullable"} or {@code "blank"} (required)
 * @param message human-readable message (may be null)
 * @param rejectedValue the value that failed validation (may be null)
 */
public record FieldError(String field, String code, String message, Object rejectedValue) {
    public FieldError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(code, "code");
    }

    public FieldError(String field, String code) {
        this(field, code, null, null);
    }
}

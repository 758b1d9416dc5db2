package com.acme.analytics.collector.schema;

import java.util.Objects;

/**
 * Why a payload was rejected. {@code field} is null when the error is not tied to a single key.
 */
public record ValidationError(ValidationErrorKind kind, String field, String message) {
    public ValidationError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }
}

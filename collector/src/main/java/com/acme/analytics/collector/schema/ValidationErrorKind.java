package com.acme.analytics.collector.schema;

import java.util.Locale;

public enum ValidationErrorKind {
    MALFORMED_JSON,
    INVALID_TYPE,
    UNRECOGNIZED_FIELD,
    MISSING_FIELD,
    INVALID_ENUM,
    INVALID_TIMESTAMP,
    INVARIANT_VIOLATION;

    /** Lower-case form used in metric labels and error bodies. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

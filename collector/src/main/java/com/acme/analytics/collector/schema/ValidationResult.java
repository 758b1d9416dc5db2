package com.acme.analytics.collector.schema;

import com.acme.analytics.collector.event.Event;

public sealed interface ValidationResult permits ValidationResult.Valid, ValidationResult.Invalid {
    record Valid(Event event) implements ValidationResult {}
    record Invalid(ValidationError error) implements ValidationResult {}
}

package com.acme.analytics.collector.schema;

import com.acme.analytics.collector.event.Event;
import com.acme.analytics.collector.event.EventAction;
import com.acme.analytics.collector.event.EventEntity;
import com.acme.analytics.collector.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Structural and semantic validation of raw event payloads.
 *
 * <p>Pure apart from reading the clock and generating an id: no I/O, no shared mutable state,
 * safe to call from any number of threads.</p>
 *
 * <p>Accepted shape:</p>
 * <pre>
 * {"entity": "page"|"anchor", "action": "view"|"click", "appId": "...", "path": "...", "ts": "2024-05-01T10:00:00Z"}
 * </pre>
 * {@code path} and {@code ts} are optional; no other keys are allowed.
 */
public final class EventValidator {
    public static final String FIELD_ENTITY = "entity";
    public static final String FIELD_ACTION = "action";
    public static final String FIELD_PATH = "path";
    public static final String FIELD_TS = "ts";
    public static final String FIELD_APP_ID = "appId";

    private static final Set<String> RECOGNIZED_FIELDS = Set.of(
        FIELD_ENTITY, FIELD_ACTION, FIELD_PATH, FIELD_TS, FIELD_APP_ID
    );

    private final Clock clock;
    private final Supplier<String> idGenerator;

    public EventValidator() {
        this(Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public EventValidator(Clock clock, Supplier<String> idGenerator) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    public ValidationResult validate(String rawPayload) {
        if (rawPayload == null || rawPayload.isBlank()) {
            return invalid(ValidationErrorKind.MALFORMED_JSON, null, "empty payload");
        }
        JsonNode root;
        try {
            root = JsonCodec.readTree(rawPayload);
        } catch (JsonProcessingException e) {
            return invalid(ValidationErrorKind.MALFORMED_JSON, null, "payload is not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || root.isMissingNode()) {
            return invalid(ValidationErrorKind.MALFORMED_JSON, null, "empty payload");
        }
        return validate(root);
    }

    public ValidationResult validate(JsonNode root) {
        if (root == null || !root.isObject()) {
            return invalid(ValidationErrorKind.INVALID_TYPE, null, "payload must be a JSON object");
        }

        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!RECOGNIZED_FIELDS.contains(name)) {
                return invalid(ValidationErrorKind.UNRECOGNIZED_FIELD, name, "unrecognized field '" + name + "'");
            }
        }

        for (String required : new String[]{FIELD_ENTITY, FIELD_ACTION, FIELD_APP_ID}) {
            if (!root.has(required)) {
                return invalid(ValidationErrorKind.MISSING_FIELD, required, "missing required field '" + required + "'");
            }
        }
        for (String field : new String[]{FIELD_ENTITY, FIELD_ACTION, FIELD_APP_ID, FIELD_PATH, FIELD_TS}) {
            JsonNode value = root.get(field);
            if (value != null && !value.isTextual()) {
                return invalid(ValidationErrorKind.INVALID_TYPE, field, "field '" + field + "' must be a string");
            }
        }

        String appId = root.get(FIELD_APP_ID).asText();
        if (appId.isBlank()) {
            return invalid(ValidationErrorKind.MISSING_FIELD, FIELD_APP_ID, "field 'appId' must not be empty");
        }

        String rawEntity = root.get(FIELD_ENTITY).asText();
        EventEntity entity = EventEntity.fromWireName(rawEntity);
        if (entity == null) {
            return invalid(ValidationErrorKind.INVALID_ENUM, FIELD_ENTITY,
                "entity must be one of [page, anchor], got '" + rawEntity + "'");
        }
        String rawAction = root.get(FIELD_ACTION).asText();
        EventAction action = EventAction.fromWireName(rawAction);
        if (action == null) {
            return invalid(ValidationErrorKind.INVALID_ENUM, FIELD_ACTION,
                "action must be one of [view, click], got '" + rawAction + "'");
        }
        if (entity.requiredAction() != action) {
            return invalid(ValidationErrorKind.INVARIANT_VIOLATION, FIELD_ACTION,
                "entity '" + entity.wireName() + "' only allows action '" + entity.requiredAction().wireName() + "'");
        }

        Instant now = clock.instant();
        Instant occurredAt = now;
        JsonNode ts = root.get(FIELD_TS);
        if (ts != null) {
            try {
                occurredAt = OffsetDateTime.parse(ts.asText()).toInstant();
            } catch (DateTimeParseException e) {
                return invalid(ValidationErrorKind.INVALID_TIMESTAMP, FIELD_TS,
                    "ts must be an ISO-8601 date-time with offset, got '" + ts.asText() + "'");
            }
        }

        JsonNode path = root.get(FIELD_PATH);
        Event event = new Event(
            idGenerator.get(),
            now,
            occurredAt,
            entity,
            action,
            path == null ? null : path.asText(),
            appId
        );
        return new ValidationResult.Valid(event);
    }

    private static ValidationResult invalid(ValidationErrorKind kind, String field, String message) {
        return new ValidationResult.Invalid(new ValidationError(kind, field, message));
    }
}

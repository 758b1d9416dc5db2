package com.acme.analytics.collector.event;

import java.time.Instant;
import java.util.Objects;

/**
 * One validated telemetry event.
 *
 * <p>{@code id} and {@code recordedAt} are assigned by the collector; {@code occurredAt} is the
 * client timestamp when one was supplied, otherwise equal to {@code recordedAt}. {@code path} may be null.</p>
 */
public record Event(
    String id,
    Instant recordedAt,
    Instant occurredAt,
    EventEntity entity,
    EventAction action,
    String path,
    String appId
) {
    public Event {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(recordedAt, "recordedAt");
        Objects.requireNonNull(occurredAt, "occurredAt");
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(appId, "appId");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (appId.isBlank()) {
            throw new IllegalArgumentException("appId must not be blank");
        }
        if (entity.requiredAction() != action) {
            throw new IllegalArgumentException("entity " + entity.wireName() + " requires action "
                + entity.requiredAction().wireName() + ", got " + action.wireName());
        }
    }
}

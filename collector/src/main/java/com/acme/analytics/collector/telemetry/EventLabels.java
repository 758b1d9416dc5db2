package com.acme.analytics.collector.telemetry;

import com.acme.analytics.collector.event.Event;

import java.util.Objects;

/**
 * Label set shared by the per-event counters.
 */
public record EventLabels(String entity, String action, String appId) {
    public EventLabels {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(appId, "appId");
    }

    public static EventLabels of(Event event) {
        return new EventLabels(event.entity().wireName(), event.action().wireName(), event.appId());
    }
}

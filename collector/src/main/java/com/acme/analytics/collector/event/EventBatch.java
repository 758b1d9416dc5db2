package com.acme.analytics.collector.event;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, insertion-ordered events detached from the buffer by a single drain.
 */
public record EventBatch(long sequence, Instant drainedAt, List<Event> events) {
    public EventBatch {
        Objects.requireNonNull(drainedAt, "drainedAt");
        events = List.copyOf(Objects.requireNonNull(events, "events"));
    }

    public static EventBatch empty(long sequence, Instant drainedAt) {
        return new EventBatch(sequence, drainedAt, List.of());
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}

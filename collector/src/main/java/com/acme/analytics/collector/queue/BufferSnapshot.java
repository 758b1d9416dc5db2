package com.acme.analytics.collector.queue;

/** Lifetime counters of an {@link EventBuffer}; the current depth is {@link EventBuffer#depth()}. */
public record BufferSnapshot(
    int capacity,
    long acceptedTotal,
    long drainedTotal,
    long drains,
    boolean closed
) {}

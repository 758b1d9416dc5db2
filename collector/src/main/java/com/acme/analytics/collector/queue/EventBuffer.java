package com.acme.analytics.collector.queue;

import com.acme.analytics.collector.event.Event;
import com.acme.analytics.collector.event.EventBatch;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accumulates validated events between flushes.
 *
 * <p>Double-buffer swap: producers append to the active list under a short lock; {@link #drain()}
 * detaches the active list and installs a fresh one under the same lock. An offer that returned
 * {@link OfferResult.Accepted} before a drain started is in that drain's batch or a later one, exactly once.
 * The lock is never held while a batch is exported.</p>
 */
public final class EventBuffer {
    private static final int MIN_INITIAL_CAPACITY = 64;
    private static final int MAX_INITIAL_CAPACITY = 65_536;

    private final int capacity;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private ArrayList<Event> active;
    private boolean closed;
    private long nextSequence = 1L;
    private long acceptedTotal;
    private long drainedTotal;
    private long drains;

    private volatile int depth;

    public EventBuffer(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    public EventBuffer(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.active = new ArrayList<>(Math.min(capacity, MIN_INITIAL_CAPACITY));
    }

    public OfferResult offer(Event event) {
        Objects.requireNonNull(event, "event");
        lock.lock();
        try {
            if (closed) {
                return new OfferResult.Closed();
            }
            int size = active.size();
            if (size >= capacity) {
                return new OfferResult.Full(size, capacity);
            }
            active.add(event);
            acceptedTotal++;
            depth = size + 1;
            return new OfferResult.Accepted(size + 1);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically detaches everything accumulated so far. Returns an empty batch when nothing was offered.
     */
    public EventBatch drain() {
        return drain(false);
    }

    /**
     * Final drain: detaches the remaining events and rejects every later offer with {@link OfferResult.Closed}.
     */
    public EventBatch drainAndClose() {
        return drain(true);
    }

    private EventBatch drain(boolean close) {
        List<Event> detached;
        long sequence;
        lock.lock();
        try {
            detached = active;
            int nextInitial = Math.max(MIN_INITIAL_CAPACITY, Math.min(detached.size(), MAX_INITIAL_CAPACITY));
            active = new ArrayList<>(Math.min(nextInitial, capacity));
            sequence = nextSequence++;
            drainedTotal += detached.size();
            drains++;
            depth = 0;
            if (close) {
                closed = true;
            }
        } finally {
            lock.unlock();
        }
        return new EventBatch(sequence, clock.instant(), detached);
    }

    public int depth() {
        return depth;
    }

    public int capacity() {
        return capacity;
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public BufferSnapshot snapshot() {
        lock.lock();
        try {
            return new BufferSnapshot(capacity, acceptedTotal, drainedTotal, drains, closed);
        } finally {
            lock.unlock();
        }
    }
}

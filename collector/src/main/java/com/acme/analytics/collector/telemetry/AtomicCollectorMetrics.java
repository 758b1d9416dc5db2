package com.acme.analytics.collector.telemetry;

import com.acme.analytics.collector.export.ExportException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Lock-free counters; {@link #snapshot()} never blocks writers.
 */
public final class AtomicCollectorMetrics implements CollectorMetrics {
    private final ConcurrentHashMap<EventLabels, LongAdder> ingested = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, LongAdder> rejectedByReason = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<SinkLabels, LongAdder> exported = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<SinkFailure, LongAdder> exportFailures = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, LongAdder> failedEventsBySink = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<SinkLabels, LongAdder> failedEvents = new ConcurrentHashMap<>();
    private final LongAdder flushCycles = new LongAdder();
    private final LongAdder flushSkipped = new LongAdder();
    private final AtomicInteger bufferDepth = new AtomicInteger();

    @Override
    public void incIngested(EventLabels labels) {
        ingested.computeIfAbsent(labels, ignored -> new LongAdder()).increment();
    }

    @Override
    public void incRejected(String reason) {
        rejectedByReason.computeIfAbsent(reason, ignored -> new LongAdder()).increment();
    }

    @Override
    public void incExported(String sink, EventLabels labels, long n) {
        if (n <= 0) return;
        exported.computeIfAbsent(new SinkLabels(sink, labels), ignored -> new LongAdder()).add(n);
    }

    @Override
    public void incExportFailure(String sink, ExportException.Kind kind, long events) {
        exportFailures.computeIfAbsent(new SinkFailure(sink, kind.label()), ignored -> new LongAdder()).increment();
        if (events > 0) {
            failedEventsBySink.computeIfAbsent(sink, ignored -> new LongAdder()).add(events);
        }
    }

    @Override
    public void incExportFailedEvents(String sink, EventLabels labels, long n) {
        if (n <= 0) return;
        failedEvents.computeIfAbsent(new SinkLabels(sink, labels), ignored -> new LongAdder()).add(n);
    }

    @Override
    public void incFlushCycles() {
        flushCycles.increment();
    }

    @Override
    public void incFlushSkipped() {
        flushSkipped.increment();
    }

    @Override
    public void setBufferDepth(int depth) {
        bufferDepth.set(Math.max(0, depth));
    }

    public Snapshot snapshot() {
        return new Snapshot(
            mapToLongs(ingested),
            mapToLongs(rejectedByReason),
            mapToLongs(exported),
            mapToLongs(exportFailures),
            mapToLongs(failedEventsBySink),
            mapToLongs(failedEvents),
            flushCycles.sum(),
            flushSkipped.sum(),
            bufferDepth.get()
        );
    }

    private static <K> Map<K, Long> mapToLongs(ConcurrentHashMap<K, LongAdder> src) {
        Map<K, Long> out = new HashMap<>();
        src.forEach((k, v) -> out.put(k, v.sum()));
        return Collections.unmodifiableMap(out);
    }

    public record SinkLabels(String sink, EventLabels labels) {}

    public record SinkFailure(String sink, String kind) {}

    public record Snapshot(Map<EventLabels, Long> ingested,
                           Map<String, Long> rejectedByReason,
                           Map<SinkLabels, Long> exported,
                           Map<SinkFailure, Long> exportFailures,
                           Map<String, Long> failedEventsBySink,
                           Map<SinkLabels, Long> failedEvents,
                           long flushCycles,
                           long flushSkipped,
                           int bufferDepth) {

        public long ingestedCount(EventLabels labels) {
            return ingested.getOrDefault(labels, 0L);
        }

        public long rejectedCount(String reason) {
            return rejectedByReason.getOrDefault(reason, 0L);
        }

        public long exportedCount(String sink, EventLabels labels) {
            return exported.getOrDefault(new SinkLabels(sink, labels), 0L);
        }

        public long exportFailureCount(String sink, ExportException.Kind kind) {
            return exportFailures.getOrDefault(new SinkFailure(sink, kind.label()), 0L);
        }

        public long failedEventCount(String sink, EventLabels labels) {
            return failedEvents.getOrDefault(new SinkLabels(sink, labels), 0L);
        }

        public long totalIngested() {
            long total = 0L;
            for (Long v : ingested.values()) {
                total += v;
            }
            return total;
        }

        public long totalRejected() {
            long total = 0L;
            for (Long v : rejectedByReason.values()) {
                total += v;
            }
            return total;
        }
    }
}

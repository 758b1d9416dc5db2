package com.acme.analytics.collector.telemetry;

import com.acme.analytics.collector.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Logs a one-line JSON summary of the counters at a fixed interval.
 */
public final class PeriodicMetricsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicMetricsReporter.class.getName());

    private final AtomicCollectorMetrics metrics;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicMetricsReporter(AtomicCollectorMetrics metrics, long intervalSeconds) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "collector-metrics-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    void emit() {
        try {
            LOG.info(render(metrics.snapshot()));
        } catch (RuntimeException e) {
            LOG.warning("Metrics reporter failure: " + e.getClass().getSimpleName());
        }
    }

    static String render(AtomicCollectorMetrics.Snapshot s) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", "analytics-collector");
        payload.put("type", "collector_metrics");
        payload.put("ingested", s.totalIngested());
        payload.put("rejected", s.totalRejected());
        payload.put("rejectedByReason", s.rejectedByReason());
        payload.put("flushCycles", s.flushCycles());
        payload.put("flushSkipped", s.flushSkipped());
        payload.put("bufferDepth", s.bufferDepth());
        payload.put("failedEventsBySink", s.failedEventsBySink());
        try {
            return JsonCodec.writeString(payload);
        } catch (JsonProcessingException e) {
            return payload.toString();
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}

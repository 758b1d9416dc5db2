package com.acme.analytics.collector.telemetry;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import com.acme.analytics.collector.util.CollectorDefaults;
import com.acme.analytics.collector.util.CollectorStatusCodes;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Prometheus text exposition of the collector counters.
 */
public final class MetricsHttpEndpoint implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(MetricsHttpEndpoint.class.getName());
    private static final Pattern METRIC_NAME_SANITIZER = Pattern.compile("[^a-zA-Z0-9_]");
    static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final AtomicCollectorMetrics metrics;
    private final String path;
    private final Supplier<Map<String, Long>> additionalGaugesSupplier;
    private final HttpServer server;
    private final ExecutorService executor;

    public MetricsHttpEndpoint(AtomicCollectorMetrics metrics, int port, String path) throws IOException {
        this(metrics, port, path, () -> Map.of());
    }

    public MetricsHttpEndpoint(AtomicCollectorMetrics metrics,
                               int port,
                               String path,
                               Supplier<Map<String, Long>> additionalGaugesSupplier) throws IOException {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.path = normalizePath(path);
        this.additionalGaugesSupplier = additionalGaugesSupplier == null ? (() -> Map.of()) : additionalGaugesSupplier;
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.server.createContext(this.path, this::handle);
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "metrics-http-endpoint");
            t.setDaemon(true);
            return t;
        });
        this.server.setExecutor(executor);
    }

    public void start() {
        server.start();
        LOG.info(() -> "Metrics endpoint started on :" + listenPort() + path);
    }

    public int listenPort() {
        return server.getAddress().getPort();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                write(exchange, CollectorStatusCodes.METHOD_NOT_ALLOWED, "method not allowed\n");
                return;
            }
            Map<String, Long> extra = additionalGaugesSupplier.get();
            String body = renderPrometheus(metrics.snapshot(), extra == null ? Map.of() : extra);
            write(exchange, CollectorStatusCodes.OK, body);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Metrics render failure", e);
            write(exchange, CollectorStatusCodes.INTERNAL_ERROR, "internal error\n");
        }
    }

    private static void write(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", CONTENT_TYPE);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static String normalizePath(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return CollectorDefaults.DEFAULT_METRICS_PATH;
        }
        return rawPath.startsWith("/") ? rawPath : "/" + rawPath;
    }

    static String renderPrometheus(AtomicCollectorMetrics.Snapshot snapshot, Map<String, Long> additionalGauges) {
        StringBuilder sb = new StringBuilder(CollectorDefaults.DEFAULT_METRICS_RENDER_BUFFER);

        appendHelpType(sb, "analytics_events_ingested_total", "Events accepted into the buffer", "counter");
        for (Map.Entry<EventLabels, Long> e : sorted(snapshot.ingested(), Comparator.comparing(MetricsHttpEndpoint::sortKey))) {
            appendMetric(sb, "analytics_events_ingested_total", eventLabels(e.getKey()), e.getValue());
        }

        appendHelpType(sb, "analytics_events_rejected_total", "Payloads rejected by reason", "counter");
        for (Map.Entry<String, Long> e : sorted(snapshot.rejectedByReason(), Comparator.naturalOrder())) {
            appendMetric(sb, "analytics_events_rejected_total", Map.of("reason", e.getKey()), e.getValue());
        }

        appendHelpType(sb, "analytics_events_exported_total", "Events written by each sink", "counter");
        for (Map.Entry<AtomicCollectorMetrics.SinkLabels, Long> e
            : sorted(snapshot.exported(), Comparator.comparing((AtomicCollectorMetrics.SinkLabels k) -> k.sink() + '|' + sortKey(k.labels())))) {
            Map<String, String> labels = new LinkedHashMap<>();
            labels.put("sink", e.getKey().sink());
            labels.putAll(eventLabels(e.getKey().labels()));
            appendMetric(sb, "analytics_events_exported_total", labels, e.getValue());
        }

        appendHelpType(sb, "analytics_export_failures_total", "Failed batch exports by sink and kind", "counter");
        for (Map.Entry<AtomicCollectorMetrics.SinkFailure, Long> e
            : sorted(snapshot.exportFailures(), Comparator.comparing((AtomicCollectorMetrics.SinkFailure k) -> k.sink() + '|' + k.kind()))) {
            Map<String, String> labels = new LinkedHashMap<>();
            labels.put("sink", e.getKey().sink());
            labels.put("kind", e.getKey().kind());
            appendMetric(sb, "analytics_export_failures_total", labels, e.getValue());
        }

        appendHelpType(sb, "analytics_export_failed_events_total", "Events in batches a sink failed to write", "counter");
        for (Map.Entry<AtomicCollectorMetrics.SinkLabels, Long> e
            : sorted(snapshot.failedEvents(), Comparator.comparing((AtomicCollectorMetrics.SinkLabels k) -> k.sink() + '|' + sortKey(k.labels())))) {
            Map<String, String> labels = new LinkedHashMap<>();
            labels.put("sink", e.getKey().sink());
            labels.putAll(eventLabels(e.getKey().labels()));
            appendMetric(sb, "analytics_export_failed_events_total", labels, e.getValue());
        }

        appendHelpType(sb, "analytics_flush_cycles_total", "Completed flush cycles", "counter");
        appendMetric(sb, "analytics_flush_cycles_total", Map.of(), snapshot.flushCycles());

        appendHelpType(sb, "analytics_flush_skipped_total", "Flush ticks skipped because a cycle was still running", "counter");
        appendMetric(sb, "analytics_flush_skipped_total", Map.of(), snapshot.flushSkipped());

        appendHelpType(sb, "analytics_buffer_depth", "Events waiting for the next flush", "gauge");
        appendMetric(sb, "analytics_buffer_depth", Map.of(), snapshot.bufferDepth());

        if (additionalGauges != null && !additionalGauges.isEmpty()) {
            for (Map.Entry<String, Long> e : sorted(additionalGauges, Comparator.naturalOrder())) {
                String metricName = toMetricName("analytics_" + e.getKey());
                appendHelpType(sb, metricName, "Additional collector gauge: " + e.getKey(), "gauge");
                appendMetric(sb, metricName, Map.of(), e.getValue());
            }
        }
        return sb.toString();
    }

    private static <K> List<Map.Entry<K, Long>> sorted(Map<K, Long> src, Comparator<K> order) {
        List<Map.Entry<K, Long>> entries = new ArrayList<>(src.entrySet());
        entries.sort(Map.Entry.comparingByKey(order));
        return entries;
    }

    private static String sortKey(EventLabels labels) {
        return labels.entity() + '|' + labels.action() + '|' + labels.appId();
    }

    private static Map<String, String> eventLabels(EventLabels labels) {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("entity", labels.entity());
        out.put("action", labels.action());
        out.put("app_id", labels.appId());
        return out;
    }

    private static String toMetricName(String raw) {
        String normalized = METRIC_NAME_SANITIZER.matcher(raw).replaceAll("_");
        if (normalized.isBlank()) {
            return "analytics_unknown_metric";
        }
        char first = normalized.charAt(0);
        if ((first >= 'a' && first <= 'z') || (first >= 'A' && first <= 'Z') || first == '_') {
            return normalized;
        }
        return "analytics_" + normalized;
    }

    private static void appendHelpType(StringBuilder sb, String metric, String help, String type) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
    }

    private static void appendMetric(StringBuilder sb, String name, Map<String, String> labels, long value) {
        sb.append(name);
        if (labels != null && !labels.isEmpty()) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, String> e : labels.entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                sb.append(e.getKey()).append("=\"").append(escapeLabelValue(e.getValue())).append('"');
            }
            sb.append('}');
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabelValue(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}

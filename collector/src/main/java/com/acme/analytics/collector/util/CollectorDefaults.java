package com.acme.analytics.collector.util;

/**
 * Default sizes, timeouts and ports.
 */
public final class CollectorDefaults {

    // ---- Network ----
    public static final int DEFAULT_PORT = 8000;
    public static final int DEFAULT_SO_BACKLOG = 1024;
    public static final int DEFAULT_MAX_BODY_BYTES = 1024;
    /** Aggregator ceiling; bodies above {@code MAX_BODY_BYTES} but below this get a proper 413. */
    public static final int MAX_AGGREGATED_CONTENT_LENGTH = 1024 * 1024;
    public static final String DEFAULT_METRICS_PATH = "/metrics";
    public static final String HEALTHCHECK_PATH = "/healthcheck";

    // ---- Buffer / flush ----
    public static final int DEFAULT_BUFFER_CAPACITY = 1_000_000;
    public static final long DEFAULT_FLUSH_INTERVAL_MS = 10_000L;
    public static final long DEFAULT_EXPORT_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_SHUTDOWN_GRACE_MS = 10_000L;

    // ---- Storage ----
    public static final int DEFAULT_DATABASE_POOL_SIZE = 4;
    public static final String EVENTS_TABLE = "events";

    // ---- Telemetry ----
    public static final int DEFAULT_METRICS_LOG_INTERVAL_SEC = 60;
    public static final int DEFAULT_METRICS_RENDER_BUFFER = 2048;

    private CollectorDefaults() {
    }
}

package com.acme.analytics.collector.util;

/**
 * Environment variable names read at startup.
 */
public final class CollectorEnvKeys {
    public static final String PORT = "PORT";
    public static final String DATABASE_URL = "DATABASE_URL";
    public static final String DATABASE_USER = "DATABASE_USER";
    public static final String DATABASE_PASSWORD = "DATABASE_PASSWORD";
    public static final String DATABASE_INIT_SCHEMA = "DATABASE_INIT_SCHEMA";
    public static final String DATABASE_POOL_SIZE = "DATABASE_POOL_SIZE";
    public static final String PARQUET_OUTPUT_DIR = "PARQUET_OUTPUT_DIR";
    public static final String FLUSH_INTERVAL_MS = "FLUSH_INTERVAL_MS";
    public static final String EXPORT_TIMEOUT_MS = "EXPORT_TIMEOUT_MS";
    public static final String SHUTDOWN_GRACE_MS = "SHUTDOWN_GRACE_MS";
    public static final String MAX_BODY_BYTES = "MAX_BODY_BYTES";
    public static final String BUFFER_CAPACITY = "BUFFER_CAPACITY";
    public static final String METRICS_ENABLED = "METRICS_ENABLED";
    public static final String METRICS_PORT = "METRICS_PORT";
    public static final String METRICS_PATH = "METRICS_PATH";
    public static final String METRICS_LOG_INTERVAL_SEC = "METRICS_LOG_INTERVAL_SEC";

    private CollectorEnvKeys() {
    }
}

package com.acme.analytics.collector.server;

import com.acme.analytics.collector.util.CollectorDefaults;
import com.acme.analytics.collector.util.CollectorEnvKeys;
import com.acme.analytics.collector.util.EnvVars;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Startup configuration read from environment variables.
 *
 * <p>{@code databaseUrl} and {@code parquetOutputDir} are null when the corresponding sink is disabled.
 * Port 0 binds an ephemeral port; the metrics port then defaults to 0 as well.</p>
 */
public record CollectorConfig(
    int port,
    String databaseUrl,
    String databaseUser,
    String databasePassword,
    boolean databaseInitSchema,
    int databasePoolSize,
    Path parquetOutputDir,
    Duration flushInterval,
    Duration exportTimeout,
    Duration shutdownGrace,
    int maxBodyBytes,
    int bufferCapacity,
    boolean metricsEnabled,
    int metricsPort,
    String metricsPath,
    int metricsLogIntervalSec
) {
    public CollectorConfig {
        Objects.requireNonNull(flushInterval, "flushInterval");
        Objects.requireNonNull(exportTimeout, "exportTimeout");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace");
        Objects.requireNonNull(metricsPath, "metricsPath");
    }

    public static CollectorConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        int port = EnvVars.getIntClamped(env, CollectorEnvKeys.PORT, CollectorDefaults.DEFAULT_PORT, 0, 65_534);
        int defaultMetricsPort = port == 0 ? 0 : port + 1;
        String parquetDir = EnvVars.getOptional(env, CollectorEnvKeys.PARQUET_OUTPUT_DIR);

        return new CollectorConfig(
            port,
            EnvVars.getOptional(env, CollectorEnvKeys.DATABASE_URL),
            EnvVars.getOptional(env, CollectorEnvKeys.DATABASE_USER),
            EnvVars.getOptional(env, CollectorEnvKeys.DATABASE_PASSWORD),
            EnvVars.getBoolean(env, CollectorEnvKeys.DATABASE_INIT_SCHEMA, false),
            EnvVars.getIntClamped(env, CollectorEnvKeys.DATABASE_POOL_SIZE,
                CollectorDefaults.DEFAULT_DATABASE_POOL_SIZE, 1, 64),
            parquetDir == null ? null : Path.of(parquetDir),
            Duration.ofMillis(EnvVars.getLongClamped(env, CollectorEnvKeys.FLUSH_INTERVAL_MS,
                CollectorDefaults.DEFAULT_FLUSH_INTERVAL_MS, 10L, 3_600_000L)),
            Duration.ofMillis(EnvVars.getLongClamped(env, CollectorEnvKeys.EXPORT_TIMEOUT_MS,
                CollectorDefaults.DEFAULT_EXPORT_TIMEOUT_MS, 100L, 600_000L)),
            Duration.ofMillis(EnvVars.getLongClamped(env, CollectorEnvKeys.SHUTDOWN_GRACE_MS,
                CollectorDefaults.DEFAULT_SHUTDOWN_GRACE_MS, 0L, 600_000L)),
            EnvVars.getIntClamped(env, CollectorEnvKeys.MAX_BODY_BYTES,
                CollectorDefaults.DEFAULT_MAX_BODY_BYTES, 64, CollectorDefaults.MAX_AGGREGATED_CONTENT_LENGTH),
            EnvVars.getIntClamped(env, CollectorEnvKeys.BUFFER_CAPACITY,
                CollectorDefaults.DEFAULT_BUFFER_CAPACITY, 1, 50_000_000),
            EnvVars.getBoolean(env, CollectorEnvKeys.METRICS_ENABLED, true),
            EnvVars.getIntClamped(env, CollectorEnvKeys.METRICS_PORT, defaultMetricsPort, 0, 65_535),
            EnvVars.getOrDefault(env, CollectorEnvKeys.METRICS_PATH, CollectorDefaults.DEFAULT_METRICS_PATH),
            EnvVars.getIntClamped(env, CollectorEnvKeys.METRICS_LOG_INTERVAL_SEC,
                CollectorDefaults.DEFAULT_METRICS_LOG_INTERVAL_SEC, 0, 86_400)
        );
    }

    @Override
    public String toString() {
        return "CollectorConfig[port=" + port
            + ", relationalSink=" + (databaseUrl != null)
            + ", parquetOutputDir=" + parquetOutputDir
            + ", flushIntervalMs=" + flushInterval.toMillis()
            + ", exportTimeoutMs=" + exportTimeout.toMillis()
            + ", shutdownGraceMs=" + shutdownGrace.toMillis()
            + ", maxBodyBytes=" + maxBodyBytes
            + ", bufferCapacity=" + bufferCapacity
            + ", metricsEnabled=" + metricsEnabled
            + ", metricsPort=" + metricsPort
            + ", metricsPath=" + metricsPath
            + "]";
    }
}

package com.acme.analytics.collector.server;

import com.acme.analytics.collector.export.EventSink;
import com.acme.analytics.collector.export.parquet.ParquetEventSink;
import com.acme.analytics.collector.export.relational.DatabaseUrl;
import com.acme.analytics.collector.export.relational.RelationalDataSources;
import com.acme.analytics.collector.export.relational.RelationalEventSink;
import com.acme.analytics.collector.flush.FlushScheduler;
import com.acme.analytics.collector.ingest.EventIngestPipeline;
import com.acme.analytics.collector.queue.BufferSnapshot;
import com.acme.analytics.collector.queue.EventBuffer;
import com.acme.analytics.collector.schema.EventValidator;
import com.acme.analytics.collector.telemetry.AtomicCollectorMetrics;
import com.acme.analytics.collector.telemetry.MetricsHttpEndpoint;
import com.acme.analytics.collector.telemetry.PeriodicMetricsReporter;
import com.acme.analytics.collector.transport.http.NettyIngestHttpAdapter;
import com.acme.analytics.collector.util.CollectorDefaults;
import com.zaxxer.hikari.HikariDataSource;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns every runtime component and their start/stop order.
 *
 * <p>Stop order: ingestion port first, then the final flush, then telemetry and sinks.</p>
 */
public final class CollectorServer implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(CollectorServer.class.getName());

    private final CollectorConfig config;
    private final AtomicCollectorMetrics metrics;
    private final EventBuffer buffer;
    private final List<EventSink> sinks;
    private final FlushScheduler scheduler;
    private final NettyIngestHttpAdapter httpAdapter;
    private final MetricsHttpEndpoint metricsEndpoint;
    private final PeriodicMetricsReporter metricsReporter;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    CollectorServer(CollectorConfig config, List<EventSink> sinks) {
        this.config = Objects.requireNonNull(config, "config");
        this.sinks = List.copyOf(sinks);
        this.metrics = new AtomicCollectorMetrics();
        this.buffer = new EventBuffer(config.bufferCapacity());
        this.scheduler = new FlushScheduler(buffer, this.sinks, config.flushInterval(), config.exportTimeout(), metrics);
        this.httpAdapter = new NettyIngestHttpAdapter(config.port(), config.maxBodyBytes(), scheduler::isRunning, metrics);
        this.httpAdapter.setInboundHandler(new EventIngestPipeline(new EventValidator(), buffer, metrics));

        MetricsHttpEndpoint endpoint = null;
        PeriodicMetricsReporter reporter = null;
        if (config.metricsEnabled()) {
            try {
                endpoint = new MetricsHttpEndpoint(metrics, config.metricsPort(), config.metricsPath(), () -> bufferGauges(buffer.snapshot()));
            } catch (IOException e) {
                LOG.warning("Metrics endpoint init failed on port " + config.metricsPort() + ": " + e.getMessage());
            }
            if (config.metricsLogIntervalSec() > 0) {
                reporter = new PeriodicMetricsReporter(metrics, config.metricsLogIntervalSec());
            }
        }
        this.metricsEndpoint = endpoint;
        this.metricsReporter = reporter;
    }

    /**
     * Builds the server and the sinks enabled by {@code config}.
     */
    public static CollectorServer create(CollectorConfig config) {
        List<EventSink> sinks = buildSinks(config);
        try {
            return new CollectorServer(config, sinks);
        } catch (RuntimeException e) {
            closeSinks(sinks);
            throw e;
        }
    }

    static List<EventSink> buildSinks(CollectorConfig config) {
        List<EventSink> sinks = new ArrayList<>();
        if (config.databaseUrl() != null) {
            DatabaseUrl url = DatabaseUrl.parse(config.databaseUrl(), config.databaseUser(), config.databasePassword());
            HikariDataSource dataSource = RelationalDataSources.pooled(url, config.databasePoolSize());
            RelationalEventSink sink = new RelationalEventSink(
                RelationalEventSink.DEFAULT_NAME, dataSource, CollectorDefaults.EVENTS_TABLE, true, config.exportTimeout());
            if (config.databaseInitSchema()) {
                try {
                    sink.createSchemaIfMissing();
                } catch (RuntimeException e) {
                    dataSource.close();
                    throw e;
                }
            }
            sinks.add(sink);
            LOG.info(() -> "Relational sink enabled url=" + url.jdbcUrl());
        } else {
            LOG.info("Relational sink disabled: DATABASE_URL is not set");
        }
        if (config.parquetOutputDir() != null) {
            ParquetEventSink sink = new ParquetEventSink(config.parquetOutputDir());
            sinks.add(sink);
            LOG.info(() -> "Parquet sink enabled dir=" + sink.outputDir());
        } else {
            LOG.info("Parquet sink disabled: PARQUET_OUTPUT_DIR is not set");
        }
        if (sinks.isEmpty()) {
            LOG.warning("No export sinks configured; events are only counted");
        }
        return sinks;
    }

    public void start() throws Exception {
        LOG.info(() -> "Starting analytics collector " + config);
        if (metricsReporter != null) {
            metricsReporter.start();
        }
        if (metricsEndpoint != null) {
            metricsEndpoint.start();
        }
        scheduler.start();
        try {
            httpAdapter.start();
        } catch (Exception e) {
            stop();
            throw e;
        }
    }

    public void stop() {
        stop(config.shutdownGrace());
    }

    public void stop(Duration grace) {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        try {
            httpAdapter.stop();
        } catch (Exception e) {
            LOG.fine("Shutdown: httpAdapter stop failed: " + e.getClass().getSimpleName());
        }
        try {
            scheduler.shutdown(grace);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Shutdown: final flush failed", e);
        }
        if (metricsReporter != null) {
            try {
                metricsReporter.close();
            } catch (RuntimeException e) {
                LOG.fine("Shutdown: metricsReporter close failed: " + e.getClass().getSimpleName());
            }
        }
        if (metricsEndpoint != null) {
            try {
                metricsEndpoint.close();
            } catch (RuntimeException e) {
                LOG.fine("Shutdown: metricsEndpoint close failed: " + e.getClass().getSimpleName());
            }
        }
        closeSinks(sinks);
        LOG.info("Analytics collector stopped");
    }

    private static void closeSinks(List<EventSink> sinks) {
        for (EventSink sink : sinks) {
            try {
                sink.close();
            } catch (Exception e) {
                LOG.fine("Shutdown: sink " + sink.name() + " close failed: " + e.getClass().getSimpleName());
            }
        }
    }

    static Map<String, Long> bufferGauges(BufferSnapshot snapshot) {
        return Map.of(
            "buffer_capacity", (long) snapshot.capacity(),
            "buffer_accepted", snapshot.acceptedTotal(),
            "buffer_drained", snapshot.drainedTotal(),
            "buffer_drains", snapshot.drains(),
            "buffer_closed", snapshot.closed() ? 1L : 0L
        );
    }

    public int ingestPort() {
        return httpAdapter.listenPort();
    }

    public int metricsPort() {
        return metricsEndpoint == null ? -1 : metricsEndpoint.listenPort();
    }

    public AtomicCollectorMetrics metrics() {
        return metrics;
    }

    public FlushScheduler scheduler() {
        return scheduler;
    }

    public List<EventSink> sinks() {
        return sinks;
    }

    @Override
    public void close() {
        stop();
    }
}

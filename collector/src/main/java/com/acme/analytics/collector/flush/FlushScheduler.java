package com.acme.analytics.collector.flush;

import com.acme.analytics.collector.event.Event;
import com.acme.analytics.collector.event.EventBatch;
import com.acme.analytics.collector.export.EventSink;
import com.acme.analytics.collector.export.ExportException;
import com.acme.analytics.collector.queue.EventBuffer;
import com.acme.analytics.collector.telemetry.CollectorMetrics;
import com.acme.analytics.collector.telemetry.EventLabels;
import com.acme.analytics.collector.telemetry.NoopCollectorMetrics;
import com.acme.analytics.collector.util.CollectorDefaults;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically drains the {@link EventBuffer} and fans each batch out to every sink.
 *
 * <p>State machine: {@code IDLE -> DRAINING -> EXPORTING -> IDLE}, terminal {@code SHUTTING_DOWN}.
 * At most one cycle is in flight; a tick that finds one running is skipped and counted.
 * Each sink has its own single-thread executor, so a sink is never called concurrently with itself
 * and a slow sink cannot delay its siblings. A sink that does not answer within the export timeout
 * is reported as failed for that cycle and its write is interrupted. Until that write returns, the
 * sink's share of later cycles fails immediately instead of queuing. Failures are recorded, never
 * retried.</p>
 */
public final class FlushScheduler implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(FlushScheduler.class.getName());

    private final EventBuffer buffer;
    private final List<SinkWorker> workers;
    private final CollectorMetrics metrics;
    private final Duration interval;
    private final Duration exportTimeout;
    private final ScheduledExecutorService timer;
    private final AtomicReference<FlushState> state = new AtomicReference<>(FlushState.IDLE);
    private final AtomicReference<CompletableFuture<FlushReport>> inFlight =
        new AtomicReference<>(CompletableFuture.completedFuture(null));

    private volatile boolean started;

    public FlushScheduler(EventBuffer buffer, List<? extends EventSink> sinks, Duration interval, Duration exportTimeout) {
        this(buffer, sinks, interval, exportTimeout, NoopCollectorMetrics.INSTANCE);
    }

    public FlushScheduler(EventBuffer buffer,
                          List<? extends EventSink> sinks,
                          Duration interval,
                          Duration exportTimeout,
                          CollectorMetrics metrics) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.exportTimeout = Objects.requireNonNull(exportTimeout, "exportTimeout");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        if (exportTimeout.isNegative() || exportTimeout.isZero()) {
            throw new IllegalArgumentException("exportTimeout must be > 0");
        }
        this.metrics = metrics == null ? NoopCollectorMetrics.INSTANCE : metrics;

        Map<String, SinkWorker> byName = new LinkedHashMap<>();
        for (EventSink sink : Objects.requireNonNull(sinks, "sinks")) {
            Objects.requireNonNull(sink, "sink");
            if (byName.containsKey(sink.name())) {
                throw new IllegalArgumentException("duplicate sink name: " + sink.name());
            }
            byName.put(sink.name(), new SinkWorker(sink));
        }
        this.workers = List.copyOf(byName.values());
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "collector-flush-timer");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (started || state.get() == FlushState.SHUTTING_DOWN) {
            return;
        }
        long periodMs = Math.max(1L, interval.toMillis());
        timer.scheduleAtFixedRate(this::tick, periodMs, periodMs, TimeUnit.MILLISECONDS);
        started = true;
        LOG.info(() -> "Flush scheduler started interval=" + interval.toMillis() + "ms sinks=" + sinkNames());
    }

    /** True between {@link #start()} and {@link #shutdown(Duration)}. */
    public boolean isRunning() {
        return started && state.get() != FlushState.SHUTTING_DOWN;
    }

    public FlushState state() {
        return state.get();
    }

    public List<String> sinkNames() {
        List<String> names = new ArrayList<>(workers.size());
        for (SinkWorker w : workers) {
            names.add(w.sink.name());
        }
        return names;
    }

    void tick() {
        try {
            if (state.get() == FlushState.SHUTTING_DOWN) {
                return;
            }
            if (flushNow().isEmpty() && state.get() != FlushState.SHUTTING_DOWN) {
                metrics.incFlushSkipped();
                LOG.fine("Flush tick skipped: previous cycle still in flight");
            }
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Flush tick failure", e);
        }
    }

    /**
     * Starts a cycle now unless one is already in flight or the scheduler is shutting down.
     */
    public Optional<CompletableFuture<FlushReport>> flushNow() {
        if (!state.compareAndSet(FlushState.IDLE, FlushState.DRAINING)) {
            return Optional.empty();
        }
        CompletableFuture<FlushReport> tracked = new CompletableFuture<>();
        inFlight.set(tracked);
        CompletableFuture<FlushReport> cycle;
        try {
            EventBatch batch = buffer.drain();
            metrics.setBufferDepth(buffer.depth());
            state.compareAndSet(FlushState.DRAINING, FlushState.EXPORTING);
            cycle = export(batch, exportTimeout);
        } catch (RuntimeException e) {
            state.compareAndSet(FlushState.DRAINING, FlushState.IDLE);
            state.compareAndSet(FlushState.EXPORTING, FlushState.IDLE);
            tracked.completeExceptionally(e);
            throw e;
        }
        cycle.whenComplete((report, error) -> {
            metrics.incFlushCycles();
            state.compareAndSet(FlushState.EXPORTING, FlushState.IDLE);
            if (error != null) {
                tracked.completeExceptionally(error);
            } else {
                tracked.complete(report);
            }
        });
        return Optional.of(tracked);
    }

    private CompletableFuture<FlushReport> export(EventBatch batch, Duration timeout) {
        if (batch.isEmpty() || workers.isEmpty()) {
            if (!batch.isEmpty()) {
                LOG.fine(() -> "Flush cycle " + batch.sequence() + " drained " + batch.size() + " events with no sinks configured");
            }
            return CompletableFuture.completedFuture(new FlushReport(batch.sequence(), batch.size(), Map.of()));
        }

        Map<String, CompletableFuture<SinkOutcome>> perSink = new LinkedHashMap<>();
        for (SinkWorker worker : workers) {
            perSink.put(worker.sink.name(), exportTo(worker, batch, timeout));
        }
        return CompletableFuture.allOf(perSink.values().toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> {
                Map<String, SinkOutcome> outcomes = new LinkedHashMap<>();
                perSink.forEach((name, f) -> outcomes.put(name, f.join()));
                FlushReport report = new FlushReport(batch.sequence(), batch.size(), outcomes);
                LOG.fine(() -> "Flush cycle " + batch.sequence() + " exported " + batch.size() + " events: " + outcomes);
                return report;
            });
    }

    private CompletableFuture<SinkOutcome> exportTo(SinkWorker worker, EventBatch batch, Duration timeout) {
        String sinkName = worker.sink.name();
        SinkWrite write;
        try {
            write = worker.submit(batch);
        } catch (RejectedExecutionException e) {
            return recorded(sinkName, batch, CompletableFuture.completedFuture(
                new SinkOutcome.Failed(ExportException.Kind.CONNECTION, "sink executor stopped")));
        }
        if (write == null) {
            // the batch is discarded rather than queued behind a write that has not returned
            return recorded(sinkName, batch, CompletableFuture.completedFuture(
                new SinkOutcome.Failed(ExportException.Kind.CONNECTION, "previous write still in flight")));
        }
        CompletableFuture<SinkOutcome> outcome = write.result
            .orTimeout(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS)
            .exceptionally(error -> {
                Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                if (cause instanceof TimeoutException) {
                    worker.abandon(write);
                    return new SinkOutcome.Failed(ExportException.Kind.CONNECTION,
                        "export timed out after " + timeout.toMillis() + "ms");
                }
                return new SinkOutcome.Failed(ExportException.Kind.CONNECTION,
                    "unexpected " + cause.getClass().getSimpleName() + ": " + cause.getMessage());
            });
        return recorded(sinkName, batch, outcome);
    }

    private CompletableFuture<SinkOutcome> recorded(String sinkName, EventBatch batch, CompletableFuture<SinkOutcome> outcome) {
        return outcome.thenApply(result -> {
            record(sinkName, batch, result);
            return result;
        });
    }

    private static SinkOutcome writeBatch(EventSink sink, EventBatch batch) {
        try {
            return new SinkOutcome.Exported(sink.writeBatch(batch));
        } catch (ExportException e) {
            return new SinkOutcome.Failed(e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Sink " + sink.name() + " threw unexpectedly", e);
            return new SinkOutcome.Failed(ExportException.Kind.CONNECTION,
                "unexpected " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void record(String sinkName, EventBatch batch, SinkOutcome outcome) {
        Map<EventLabels, Long> byLabels = new HashMap<>();
        for (Event event : batch.events()) {
            byLabels.merge(EventLabels.of(event), 1L, Long::sum);
        }
        if (outcome instanceof SinkOutcome.Exported) {
            byLabels.forEach((labels, n) -> metrics.incExported(sinkName, labels, n));
        } else if (outcome instanceof SinkOutcome.Failed failed) {
            metrics.incExportFailure(sinkName, failed.kind(), batch.size());
            byLabels.forEach((labels, n) -> metrics.incExportFailedEvents(sinkName, labels, n));
            LOG.warning("Sink " + sinkName + " failed batch " + batch.sequence()
                + " (" + batch.size() + " events) kind=" + failed.kind() + ": " + failed.message());
        }
    }

    /**
     * Stops the timer, lets an in-flight cycle finish within {@code grace}, then drains the buffer
     * one last time and exports it with whatever grace is left. Offers made afterwards are rejected.
     *
     * @return the report of the final flush
     */
    public FlushReport shutdown(Duration grace) {
        Objects.requireNonNull(grace, "grace");
        long deadline = System.nanoTime() + Math.max(0L, grace.toNanos());
        timer.shutdownNow();

        awaitInFlight(deadline);
        FlushState previous = state.getAndSet(FlushState.SHUTTING_DOWN);
        if (previous == FlushState.SHUTTING_DOWN) {
            return new FlushReport(0L, 0, Map.of());
        }
        if (previous != FlushState.IDLE) {
            // a manual flush slipped in after the first wait
            awaitInFlight(deadline);
        }

        EventBatch last = buffer.drainAndClose();
        metrics.setBufferDepth(0);
        FlushReport report = new FlushReport(last.sequence(), last.size(), Map.of());
        long remainingMs = TimeUnit.NANOSECONDS.toMillis(remainingNanos(deadline));
        if (!last.isEmpty()) {
            CompletableFuture<FlushReport> finalCycle = export(last, Duration.ofMillis(Math.max(1L, remainingMs)));
            try {
                report = finalCycle.get(Math.max(1L, remainingMs) + 100L, TimeUnit.MILLISECONDS);
                metrics.incFlushCycles();
            } catch (TimeoutException e) {
                LOG.warning("Shutdown: final flush of " + last.size() + " events did not finish within grace period");
            } catch (ExecutionException e) {
                LOG.log(Level.WARNING, "Shutdown: final flush failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        for (SinkWorker worker : workers) {
            worker.executor.shutdownNow();
        }
        FlushReport finalReport = report;
        LOG.info(() -> "Flush scheduler stopped; final flush exported " + finalReport.batchSize()
            + " events to " + finalReport.outcomes().keySet());
        return report;
    }

    private void awaitInFlight(long deadline) {
        try {
            inFlight.get().get(remainingNanos(deadline), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            LOG.warning("Shutdown: in-flight flush cycle did not finish within grace period");
        } catch (ExecutionException e) {
            LOG.log(Level.WARNING, "Shutdown: in-flight flush cycle failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static long remainingNanos(long deadline) {
        return Math.max(0L, deadline - System.nanoTime());
    }

    /** Shuts down with the default grace period of {@value CollectorDefaults#DEFAULT_SHUTDOWN_GRACE_MS}ms. */
    @Override
    public void close() {
        shutdown(Duration.ofMillis(CollectorDefaults.DEFAULT_SHUTDOWN_GRACE_MS));
    }

    /**
     * One sink plus its export thread. At most one write per sink is outstanding: while a write has
     * not returned, {@link #submit} refuses new batches instead of queuing them.
     */
    private static final class SinkWorker {
        private final EventSink sink;
        private final ExecutorService executor;
        private final AtomicBoolean busy = new AtomicBoolean(false);

        private SinkWorker(EventSink sink) {
            this.sink = sink;
            this.executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "collector-export-" + sink.name());
                t.setDaemon(true);
                return t;
            });
        }

        /** Returns null while the previous write is still running. */
        SinkWrite submit(EventBatch batch) {
            if (!busy.compareAndSet(false, true)) {
                return null;
            }
            SinkWrite write = new SinkWrite();
            try {
                write.task = executor.submit(() -> run(write, batch));
            } catch (RejectedExecutionException e) {
                busy.set(false);
                throw e;
            }
            return write;
        }

        private void run(SinkWrite write, EventBatch batch) {
            if (!write.started.compareAndSet(false, true)) {
                return;
            }
            SinkOutcome outcome;
            try {
                outcome = writeBatch(sink, batch);
            } finally {
                busy.set(false);
            }
            // completing runs the cycle's continuations, which may submit the next batch
            write.result.complete(outcome);
        }

        /**
         * Gives up on a write that exceeded the export timeout. A write that never started is dropped;
         * a running one is interrupted and keeps the sink busy until it actually returns.
         */
        void abandon(SinkWrite write) {
            Future<?> task = write.task;
            if (write.started.compareAndSet(false, true)) {
                if (task != null) {
                    task.cancel(false);
                }
                busy.set(false);
            } else if (task != null) {
                task.cancel(true);
            }
        }
    }

    private static final class SinkWrite {
        private final CompletableFuture<SinkOutcome> result = new CompletableFuture<>();
        private final AtomicBoolean started = new AtomicBoolean(false);
        private volatile Future<?> task;
    }
}

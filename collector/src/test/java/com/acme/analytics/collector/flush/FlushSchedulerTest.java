package com.acme.analytics.collector.flush;

import com.acme.analytics.collector.event.EventBatch;
import com.acme.analytics.collector.event.TestEvents;
import com.acme.analytics.collector.export.EventSink;
import com.acme.analytics.collector.export.ExportException;
import com.acme.analytics.collector.queue.EventBuffer;
import com.acme.analytics.collector.queue.OfferResult;
import com.acme.analytics.collector.telemetry.AtomicCollectorMetrics;
import com.acme.analytics.collector.telemetry.EventLabels;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlushSchedulerTest {

    private static final Duration LONG_INTERVAL = Duration.ofHours(1);
    private static final Duration EXPORT_TIMEOUT = Duration.ofSeconds(5);
    private static final EventLabels PAGE_VIEW = new EventLabels("page", "view", "app");

    private final AtomicCollectorMetrics metrics = new AtomicCollectorMetrics();

    @Test
    void shouldCompleteEmptyCycleWithoutCallingSinks() throws Exception {
        EventBuffer buffer = new EventBuffer(16);
        RecordingSink sink = new RecordingSink("recording");
        FlushScheduler scheduler = new FlushScheduler(buffer, List.of(sink), LONG_INTERVAL, EXPORT_TIMEOUT, metrics);
        try {
            FlushReport report = scheduler.flushNow().orElseThrow().get(5, TimeUnit.SECONDS);

            assertEquals(0, report.batchSize());
            assertTrue(report.outcomes().isEmpty());
            assertEquals(0, sink.calls.get());
            assertEquals(FlushState.IDLE, scheduler.state());
            assertEquals(1, metrics.snapshot().flushCycles());
        } finally {
            scheduler.shutdown(Duration.ofSeconds(1));
        }
    }

    @Test
    void shouldIsolateFailingSinkFromSibling() throws Exception {
        EventBuffer buffer = new EventBuffer(16);
        RecordingSink recording = new RecordingSink("recording");
        EventSink failing = new FailingSink("failing");
        FlushScheduler scheduler = new FlushScheduler(buffer, List.of(failing, recording), LONG_INTERVAL, EXPORT_TIMEOUT, metrics);
        try {
            for (int i = 0; i < 3; i++) {
                buffer.offer(TestEvents.pageView("app", "/" + i));
            }

            FlushReport report = scheduler.flushNow().orElseThrow().get(5, TimeUnit.SECONDS);

            assertEquals(3, report.batchSize());
            assertFalse(report.allExported());
            SinkOutcome.Failed failed = assertInstanceOf(SinkOutcome.Failed.class, report.outcomes().get("failing"));
            assertEquals(ExportException.Kind.CONNECTION, failed.kind());
            assertEquals(new SinkOutcome.Exported(3), report.outcomes().get("recording"));
            assertEquals(3, recording.events());

            AtomicCollectorMetrics.Snapshot snapshot = metrics.snapshot();
            assertEquals(3, snapshot.exportedCount("recording", PAGE_VIEW));
            assertEquals(0, snapshot.exportedCount("failing", PAGE_VIEW));
            assertEquals(1, snapshot.exportFailureCount("failing", ExportException.Kind.CONNECTION));
            assertEquals(3L, snapshot.failedEventsBySink().get("failing"));
            assertEquals(3, snapshot.failedEventCount("failing", PAGE_VIEW));
            assertEquals(0, snapshot.failedEventCount("recording", PAGE_VIEW));
        } finally {
            scheduler.shutdown(Duration.ofSeconds(1));
        }
    }

    @Test
    void shouldSkipTicksWhileCycleIsInFlight() throws Exception {
        EventBuffer buffer = new EventBuffer(16);
        BlockingSink slow = new BlockingSink("slow");
        FlushScheduler scheduler = new FlushScheduler(buffer, List.of(slow), LONG_INTERVAL, EXPORT_TIMEOUT, metrics);
        try {
            buffer.offer(TestEvents.pageView("app", "/"));
            CompletableFuture<FlushReport> cycle = scheduler.flushNow().orElseThrow();
            assertTrue(slow.entered.await(5, TimeUnit.SECONDS));
            assertEquals(FlushState.EXPORTING, scheduler.state());

            scheduler.tick();
            scheduler.tick();
            assertTrue(scheduler.flushNow().isEmpty());

            assertEquals(2, metrics.snapshot().flushSkipped());
            assertEquals(1, slow.calls.get());

            slow.release.countDown();
            assertEquals(1, cycle.get(5, TimeUnit.SECONDS).batchSize());
            assertEquals(FlushState.IDLE, scheduler.state());
            assertTrue(scheduler.flushNow().isPresent());
        } finally {
            slow.release.countDown();
            scheduler.shutdown(Duration.ofSeconds(1));
        }
    }

    @Test
    void shouldCountSkippedTimerTicksBehindSlowSink() throws Exception {
        EventBuffer buffer = new EventBuffer(16);
        BlockingSink slow = new BlockingSink("slow");
        FlushScheduler scheduler = new FlushScheduler(buffer, List.of(slow), Duration.ofMillis(20), EXPORT_TIMEOUT, metrics);
        try {
            buffer.offer(TestEvents.pageView("app", "/"));
            scheduler.start();
            assertTrue(slow.entered.await(5, TimeUnit.SECONDS));

            assertTrue(await(() -> metrics.snapshot().flushSkipped() >= 2, Duration.ofSeconds(5)));
            assertEquals(1, slow.calls.get());
        } finally {
            slow.release.countDown();
            scheduler.shutdown(Duration.ofSeconds(2));
        }
    }

    @Test
    void shouldGiveUpOnSinkThatExceedsExportTimeout() throws Exception {
        EventBuffer buffer = new EventBuffer(16);
        BlockingSink stuck = new BlockingSink("stuck");
        RecordingSink recording = new RecordingSink("recording");
        FlushScheduler scheduler = new FlushScheduler(buffer, List.of(stuck, recording), LONG_INTERVAL, Duration.ofMillis(150), metrics);
        try {
            buffer.offer(TestEvents.anchorClick("app"));

            FlushReport report = scheduler.flushNow().orElseThrow().get(5, TimeUnit.SECONDS);

            SinkOutcome.Failed failed = assertInstanceOf(SinkOutcome.Failed.class, report.outcomes().get("stuck"));
            assertEquals(ExportException.Kind.CONNECTION, failed.kind());
            assertTrue(failed.message().contains("timed out"), failed.message());
            assertEquals(new SinkOutcome.Exported(1), report.outcomes().get("recording"));
            assertEquals(FlushState.IDLE, scheduler.state());
        } finally {
            stuck.release.countDown();
            scheduler.shutdown(Duration.ofSeconds(1));
        }
    }

    @Test
    void shouldInterruptTimedOutWriteSoLaterCyclesExport() throws Exception {
        EventBuffer buffer = new EventBuffer(16);
        BlockingSink hung = new BlockingSink("hung");
        FlushScheduler scheduler = new FlushScheduler(buffer, List.of(hung), LONG_INTERVAL, Duration.ofMillis(100), metrics);
        try {
            buffer.offer(TestEvents.pageView("app", "/hung"));
            SinkOutcome first = scheduler.flushNow().orElseThrow().get(5, TimeUnit.SECONDS).outcomes().get("hung");
            assertTrue(assertInstanceOf(SinkOutcome.Failed.class, first).message().contains("timed out"));
            assertTrue(hung.exited.await(5, TimeUnit.SECONDS));
            Thread.sleep(50);

            for (int i = 0; i < 4; i++) {
                buffer.offer(TestEvents.pageView("app", "/" + i));
                FlushReport report = scheduler.flushNow().orElseThrow().get(5, TimeUnit.SECONDS);
                assertEquals(new SinkOutcome.Exported(1), report.outcomes().get("hung"));
            }

            assertEquals(4, hung.events());
            AtomicCollectorMetrics.Snapshot snapshot = metrics.snapshot();
            assertEquals(4, snapshot.exportedCount("hung", PAGE_VIEW));
            assertEquals(1, snapshot.failedEventCount("hung", PAGE_VIEW));
        } finally {
            hung.release.countDown();
            scheduler.shutdown(Duration.ofSeconds(1));
        }
    }

    @Test
    void shouldFailFastInsteadOfQueuingBehindWriteThatIgnoresInterrupt() throws Exception {
        EventBuffer buffer = new EventBuffer(16);
        BlockingSink hung = new BlockingSink("hung", false);
        FlushScheduler scheduler = new FlushScheduler(buffer, List.of(hung), LONG_INTERVAL, Duration.ofMillis(100), metrics);
        try {
            buffer.offer(TestEvents.pageView("app", "/hung"));
            scheduler.flushNow().orElseThrow().get(5, TimeUnit.SECONDS);
            assertTrue(hung.entered.await(5, TimeUnit.SECONDS));

            for (int i = 0; i < 4; i++) {
                buffer.offer(TestEvents.pageView("app", "/" + i));
                FlushReport report = scheduler.flushNow().orElseThrow().get(1, TimeUnit.SECONDS);
                SinkOutcome.Failed failed = assertInstanceOf(SinkOutcome.Failed.class, report.outcomes().get("hung"));
                assertEquals(ExportException.Kind.CONNECTION, failed.kind());
                assertEquals("previous write still in flight", failed.message());
            }
            assertEquals(0, hung.calls.get());
            assertEquals(5, metrics.snapshot().exportFailureCount("hung", ExportException.Kind.CONNECTION));

            hung.release.countDown();
            assertTrue(hung.exited.await(5, TimeUnit.SECONDS));
            Thread.sleep(50);

            buffer.offer(TestEvents.pageView("app", "/after"));
            FlushReport after = scheduler.flushNow().orElseThrow().get(5, TimeUnit.SECONDS);
            assertEquals(new SinkOutcome.Exported(1), after.outcomes().get("hung"));
            // the late first write and the last batch; the four refused batches never reached the sink
            assertEquals(2, hung.calls.get());
            assertEquals(2, hung.events());
        } finally {
            hung.release.countDown();
            scheduler.shutdown(Duration.ofSeconds(1));
        }
    }

    @Test
    void shouldRecordUnexpectedSinkExceptionAsFailure() throws Exception {
        EventBuffer buffer = new EventBuffer(16);
        EventSink broken = new EventSink() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public int writeBatch(EventBatch batch) {
                throw new IllegalStateException("boom");
            }
        };
        FlushScheduler scheduler = new FlushScheduler(buffer, List.of(broken), LONG_INTERVAL, EXPORT_TIMEOUT, metrics);
        try {
            buffer.offer(TestEvents.pageView("app", "/"));

            FlushReport report = scheduler.flushNow().orElseThrow().get(5, TimeUnit.SECONDS);

            SinkOutcome.Failed failed = assertInstanceOf(SinkOutcome.Failed.class, report.outcomes().get("broken"));
            assertTrue(failed.message().contains("boom"));
            assertTrue(scheduler.flushNow().isPresent());
        } finally {
            scheduler.shutdown(Duration.ofSeconds(1));
        }
    }

    @Test
    void shouldFlushPeriodicallyOnceStarted() throws Exception {
        EventBuffer buffer = new EventBuffer(16);
        RecordingSink recording = new RecordingSink("recording");
        FlushScheduler scheduler = new FlushScheduler(buffer, List.of(recording), Duration.ofMillis(25), EXPORT_TIMEOUT, metrics);
        try {
            scheduler.start();
            assertTrue(scheduler.isRunning());
            buffer.offer(TestEvents.pageView("app", "/a"));
            buffer.offer(TestEvents.pageView("app", "/b"));

            assertTrue(await(() -> recording.events() == 2, Duration.ofSeconds(5)));
        } finally {
            scheduler.shutdown(Duration.ofSeconds(1));
        }
        assertFalse(scheduler.isRunning());
    }

    @Test
    void shouldExportRemainingEventsOnShutdownAndCloseBuffer() {
        EventBuffer buffer = new EventBuffer(16);
        RecordingSink recording = new RecordingSink("recording");
        FlushScheduler scheduler = new FlushScheduler(buffer, List.of(recording), LONG_INTERVAL, EXPORT_TIMEOUT, metrics);
        scheduler.start();
        for (int i = 0; i < 4; i++) {
            buffer.offer(TestEvents.pageView("app", "/" + i));
        }

        FlushReport report = scheduler.shutdown(Duration.ofSeconds(5));

        assertEquals(4, report.batchSize());
        assertEquals(new SinkOutcome.Exported(4), report.outcomes().get("recording"));
        assertEquals(4, recording.events());
        assertInstanceOf(OfferResult.Closed.class, buffer.offer(TestEvents.anchorClick("app")));
        assertEquals(FlushState.SHUTTING_DOWN, scheduler.state());
        assertTrue(scheduler.flushNow().isEmpty());
    }

    @Test
    void shouldExportRemainingEventsOnClose() {
        EventBuffer buffer = new EventBuffer(16);
        RecordingSink recording = new RecordingSink("recording");
        FlushScheduler scheduler = new FlushScheduler(buffer, List.of(recording), LONG_INTERVAL, EXPORT_TIMEOUT, metrics);
        scheduler.start();
        for (int i = 0; i < 3; i++) {
            buffer.offer(TestEvents.pageView("app", "/" + i));
        }

        scheduler.close();

        assertEquals(3, recording.events());
        assertEquals(3, metrics.snapshot().exportedCount("recording", PAGE_VIEW));
        assertInstanceOf(OfferResult.Closed.class, buffer.offer(TestEvents.anchorClick("app")));
    }

    @Test
    void shouldLetInFlightCycleFinishBeforeFinalFlush() throws Exception {
        EventBuffer buffer = new EventBuffer(16);
        BlockingSink firstCallBlocks = new BlockingSink("sink");
        FlushScheduler scheduler = new FlushScheduler(buffer, List.of(firstCallBlocks), LONG_INTERVAL, EXPORT_TIMEOUT, metrics);

        buffer.offer(TestEvents.pageView("app", "/first"));
        CompletableFuture<FlushReport> cycle = scheduler.flushNow().orElseThrow();
        assertTrue(firstCallBlocks.entered.await(5, TimeUnit.SECONDS));
        buffer.offer(TestEvents.pageView("app", "/second"));
        buffer.offer(TestEvents.pageView("app", "/third"));

        CompletableFuture<FlushReport> shutdown = CompletableFuture.supplyAsync(() -> scheduler.shutdown(Duration.ofSeconds(5)));
        Thread.sleep(100);
        assertFalse(shutdown.isDone());
        firstCallBlocks.release.countDown();

        assertEquals(1, cycle.get(5, TimeUnit.SECONDS).batchSize());
        FlushReport last = shutdown.get(5, TimeUnit.SECONDS);
        assertEquals(2, last.batchSize());
        assertEquals(3, firstCallBlocks.events());
    }

    @Test
    void shouldRejectDuplicateSinkNames() {
        EventBuffer buffer = new EventBuffer(16);
        assertThrows(IllegalArgumentException.class, () -> new FlushScheduler(
            buffer, List.of(new RecordingSink("same"), new RecordingSink("same")), LONG_INTERVAL, EXPORT_TIMEOUT));
    }

    private static boolean await(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }

    private static class RecordingSink implements EventSink {
        private final String name;
        final AtomicInteger calls = new AtomicInteger();
        final List<EventBatch> batches = new CopyOnWriteArrayList<>();

        RecordingSink(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public int writeBatch(EventBatch batch) throws ExportException {
            calls.incrementAndGet();
            batches.add(batch);
            return batch.size();
        }

        int events() {
            int total = 0;
            for (EventBatch batch : batches) {
                total += batch.size();
            }
            return total;
        }
    }

    /** Blocks its first call until released; later calls return immediately. */
    private static final class BlockingSink extends RecordingSink {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final CountDownLatch exited = new CountDownLatch(1);
        private final AtomicBoolean first = new AtomicBoolean(true);
        private final boolean interruptible;

        BlockingSink(String name) {
            this(name, true);
        }

        BlockingSink(String name, boolean interruptible) {
            super(name);
            this.interruptible = interruptible;
        }

        @Override
        public int writeBatch(EventBatch batch) throws ExportException {
            if (first.compareAndSet(true, false)) {
                entered.countDown();
                try {
                    awaitRelease();
                } finally {
                    exited.countDown();
                }
            }
            return super.writeBatch(batch);
        }

        private void awaitRelease() throws ExportException {
            if (interruptible) {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ExportException(ExportException.Kind.CONNECTION, "interrupted");
                }
                return;
            }
            boolean interrupted = false;
            while (true) {
                try {
                    release.await();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static final class FailingSink implements EventSink {
        private final String name;

        FailingSink(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public int writeBatch(EventBatch batch) throws ExportException {
            throw new ExportException(ExportException.Kind.CONNECTION, "destination unreachable");
        }
    }
}

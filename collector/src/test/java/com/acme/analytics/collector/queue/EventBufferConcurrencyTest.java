package com.acme.analytics.collector.queue;

import com.acme.analytics.collector.event.Event;
import com.acme.analytics.collector.event.EventAction;
import com.acme.analytics.collector.event.EventBatch;
import com.acme.analytics.collector.event.EventEntity;
import com.acme.analytics.collector.event.TestEvents;
import org.junit.jupiter.api.RepeatedTest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBufferConcurrencyTest {

    @RepeatedTest(5)
    void shouldNeitherLoseNorDuplicateEventsAcrossConcurrentDrains() throws Exception {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        int producerThreads = random.nextInt(2, 9);
        int perProducer = random.nextInt(2_000, 6_000);
        int totalItems = producerThreads * perProducer;

        EventBuffer buffer = new EventBuffer(totalItems);
        ExecutorService pool = Executors.newFixedThreadPool(producerThreads + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean producersDone = new AtomicBoolean(false);
        AtomicInteger accepted = new AtomicInteger();
        Map<String, Boolean> offered = new ConcurrentHashMap<>();
        Map<String, Boolean> seen = new ConcurrentHashMap<>();
        List<Long> sequences = new ArrayList<>();
        try {
            List<Future<?>> producers = new ArrayList<>();
            for (int p = 0; p < producerThreads; p++) {
                int producer = p;
                producers.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perProducer; i++) {
                        String id = producer + "-" + i;
                        Event event = new Event(id, TestEvents.T0, TestEvents.T0,
                            EventEntity.PAGE, EventAction.VIEW, "/" + i, "app-" + producer);
                        if (buffer.offer(event) instanceof OfferResult.Accepted) {
                            offered.put(id, Boolean.TRUE);
                            accepted.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }

            Future<?> drainer = pool.submit(() -> {
                start.await();
                while (true) {
                    boolean last = producersDone.get();
                    EventBatch batch = buffer.drain();
                    sequences.add(batch.sequence());
                    for (Event event : batch.events()) {
                        if (seen.putIfAbsent(event.id(), Boolean.TRUE) != null) {
                            throw new IllegalStateException("Duplicate event drained: " + event.id());
                        }
                    }
                    if (last) {
                        return null;
                    }
                    Thread.sleep(ThreadLocalRandom.current().nextInt(0, 3));
                }
            });

            start.countDown();
            for (Future<?> producer : producers) {
                producer.get(20, TimeUnit.SECONDS);
            }
            producersDone.set(true);
            drainer.get(20, TimeUnit.SECONDS);

            assertEquals(totalItems, accepted.get());
            assertEquals(offered.keySet(), seen.keySet());
            assertEquals(0, buffer.depth());
            for (int i = 1; i < sequences.size(); i++) {
                assertTrue(sequences.get(i) > sequences.get(i - 1), "drain sequences must increase");
            }
        } finally {
            pool.shutdownNow();
            pool.awaitTermination(2, TimeUnit.SECONDS);
        }
    }
}

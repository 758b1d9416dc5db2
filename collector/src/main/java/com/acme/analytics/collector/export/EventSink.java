package com.acme.analytics.collector.export;

import com.acme.analytics.collector.event.EventBatch;

/**
 * Durable destination for drained batches.
 *
 * <p>Called from the export executor, at most once per batch and never concurrently for the same
 * sink instance by the flush scheduler. An empty batch must be a no-op returning 0.</p>
 */
public interface EventSink extends AutoCloseable {
    /** Stable identifier used in metric labels and log lines. */
    String name();

    /**
     * Writes every event of the batch.
     *
     * @return number of events written
     * @throws ExportException if the batch could not be written in full
     */
    int writeBatch(EventBatch batch) throws ExportException;

    @Override
    default void close() throws Exception {
    }
}

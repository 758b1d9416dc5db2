package com.acme.analytics.collector.flush;

import java.util.Map;

/**
 * Result of one flush cycle. {@code outcomes} is keyed by sink name and is empty for an empty batch.
 */
public record FlushReport(long sequence, int batchSize, Map<String, SinkOutcome> outcomes) {
    public FlushReport {
        outcomes = Map.copyOf(outcomes);
    }

    public boolean allExported() {
        for (SinkOutcome outcome : outcomes.values()) {
            if (!(outcome instanceof SinkOutcome.Exported)) {
                return false;
            }
        }
        return true;
    }
}

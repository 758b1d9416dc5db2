package com.acme.analytics.collector.flush;

import com.acme.analytics.collector.export.ExportException;

public sealed interface SinkOutcome permits SinkOutcome.Exported, SinkOutcome.Failed {
    record Exported(int events) implements SinkOutcome {}
    record Failed(ExportException.Kind kind, String message) implements SinkOutcome {}
}

package com.acme.analytics.collector.telemetry;

import com.acme.analytics.collector.export.ExportException;

public interface CollectorMetrics {
    void incIngested(EventLabels labels);
    void incRejected(String reason);
    void incExported(String sink, EventLabels labels, long n);
    void incExportFailure(String sink, ExportException.Kind kind, long events);
    void incExportFailedEvents(String sink, EventLabels labels, long n);
    void incFlushCycles();
    void incFlushSkipped();
    void setBufferDepth(int depth);
}

package com.acme.analytics.collector.telemetry;

import com.acme.analytics.collector.export.ExportException;

public final class NoopCollectorMetrics implements CollectorMetrics {
    public static final NoopCollectorMetrics INSTANCE = new NoopCollectorMetrics();

    private NoopCollectorMetrics() {
    }

    @Override
    public void incIngested(EventLabels labels) {
    }

    @Override
    public void incRejected(String reason) {
    }

    @Override
    public void incExported(String sink, EventLabels labels, long n) {
    }

    @Override
    public void incExportFailure(String sink, ExportException.Kind kind, long events) {
    }

    @Override
    public void incExportFailedEvents(String sink, EventLabels labels, long n) {
    }

    @Override
    public void incFlushCycles() {
    }

    @Override
    public void incFlushSkipped() {
    }

    @Override
    public void setBufferDepth(int depth) {
    }
}

package com.acme.analytics.collector.flush;

public enum FlushState {
    IDLE,
    DRAINING,
    EXPORTING,
    SHUTTING_DOWN
}

package com.acme.analytics.collector.transport.api;

/**
 * An ingestion request that already passed transport-level checks (method, content type, size).
 */
public record InboundRequest(
    long requestId,
    String path,
    String contentType,
    String body
) {}

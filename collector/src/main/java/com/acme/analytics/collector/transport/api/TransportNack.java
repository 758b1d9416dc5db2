package com.acme.analytics.collector.transport.api;

/**
 * Rejection returned to the client. {@code field} may be null.
 */
public record TransportNack(
    int statusCode,
    String errorCode,
    String field,
    String message,
    boolean retryable
) implements TransportResponse { }

package com.acme.analytics.collector.util;

/**
 * HTTP status codes used by the ingestion and metrics endpoints.
 */
public final class CollectorStatusCodes {

    // ---- Success ----
    public static final int OK = 200;
    public static final int ACCEPTED = 202;

    // ---- Client errors ----
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int METHOD_NOT_ALLOWED = 405;
    public static final int PAYLOAD_TOO_LARGE = 413;

    // ---- Server errors ----
    public static final int INTERNAL_ERROR = 500;
    public static final int SERVICE_UNAVAILABLE = 503;

    private CollectorStatusCodes() {
    }
}

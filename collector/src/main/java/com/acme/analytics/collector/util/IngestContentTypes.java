package com.acme.analytics.collector.util;

import java.util.Locale;

/**
 * Content types accepted on the ingestion endpoint.
 *
 * <p>{@code text/plain} is what {@code navigator.sendBeacon} sends for string bodies.</p>
 */
public final class IngestContentTypes {
    public static final String APPLICATION_JSON = "application/json";
    public static final String TEXT_PLAIN = "text/plain";

    private IngestContentTypes() {
    }

    public static boolean isSupported(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return false;
        }
        String normalized = contentType.toLowerCase(Locale.ROOT);
        return normalized.contains(APPLICATION_JSON) || normalized.contains(TEXT_PLAIN);
    }
}

package com.acme.analytics.collector.util;

/**
 * Values of the {@code reason} label on the rejected-events counter, besides the validation kinds.
 */
public final class RejectReasons {
    public static final String BUFFER_FULL = "buffer_full";
    public static final String BUFFER_CLOSED = "buffer_closed";
    public static final String PAYLOAD_TOO_LARGE = "payload_too_large";
    public static final String UNSUPPORTED_CONTENT_TYPE = "unsupported_content_type";

    private RejectReasons() {
    }
}

package com.acme.analytics.collector.export;

import java.util.Locale;
import java.util.Objects;

public final class ExportException extends Exception {
    public enum Kind {
        /** Destination unreachable, timed out or refused the write. */
        CONNECTION,
        /** Events could not be encoded for the destination. */
        SERIALIZATION,
        /** The write failed part way; reported as a failure of the whole batch. */
        PARTIAL;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Kind kind;

    public ExportException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ExportException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }
}

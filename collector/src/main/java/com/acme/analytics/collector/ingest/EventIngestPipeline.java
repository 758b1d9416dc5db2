package com.acme.analytics.collector.ingest;

import com.acme.analytics.collector.event.Event;
import com.acme.analytics.collector.queue.EventBuffer;
import com.acme.analytics.collector.queue.OfferResult;
import com.acme.analytics.collector.schema.EventValidator;
import com.acme.analytics.collector.schema.ValidationError;
import com.acme.analytics.collector.schema.ValidationResult;
import com.acme.analytics.collector.telemetry.CollectorMetrics;
import com.acme.analytics.collector.telemetry.EventLabels;
import com.acme.analytics.collector.telemetry.NoopCollectorMetrics;
import com.acme.analytics.collector.transport.api.InboundRequest;
import com.acme.analytics.collector.transport.api.TransportAck;
import com.acme.analytics.collector.transport.api.TransportAdapter;
import com.acme.analytics.collector.transport.api.TransportNack;
import com.acme.analytics.collector.transport.api.TransportResponse;
import com.acme.analytics.collector.util.CollectorStatusCodes;
import com.acme.analytics.collector.util.RejectReasons;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Request body to buffered event: validate, offer, count.
 *
 * <p>Never blocks on export I/O; the only shared structure touched is the buffer's short lock.</p>
 */
public final class EventIngestPipeline implements TransportAdapter.InboundHandler {
    private static final Logger LOG = Logger.getLogger(EventIngestPipeline.class.getName());

    private final EventValidator validator;
    private final EventBuffer buffer;
    private final CollectorMetrics metrics;

    public EventIngestPipeline(EventValidator validator, EventBuffer buffer) {
        this(validator, buffer, NoopCollectorMetrics.INSTANCE);
    }

    public EventIngestPipeline(EventValidator validator, EventBuffer buffer, CollectorMetrics metrics) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.metrics = metrics == null ? NoopCollectorMetrics.INSTANCE : metrics;
    }

    @Override
    public TransportResponse onRequest(InboundRequest request) {
        ValidationResult result = validator.validate(request.body());
        if (result instanceof ValidationResult.Invalid invalid) {
            ValidationError error = invalid.error();
            metrics.incRejected(error.kind().label());
            LOG.fine(() -> "Rejected request " + request.requestId() + " kind=" + error.kind() + ": " + error.message());
            return new TransportNack(CollectorStatusCodes.BAD_REQUEST, error.kind().label(), error.field(), error.message(), false);
        }

        Event event = ((ValidationResult.Valid) result).event();
        OfferResult offer = buffer.offer(event);
        if (offer instanceof OfferResult.Accepted accepted) {
            metrics.incIngested(EventLabels.of(event));
            metrics.setBufferDepth(accepted.depth());
            return new TransportAck(CollectorStatusCodes.ACCEPTED);
        }
        if (offer instanceof OfferResult.Full full) {
            metrics.incRejected(RejectReasons.BUFFER_FULL);
            LOG.fine(() -> "Buffer full depth=" + full.depth() + " capacity=" + full.capacity());
            return new TransportNack(CollectorStatusCodes.SERVICE_UNAVAILABLE, RejectReasons.BUFFER_FULL, null,
                "event buffer is full", true);
        }
        metrics.incRejected(RejectReasons.BUFFER_CLOSED);
        return new TransportNack(CollectorStatusCodes.SERVICE_UNAVAILABLE, RejectReasons.BUFFER_CLOSED, null,
            "collector is shutting down", true);
    }
}

package com.acme.analytics.collector.transport.api;

/**
 * SPI for network transports that feed the ingest pipeline.
 *
 * <p>Lifecycle: call {@link #setInboundHandler} before {@link #start()}.
 * {@link #close()} delegates to {@link #stop()}. Implementations must
 * tolerate multiple stop/close calls without error.
 */
public interface TransportAdapter extends AutoCloseable {
    /** Port the adapter is bound to; the configured port until started. */
    int listenPort();

    /** Starts accepting inbound connections. Must not be called before setting the handler. */
    void start() throws Exception;

    /** Stops accepting connections and releases the event loops. */
    void stop() throws Exception;

    void setInboundHandler(InboundHandler handler);

    /** Callback for requests delivered by the transport. */
    interface InboundHandler {
        TransportResponse onRequest(InboundRequest request);
    }

    @Override
    default void close() throws Exception { stop(); }
}

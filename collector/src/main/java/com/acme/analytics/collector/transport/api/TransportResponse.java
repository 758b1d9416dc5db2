package com.acme.analytics.collector.transport.api;

public sealed interface TransportResponse permits TransportAck, TransportNack {
    int statusCode();
}

package com.acme.analytics.collector.transport.api;

public record TransportAck(int statusCode) implements TransportResponse { }

package com.acme.analytics.collector.queue;

public sealed interface OfferResult permits OfferResult.Accepted, OfferResult.Full, OfferResult.Closed {
    record Accepted(int depth) implements OfferResult {}
    record Full(int depth, int capacity) implements OfferResult {}
    record Closed() implements OfferResult {}
}

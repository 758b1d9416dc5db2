package com.acme.analytics.collector.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestContentTypesTest {

    @Test
    void shouldAcceptJsonAndBeaconContentTypes() {
        assertTrue(IngestContentTypes.isSupported("application/json"));
        assertTrue(IngestContentTypes.isSupported("application/json; charset=utf-8"));
        assertTrue(IngestContentTypes.isSupported("text/plain;charset=UTF-8"));
        assertTrue(IngestContentTypes.isSupported("Application/JSON"));
    }

    @Test
    void shouldRejectOtherContentTypes() {
        assertFalse(IngestContentTypes.isSupported(null));
        assertFalse(IngestContentTypes.isSupported(""));
        assertFalse(IngestContentTypes.isSupported("application/x-www-form-urlencoded"));
        assertFalse(IngestContentTypes.isSupported("multipart/form-data"));
    }
}

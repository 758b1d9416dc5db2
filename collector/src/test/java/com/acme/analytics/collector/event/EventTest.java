package com.acme.analytics.collector.event;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void shouldRejectMismatchedEntityAndAction() {
        assertThrows(IllegalArgumentException.class,
            () -> new Event("id-1", NOW, NOW, EventEntity.PAGE, EventAction.CLICK, "/", "app"));
        assertThrows(IllegalArgumentException.class,
            () -> new Event("id-2", NOW, NOW, EventEntity.ANCHOR, EventAction.VIEW, "/", "app"));
    }

    @Test
    void shouldRejectBlankAppId() {
        assertThrows(IllegalArgumentException.class,
            () -> new Event("id-1", NOW, NOW, EventEntity.PAGE, EventAction.VIEW, "/", "  "));
        assertThrows(NullPointerException.class,
            () -> new Event("id-1", NOW, NOW, EventEntity.PAGE, EventAction.VIEW, "/", null));
    }

    @Test
    void shouldAllowMissingPath() {
        Event event = new Event("id-1", NOW, NOW, EventEntity.ANCHOR, EventAction.CLICK, null, "app");
        assertNull(event.path());
    }

    @Test
    void shouldResolveWireNamesCaseSensitively() {
        assertEquals(EventEntity.PAGE, EventEntity.fromWireName("page"));
        assertEquals(EventAction.CLICK, EventAction.fromWireName("click"));
        assertNull(EventEntity.fromWireName("Page"));
        assertNull(EventAction.fromWireName("hover"));
    }

    @Test
    void batchShouldBeAnImmutableSnapshot() {
        List<Event> source = new ArrayList<>();
        source.add(TestEvents.pageView("app", "/"));
        EventBatch batch = new EventBatch(1, NOW, source);
        source.add(TestEvents.anchorClick("app"));

        assertEquals(1, batch.size());
        assertThrows(UnsupportedOperationException.class, () -> batch.events().add(TestEvents.anchorClick("app")));
        assertTrue(EventBatch.empty(2, NOW).isEmpty());
    }
}

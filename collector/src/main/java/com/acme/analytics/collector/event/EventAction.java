package com.acme.analytics.collector.event;

/**
 * What happened to the entity.
 */
public enum EventAction {
    VIEW("view"),
    CLICK("click");

    private final String wireName;

    EventAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static EventAction fromWireName(String raw) {
        if (raw == null) {
            return null;
        }
        for (EventAction a : values()) {
            if (a.wireName.equals(raw)) {
                return a;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return wireName;
    }
}

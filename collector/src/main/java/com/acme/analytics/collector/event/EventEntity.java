package com.acme.analytics.collector.event;

/**
 * Kind of UI element an event refers to.
 */
public enum EventEntity {
    PAGE("page"),
    ANCHOR("anchor");

    private final String wireName;

    EventEntity(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Returns the entity for a payload value, or {@code null} if unknown. Matching is case-sensitive. */
    public static EventEntity fromWireName(String raw) {
        if (raw == null) {
            return null;
        }
        for (EventEntity e : values()) {
            if (e.wireName.equals(raw)) {
                return e;
            }
        }
        return null;
    }

    /** The only action allowed for this entity. */
    public EventAction requiredAction() {
        return this == PAGE ? EventAction.VIEW : EventAction.CLICK;
    }

    @Override
    public String toString() {
        return wireName;
    }
}

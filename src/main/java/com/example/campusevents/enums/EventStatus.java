package com.example.campusevents.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EventStatus {
    ACTIVE("Active"),
    COMPLETED("Completed"),
    CANCELLED("Cancelled"),
    ARCHIVED("Archived");

    private final String label;

    EventStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Completed and Archived events are closed for registration and check-in.
     */
    public boolean isClosed() {
        return this == COMPLETED || this == ARCHIVED;
    }

    @JsonCreator
    public static EventStatus fromValue(String raw) {
        if (raw == null) return null;
        String v = raw.trim().toUpperCase(Locale.ROOT);
        for (EventStatus s : values()) {
            if (s.name().equals(v)) return s;
        }
        throw new IllegalArgumentException("Unknown event status: " + raw);
    }
}

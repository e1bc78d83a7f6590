package com.example.campusevents.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * On-duty request lifecycle: PENDING -> APPROVED | REJECTED. Both outcomes are terminal.
 */
public enum OnDutyStatus {
    PENDING,
    APPROVED,
    REJECTED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OnDutyStatus fromValue(String raw) {
        if (raw == null) return null;
        return OnDutyStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}

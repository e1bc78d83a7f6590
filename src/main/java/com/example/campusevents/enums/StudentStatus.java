package com.example.campusevents.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StudentStatus {
    PENDING,
    APPROVED,
    REJECTED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StudentStatus fromValue(String raw) {
        if (raw == null) return null;
        return StudentStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}

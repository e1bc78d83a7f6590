package com.example.campusevents.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * Attendance statuses shared by event participants and attendance logs.
 *
 * <ul>
 *     <li>REGISTERED: participant signed up, not checked in yet. Never stored on an attendance log.</li>
 *     <li>ATTENDED: checked in within the grace period, or proof uploaded.</li>
 *     <li>LATE: checked in after the grace period.</li>
 *     <li>ABSENT: still registered when the event was closed by an admin.</li>
 * </ul>
 *
 * Older clients send "present" or "verified" for attendance logs; both read as ATTENDED.
 */
public enum AttendanceStatus {
    REGISTERED,
    ATTENDED,
    LATE,
    ABSENT;

    private static final Map<String, AttendanceStatus> WIRE_VALUES = Map.of(
            "registered", REGISTERED,
            "attended", ATTENDED,
            "present", ATTENDED,
            "verified", ATTENDED,
            "late", LATE,
            "absent", ABSENT
    );

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isCheckedIn() {
        return this == ATTENDED || this == LATE;
    }

    @JsonCreator
    public static AttendanceStatus fromValue(String raw) {
        if (raw == null) return null;
        AttendanceStatus status = WIRE_VALUES.get(raw.trim().toLowerCase(Locale.ROOT));
        if (status == null) {
            throw new IllegalArgumentException("Unknown attendance status: " + raw);
        }
        return status;
    }
}

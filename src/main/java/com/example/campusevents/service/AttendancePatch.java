package com.example.campusevents.service;

import com.example.campusevents.enums.AttendanceStatus;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Partial update of an attendance log. Null fields leave the stored value untouched.
 */
@Getter
@Builder
public class AttendancePatch {
    private final AttendanceStatus status;
    // when set, an existing LATE status is not replaced by ATTENDED
    private final boolean preserveLate;
    private final String location;
    private final String scannedQrData;
    private final String deviceInfo;
    private final String proofPhotoUrl;
    private final BigDecimal latitude;
    private final BigDecimal longitude;
    private final Instant photoTakenAt;
    private final Instant timestamp;
    private final String notes;
}

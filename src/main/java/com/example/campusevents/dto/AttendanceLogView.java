package com.example.campusevents.dto;

import com.example.campusevents.enums.AttendanceStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttendanceLogView {
    private UUID id;
    private UUID studentId;
    private UUID eventId;
    private AttendanceStatus status;
    private String location;
    private String scannedQrData;
    private String deviceInfo;
    private String proofPhotoUrl;
    private BigDecimal latitude;
    private BigDecimal longitude;
    private Instant photoTakenAt;
    private Instant timestamp;
    private String eventName;
    private LocalDate eventDate;
    private String venue;
}

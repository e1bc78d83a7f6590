package com.example.campusevents.dto;

import com.example.campusevents.enums.AttendanceStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParticipantView {
    private UUID id;
    private UUID eventId;
    private UUID studentId;
    private AttendanceStatus status;
    private Instant checkInTime;
    private String notes;
    private Instant createdAt;

    private String studentName;
    private String studentEmail;
    private String department;
    private String college;
    private String registrationNumber;

    private String proofPhotoUrl;
    private BigDecimal latitude;
    private BigDecimal longitude;
    private Instant photoTakenAt;
}

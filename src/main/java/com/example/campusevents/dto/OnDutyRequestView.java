package com.example.campusevents.dto;

import com.example.campusevents.enums.OnDutyStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OnDutyRequestView {
    private UUID id;
    private UUID studentId;
    private String collegeName;
    private LocalDate startDate;
    private LocalTime startTime;
    private LocalDate endDate;
    private LocalTime endTime;
    private String reason;
    private String documentUrl;
    private OnDutyStatus status;
    private UUID approvedBy;
    private String approvedByName;
    private String rejectionReason;
    private Instant createdAt;
    private Instant updatedAt;

    private String studentName;
    private String studentEmail;
    private String registrationNumber;
    private String department;
    private String college;
}

package com.example.campusevents.dto;

import com.example.campusevents.enums.AttendanceStatus;
import com.example.campusevents.enums.EventStatus;
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
public class EventView {
    private UUID id;
    private String name;
    private String description;
    private LocalDate eventDate;
    private LocalTime eventTime;
    private String venue;
    private String category;
    private EventStatus status;
    private String qrData;
    private Integer maxParticipants;
    private Integer gracePeriodMinutes;
    private UUID createdBy;
    private Instant createdAt;
    private Instant updatedAt;

    private long totalParticipants;
    private long registeredCount;
    private long attendedCount;
    private long lateCount;
    private long absentCount;
    private long checkInsCount;
    private long photosUploaded;

    // only for a student caller
    private AttendanceStatus registrationStatus;
    private Instant checkInTime;
    private UUID participantId;
}

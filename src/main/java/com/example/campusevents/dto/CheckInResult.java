package com.example.campusevents.dto;

import com.example.campusevents.enums.AttendanceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckInResult {
    private UUID id;
    private UUID studentId;
    private UUID eventId;
    private String eventName;
    private String eventVenue;
    private String location;
    private Instant checkInTime;
    private AttendanceStatus status;
}

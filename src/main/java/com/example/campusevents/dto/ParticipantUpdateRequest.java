package com.example.campusevents.dto;

import com.example.campusevents.enums.AttendanceStatus;
import lombok.Data;

@Data
public class ParticipantUpdateRequest {
    private AttendanceStatus status;
    private String notes;
}

package com.example.campusevents.dto;

import com.example.campusevents.enums.AttendanceStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RegistrationResult {
    private UUID eventId;
    private UUID participantId;
    private AttendanceStatus registrationStatus;
    @JsonIgnore
    private String message;
    @JsonIgnore
    private boolean created;
}

package com.example.campusevents.dto;

import com.example.campusevents.enums.EventStatus;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Body of event create/update. On update every null field keeps its stored value.
 */
@Data
public class EventRequest {
    private String name;
    private String description;
    private LocalDate eventDate;
    private LocalTime eventTime;
    private String venue;
    private String category;
    private EventStatus status;
    @Min(1)
    private Integer maxParticipants;
    @Min(0)
    private Integer gracePeriodMinutes;
}

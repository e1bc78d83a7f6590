package com.example.campusevents.dto;

import lombok.Data;

import java.util.UUID;

@Data
public class RegisterEventRequest {
    // used only when the caller's profile cannot be resolved from the token
    private UUID studentId;
}

package com.example.campusevents.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;
import java.util.UUID;

@Data
public class CertificateGenerateRequest {
    @NotNull(message = "Student ID and title are required")
    private UUID studentId;
    private UUID eventId;
    @NotBlank(message = "Student ID and title are required")
    private String title;
    private String certificateType;
    private String issuedBy;
    // defaults to today
    private LocalDate issuedDate;
}

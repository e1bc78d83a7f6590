package com.example.campusevents.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CertificateStatusRequest {
    @NotBlank
    private String status;
    private String notes;
}

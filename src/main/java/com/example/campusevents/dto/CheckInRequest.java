package com.example.campusevents.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CheckInRequest {
    @NotBlank(message = "QR data is required")
    private String qrData;
    private String location;
    private JsonNode deviceInfo;
}

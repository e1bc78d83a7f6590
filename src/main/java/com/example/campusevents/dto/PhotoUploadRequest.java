package com.example.campusevents.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Photo proof upload. Exactly one of {@code attendanceLogId} and {@code eventId} is expected.
 */
@Data
public class PhotoUploadRequest {
    // base64, optionally with a data URL prefix
    private String photoData;
    private UUID eventId;
    private UUID attendanceLogId;
    private BigDecimal latitude;
    private BigDecimal longitude;
    private String qrData;
    private String location;
    private JsonNode deviceInfo;
}

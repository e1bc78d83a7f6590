package com.example.campusevents.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OnDutyAttendanceView {
    private UUID id;
    private UUID onDutyRequestId;
    private UUID studentId;
    private Instant checkInTime;
    private LocalDate checkInDate;
    private BigDecimal latitude;
    private BigDecimal longitude;
    private String address;
    private String selfiePhotoUrl;
    private String qrData;

    private String collegeName;
    private LocalDate startDate;
    private LocalDate endDate;

    private String studentName;
    private String studentEmail;
    private String registrationNumber;
}

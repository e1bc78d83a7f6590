package com.example.campusevents.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.util.UUID;

@Data
public class OnDutyAttendanceForm {
    private UUID onDutyRequestId;
    private BigDecimal latitude;
    private BigDecimal longitude;
    private String address;
    private String qrData;
}

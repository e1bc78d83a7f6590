package com.example.campusevents.dto;

import lombok.Data;

/**
 * Multipart fields of an on-duty request. Dates are yyyy-MM-dd, times HH:mm[:ss].
 */
@Data
public class OnDutyRequestForm {
    private String collegeName;
    private String startDate;
    private String startTime;
    private String endDate;
    private String endTime;
    private String reason;
}

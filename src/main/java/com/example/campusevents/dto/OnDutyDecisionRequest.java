package com.example.campusevents.dto;

import lombok.Data;

@Data
public class OnDutyDecisionRequest {
    // "approved" or "rejected"
    private String status;
    private String rejectionReason;
}

package com.example.campusevents.dto;

import com.example.campusevents.enums.CertificateStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CertificateView {
    private UUID id;
    private UUID studentId;
    private UUID eventId;
    private String title;
    private String category;
    private String certificateType;
    private LocalDate issueDate;
    private String issuedBy;
    private String description;
    private String fileName;
    private String fileUrl;
    private CertificateStatus status;
    private String remarks;
    private Instant approvedAt;
    private UUID approvedBy;
    private Instant uploadedAt;
    private Instant updatedAt;

    private String studentName;
    private String studentEmail;
    private String department;
    private String eventName;
    private LocalDate eventDate;
}

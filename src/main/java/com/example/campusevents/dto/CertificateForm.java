package com.example.campusevents.dto;

import lombok.Data;

/**
 * Multipart fields of a certificate upload or edit. {@code issueDate} is yyyy-MM-dd.
 * {@code status} and {@code remarks} are only honoured for admins.
 */
@Data
public class CertificateForm {
    private String title;
    private String category;
    private String issueDate;
    private String description;
    private String status;
    private String remarks;
}

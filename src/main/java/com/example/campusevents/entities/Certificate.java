package com.example.campusevents.entities;

import com.example.campusevents.enums.CertificateStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "certificates", indexes = {
        @Index(name = "idx_certificates_student_id", columnList = "student_id"),
        @Index(name = "idx_certificates_event_id", columnList = "event_id"),
        @Index(name = "idx_certificates_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Certificate {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "student_id", nullable = false)
    private UUID studentId;

    // optional link to the event the certificate was earned at
    @Column(name = "event_id")
    private UUID eventId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "category", length = 100)
    private String category;

    @Column(name = "certificate_type", length = 50)
    private String certificateType;

    @Column(name = "issue_date")
    private LocalDate issueDate;

    @Column(name = "issued_by")
    private String issuedBy;

    @Column(name = "description", length = 2000)
    private String description;

    // null for certificates generated by an admin
    @Column(name = "file_name")
    private String fileName;

    @Column(name = "file_url", length = 500)
    private String fileUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private CertificateStatus status = CertificateStatus.PENDING;

    @Column(name = "remarks", length = 2000)
    private String remarks;

    @Column(name = "approved_at")
    private Instant approvedAt;

    // admins.id
    @Column(name = "approved_by")
    private UUID approvedBy;

    @Column(name = "uploaded_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant uploadedAt = Instant.now();

    @Column(name = "updated_at")
    @Builder.Default
    private Instant updatedAt = Instant.now();
}

package com.example.campusevents.entities;

import com.example.campusevents.enums.AttendanceStatus;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * The single attendance/proof record of a student at an event. QR check-in and photo
 * upload both write into the same row, whichever comes first creates it.
 */
@Entity
@Table(name = "attendance_logs", uniqueConstraints = {
        @UniqueConstraint(name = "uk_attendance_student_event", columnNames = {"student_id", "event_id"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttendanceLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "student_id", nullable = false)
    private UUID studentId;

    @Column(name = "event_id", nullable = false)
    private UUID eventId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private AttendanceStatus status;

    @Column(name = "location", length = 500)
    private String location;

    @Column(name = "scanned_qr_data", length = 2000)
    private String scannedQrData;

    // raw JSON as sent by the client
    @Column(name = "device_info", length = 2000)
    private String deviceInfo;

    @Column(name = "proof_photo_url", length = 1000)
    private String proofPhotoUrl;

    @Column(name = "latitude", precision = 10, scale = 8)
    private BigDecimal latitude;

    @Column(name = "longitude", precision = 11, scale = 8)
    private BigDecimal longitude;

    @Column(name = "photo_taken_at")
    private Instant photoTakenAt;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Column(name = "timestamp")
    private Instant timestamp;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    @Builder.Default
    private Instant updatedAt = Instant.now();

    public boolean hasCompleteProof() {
        return proofPhotoUrl != null && latitude != null && longitude != null;
    }
}

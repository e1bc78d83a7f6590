package com.example.campusevents.entities;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "on_duty_attendance", uniqueConstraints = {
        @UniqueConstraint(name = "uk_on_duty_attendance_day",
                columnNames = {"on_duty_request_id", "student_id", "check_in_date"})
}, indexes = {
        @Index(name = "idx_on_duty_attendance_student_id", columnList = "student_id"),
        @Index(name = "idx_on_duty_attendance_check_in_time", columnList = "check_in_time")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OnDutyAttendance {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "on_duty_request_id", nullable = false)
    private UUID onDutyRequestId;

    @Column(name = "student_id", nullable = false)
    private UUID studentId;

    @Column(name = "check_in_time", nullable = false)
    private Instant checkInTime;

    // calendar day of checkInTime, one row per request and day
    @Column(name = "check_in_date", nullable = false)
    private LocalDate checkInDate;

    @Column(name = "latitude", nullable = false, precision = 10, scale = 8)
    private BigDecimal latitude;

    @Column(name = "longitude", nullable = false, precision = 11, scale = 8)
    private BigDecimal longitude;

    @Column(name = "address", length = 1000)
    private String address;

    @Column(name = "selfie_photo_url", length = 500)
    private String selfiePhotoUrl;

    @Column(name = "qr_data", length = 2000)
    private String qrData;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();
}

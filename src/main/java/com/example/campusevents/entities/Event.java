package com.example.campusevents.entities;

import com.example.campusevents.enums.EventStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

@Entity
@Table(name = "events", indexes = {
        @Index(name = "idx_event_date", columnList = "event_date"),
        @Index(name = "idx_event_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Event {

    public static final int DEFAULT_GRACE_PERIOD_MINUTES = 15;

    @Id
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description", length = 4000)
    private String description;

    @Column(name = "event_date")
    private LocalDate eventDate;

    // optional: an event without a time stays open for registration the whole day
    @Column(name = "event_time")
    private LocalTime eventTime;

    @Column(name = "venue")
    private String venue;

    @Column(name = "category", length = 100)
    private String category;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private EventStatus status = EventStatus.ACTIVE;

    // opaque payload encoded into the printed QR code
    @Column(name = "qr_data", length = 2000)
    private String qrData;

    @Column(name = "max_participants")
    private Integer maxParticipants;

    @Column(name = "grace_period_minutes")
    @Builder.Default
    private Integer gracePeriodMinutes = DEFAULT_GRACE_PERIOD_MINUTES;

    // admins.id
    @Column(name = "created_by")
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    @Builder.Default
    private Instant updatedAt = Instant.now();

    public int effectiveGracePeriodMinutes() {
        return gracePeriodMinutes == null ? DEFAULT_GRACE_PERIOD_MINUTES : gracePeriodMinutes;
    }
}

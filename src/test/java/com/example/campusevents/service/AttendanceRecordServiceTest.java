package com.example.campusevents.service;

import com.example.campusevents.entities.AttendanceLog;
import com.example.campusevents.entities.EventParticipant;
import com.example.campusevents.enums.AttendanceStatus;
import com.example.campusevents.exception.ConflictException;
import com.example.campusevents.repository.AttendanceLogRepository;
import com.example.campusevents.repository.EventParticipantRepository;
import com.example.campusevents.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AttendanceRecordService upserts")
class AttendanceRecordServiceTest {

    @Mock
    private AttendanceLogRepository attendanceLogRepository;

    @Mock
    private EventParticipantRepository participantRepository;

    private final MutableClock clock = MutableClock.at("2025-03-15T10:30:00Z");

    private AttendanceRecordService service;

    private final UUID studentId = UUID.randomUUID();
    private final UUID eventId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new AttendanceRecordService(attendanceLogRepository, participantRepository, clock);
    }

    @Test
    @DisplayName("Proof on a late log keeps it late and fills only the proof fields")
    void proofKeepsLateAndQrData() {
        // Given
        AttendanceLog existing = AttendanceLog.builder()
                .id(UUID.randomUUID()).studentId(studentId).eventId(eventId)
                .status(AttendanceStatus.LATE)
                .scannedQrData("{\"eventId\":\"x\"}")
                .timestamp(Instant.parse("2025-03-15T10:20:00Z"))
                .build();
        when(attendanceLogRepository.findByStudentIdAndEventId(studentId, eventId)).thenReturn(Optional.of(existing));
        when(attendanceLogRepository.save(any(AttendanceLog.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        AttendanceLog saved = service.upsertAttendance(studentId, eventId, AttendancePatch.builder()
                .status(AttendanceStatus.ATTENDED)
                .preserveLate(true)
                .proofPhotoUrl("/uploads/attendance-photos/p.jpg")
                .latitude(new BigDecimal("12.97160000"))
                .longitude(new BigDecimal("77.59460000"))
                .photoTakenAt(clock.instant())
                .build());

        // Then
        assertThat(saved.getStatus()).isEqualTo(AttendanceStatus.LATE);
        assertThat(saved.getScannedQrData()).isEqualTo("{\"eventId\":\"x\"}");
        assertThat(saved.getTimestamp()).isEqualTo(Instant.parse("2025-03-15T10:20:00Z"));
        assertThat(saved.hasCompleteProof()).isTrue();
        assertThat(saved.getUpdatedAt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("A check-in after proof sets the scan status and keeps the photo")
    void checkInAfterProof() {
        AttendanceLog existing = AttendanceLog.builder()
                .id(UUID.randomUUID()).studentId(studentId).eventId(eventId)
                .status(AttendanceStatus.ATTENDED)
                .proofPhotoUrl("/uploads/attendance-photos/p.jpg")
                .build();
        when(attendanceLogRepository.findByStudentIdAndEventId(studentId, eventId)).thenReturn(Optional.of(existing));
        when(attendanceLogRepository.save(any(AttendanceLog.class))).thenAnswer(inv -> inv.getArgument(0));

        AttendanceLog saved = service.upsertAttendance(studentId, eventId, AttendancePatch.builder()
                .status(AttendanceStatus.LATE)
                .scannedQrData("qr")
                .timestamp(clock.instant())
                .build());

        assertThat(saved.getStatus()).isEqualTo(AttendanceStatus.LATE);
        assertThat(saved.getProofPhotoUrl()).isEqualTo("/uploads/attendance-photos/p.jpg");
        assertThat(saved.getScannedQrData()).isEqualTo("qr");
    }

    @Test
    void createsLogWithDefaultTimestamp() {
        when(attendanceLogRepository.findByStudentIdAndEventId(studentId, eventId)).thenReturn(Optional.empty());
        when(attendanceLogRepository.saveAndFlush(any(AttendanceLog.class))).thenAnswer(inv -> inv.getArgument(0));

        AttendanceLog saved = service.upsertAttendance(studentId, eventId, AttendancePatch.builder()
                .status(AttendanceStatus.ATTENDED)
                .location("Main Hall")
                .build());

        assertThat(saved.getTimestamp()).isEqualTo(clock.instant());
        assertThat(saved.getLocation()).isEqualTo("Main Hall");
    }

    @Test
    @DisplayName("A lost insert race surfaces as a conflict")
    void concurrentInsert() {
        when(attendanceLogRepository.findByStudentIdAndEventId(studentId, eventId)).thenReturn(Optional.empty());
        when(attendanceLogRepository.saveAndFlush(any(AttendanceLog.class)))
                .thenThrow(new DataIntegrityViolationException("uk_attendance_student_event"));

        assertThatThrownBy(() -> service.upsertAttendance(studentId, eventId,
                AttendancePatch.builder().status(AttendanceStatus.ATTENDED).build()))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void participantUpsertKeepsCheckInTimeWhenNotGiven() {
        Instant firstScan = Instant.parse("2025-03-15T10:05:00Z");
        EventParticipant p = EventParticipant.builder()
                .id(UUID.randomUUID()).eventId(eventId).studentId(studentId)
                .status(AttendanceStatus.LATE).checkInTime(firstScan).build();
        when(participantRepository.findByEventIdAndStudentId(eventId, studentId)).thenReturn(Optional.of(p));
        when(participantRepository.save(any(EventParticipant.class))).thenAnswer(inv -> inv.getArgument(0));

        EventParticipant saved = service.upsertParticipant(eventId, studentId, AttendanceStatus.ATTENDED, null,
                PhotoProofService.PROOF_ONLY_NOTE, true);

        assertThat(saved.getStatus()).isEqualTo(AttendanceStatus.LATE);
        assertThat(saved.getCheckInTime()).isEqualTo(firstScan);
        assertThat(saved.getNotes()).isEqualTo(PhotoProofService.PROOF_ONLY_NOTE);
    }

    @Test
    void mergeStatus() {
        assertThat(AttendanceRecordService.mergeStatus(AttendanceStatus.LATE, AttendanceStatus.ATTENDED, true))
                .isEqualTo(AttendanceStatus.LATE);
        assertThat(AttendanceRecordService.mergeStatus(AttendanceStatus.LATE, AttendanceStatus.ATTENDED, false))
                .isEqualTo(AttendanceStatus.ATTENDED);
        assertThat(AttendanceRecordService.mergeStatus(AttendanceStatus.REGISTERED, AttendanceStatus.ATTENDED, true))
                .isEqualTo(AttendanceStatus.ATTENDED);
    }
}

package com.example.campusevents.service;

import com.example.campusevents.entities.AttendanceLog;
import com.example.campusevents.entities.EventParticipant;
import com.example.campusevents.enums.AttendanceStatus;
import com.example.campusevents.exception.ConflictException;
import com.example.campusevents.exception.ErrorCode;
import com.example.campusevents.repository.AttendanceLogRepository;
import com.example.campusevents.repository.EventParticipantRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Keyed upserts of the two per-(student, event) rows: the attendance log and the participant.
 * QR check-in and photo proof upload both go through here, so whichever arrives first
 * creates the row and the other one completes it.
 */
@Service
@RequiredArgsConstructor
public class AttendanceRecordService {

    private final Logger log = LoggerFactory.getLogger(AttendanceRecordService.class);

    private final AttendanceLogRepository attendanceLogRepository;
    private final EventParticipantRepository participantRepository;
    private final Clock clock;

    @Transactional
    public AttendanceLog upsertAttendance(UUID studentId, UUID eventId, AttendancePatch patch) {
        Instant now = Instant.now(clock);
        AttendanceLog existing = attendanceLogRepository.findByStudentIdAndEventId(studentId, eventId).orElse(null);

        if (existing == null) {
            AttendanceLog created = AttendanceLog.builder()
                    .studentId(studentId)
                    .eventId(eventId)
                    .status(patch.getStatus())
                    .timestamp(patch.getTimestamp() != null ? patch.getTimestamp() : now)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            apply(created, patch);
            try {
                AttendanceLog saved = attendanceLogRepository.saveAndFlush(created);
                log.debug("Created attendance log {} student={} event={} status={}", saved.getId(), studentId, eventId, saved.getStatus());
                return saved;
            } catch (DataIntegrityViolationException ex) {
                throw new ConflictException(ErrorCode.CONCURRENT_UPDATE,
                        "Attendance for this event is being recorded concurrently, please retry", ex);
            }
        }

        if (patch.getStatus() != null) {
            existing.setStatus(mergeStatus(existing.getStatus(), patch.getStatus(), patch.isPreserveLate()));
        }
        if (patch.getTimestamp() != null) {
            existing.setTimestamp(patch.getTimestamp());
        }
        apply(existing, patch);
        existing.setUpdatedAt(now);
        AttendanceLog saved = attendanceLogRepository.save(existing);
        log.debug("Updated attendance log {} student={} event={} status={}", saved.getId(), studentId, eventId, saved.getStatus());
        return saved;
    }

    /**
     * Moves the participant of (event, student) to {@code status}, creating it if missing.
     * {@code checkInTime} null keeps an existing check-in time (or stamps now on creation).
     */
    @Transactional
    public EventParticipant upsertParticipant(UUID eventId, UUID studentId, AttendanceStatus status,
                                              Instant checkInTime, String note, boolean preserveLate) {
        Instant now = Instant.now(clock);
        EventParticipant participant = participantRepository.findByEventIdAndStudentId(eventId, studentId).orElse(null);

        if (participant == null) {
            participant = EventParticipant.builder()
                    .eventId(eventId)
                    .studentId(studentId)
                    .status(status)
                    .checkInTime(checkInTime != null ? checkInTime : now)
                    .notes(note)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            try {
                return participantRepository.saveAndFlush(participant);
            } catch (DataIntegrityViolationException ex) {
                throw new ConflictException(ErrorCode.CONCURRENT_UPDATE,
                        "Participation for this event is being recorded concurrently, please retry", ex);
            }
        }

        participant.setStatus(mergeStatus(participant.getStatus(), status, preserveLate));
        if (checkInTime != null) {
            participant.setCheckInTime(checkInTime);
        } else if (participant.getCheckInTime() == null) {
            participant.setCheckInTime(now);
        }
        if (note != null) {
            participant.setNotes(note);
        }
        participant.setUpdatedAt(now);
        return participantRepository.save(participant);
    }

    private void apply(AttendanceLog target, AttendancePatch patch) {
        if (patch.getLocation() != null) target.setLocation(patch.getLocation());
        if (patch.getScannedQrData() != null) target.setScannedQrData(patch.getScannedQrData());
        if (patch.getDeviceInfo() != null) target.setDeviceInfo(patch.getDeviceInfo());
        if (patch.getProofPhotoUrl() != null) target.setProofPhotoUrl(patch.getProofPhotoUrl());
        if (patch.getLatitude() != null) target.setLatitude(patch.getLatitude());
        if (patch.getLongitude() != null) target.setLongitude(patch.getLongitude());
        if (patch.getPhotoTakenAt() != null) target.setPhotoTakenAt(patch.getPhotoTakenAt());
        if (patch.getNotes() != null) target.setNotes(patch.getNotes());
    }

    static AttendanceStatus mergeStatus(AttendanceStatus current, AttendanceStatus requested, boolean preserveLate) {
        if (preserveLate && current == AttendanceStatus.LATE && requested == AttendanceStatus.ATTENDED) {
            return AttendanceStatus.LATE;
        }
        return requested;
    }
}

package com.example.campusevents.service;

import com.example.campusevents.dto.AttendanceLogView;
import com.example.campusevents.dto.CheckInRequest;
import com.example.campusevents.dto.CheckInResult;
import com.example.campusevents.dto.ParticipantUpdateRequest;
import com.example.campusevents.entities.AppUser;
import com.example.campusevents.entities.AttendanceLog;
import com.example.campusevents.entities.Event;
import com.example.campusevents.entities.EventParticipant;
import com.example.campusevents.entities.Student;
import com.example.campusevents.enums.AttendanceStatus;
import com.example.campusevents.enums.UserRole;
import com.example.campusevents.exception.ErrorCode;
import com.example.campusevents.exception.ForbiddenException;
import com.example.campusevents.exception.NotFoundException;
import com.example.campusevents.exception.ValidationException;
import com.example.campusevents.repository.AttendanceLogRepository;
import com.example.campusevents.repository.EventParticipantRepository;
import com.example.campusevents.repository.EventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * QR check-in and attendance history.
 */
@Service
@RequiredArgsConstructor
public class AttendanceService {

    private final Logger log = LoggerFactory.getLogger(AttendanceService.class);

    private final EventRepository eventRepository;
    private final EventParticipantRepository participantRepository;
    private final AttendanceLogRepository attendanceLogRepository;
    private final AttendanceRecordService recordService;
    private final StudentService studentService;
    private final EventSchedule eventSchedule;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Checks the calling student in from a scanned QR payload.
     * <p>
     * Rejects cancelled, not yet started and finished events. Within start + grace period the
     * scan counts as ATTENDED, afterwards as LATE. Participant and attendance log are written
     * in the same transaction.
     */
    @Transactional
    public CheckInResult checkIn(AppUser user, CheckInRequest req) {
        UUID eventId = parseQrEventId(req.getQrData());

        Event event = eventRepository.findById(eventId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.EVENT_NOT_FOUND, "Event not found"));

        Instant now = Instant.now(clock);
        AttendanceStatus status = eventSchedule.admitCheckIn(event, now);

        Student student = studentService.requireForUser(user);
        String location = firstNonBlank(req.getLocation(), event.getVenue());

        recordService.upsertParticipant(eventId, student.getId(), status, now, null, false);
        AttendanceLog attendance = recordService.upsertAttendance(student.getId(), eventId, AttendancePatch.builder()
                .status(status)
                .location(location)
                .scannedQrData(req.getQrData())
                .deviceInfo(toJson(req.getDeviceInfo()))
                .timestamp(now)
                .build());

        log.info("Check-in student={} event={} status={}", student.getId(), eventId, status.value());
        return CheckInResult.builder()
                .id(attendance.getId())
                .studentId(student.getId())
                .eventId(eventId)
                .eventName(event.getName())
                .eventVenue(event.getVenue())
                .location(firstNonBlank(attendance.getLocation(), event.getVenue()))
                .checkInTime(attendance.getTimestamp())
                .status(attendance.getStatus())
                .build();
    }

    /**
     * Attendance logs of a student, newest first. Students may only read their own.
     */
    @Transactional(readOnly = true)
    public List<AttendanceLogView> findHistory(UUID studentId, AppUser caller) {
        if (caller.getRole() == UserRole.STUDENT) {
            Student own = studentService.requireForUser(caller);
            if (!own.getId().equals(studentId)) {
                throw new ForbiddenException("Unauthorized");
            }
        }
        List<AttendanceLog> logs = attendanceLogRepository.findByStudentIdOrderByTimestampDesc(studentId);
        Map<UUID, Event> events = eventRepository.findAllById(
                        logs.stream().map(AttendanceLog::getEventId).collect(Collectors.toSet()))
                .stream().collect(Collectors.toMap(Event::getId, Function.identity()));

        List<AttendanceLogView> out = new ArrayList<>(logs.size());
        for (AttendanceLog l : logs) {
            out.add(toView(l, events.get(l.getEventId())));
        }
        return out;
    }

    @Transactional
    public EventParticipant updateParticipant(UUID participantId, ParticipantUpdateRequest req) {
        EventParticipant participant = participantRepository.findById(participantId)
                .orElseThrow(() -> new NotFoundException("Participant not found"));
        if (req.getStatus() != null) participant.setStatus(req.getStatus());
        if (req.getNotes() != null) participant.setNotes(req.getNotes());
        participant.setUpdatedAt(Instant.now(clock));
        EventParticipant saved = participantRepository.save(participant);
        log.info("Participant {} updated by admin status={}", participantId, saved.getStatus().value());
        return saved;
    }

    static AttendanceLogView toView(AttendanceLog l, Event event) {
        AttendanceLogView.AttendanceLogViewBuilder b = AttendanceLogView.builder()
                .id(l.getId())
                .studentId(l.getStudentId())
                .eventId(l.getEventId())
                .status(l.getStatus())
                .location(l.getLocation())
                .scannedQrData(l.getScannedQrData())
                .deviceInfo(l.getDeviceInfo())
                .proofPhotoUrl(l.getProofPhotoUrl())
                .latitude(l.getLatitude())
                .longitude(l.getLongitude())
                .photoTakenAt(l.getPhotoTakenAt())
                .timestamp(l.getTimestamp());
        if (event != null) {
            b.eventName(event.getName()).eventDate(event.getEventDate()).venue(event.getVenue());
        }
        return b.build();
    }

    /**
     * Extracts the event id from an event QR payload ({"eventId": "...", ...}).
     */
    UUID parseQrEventId(String qrData) {
        if (qrData == null || qrData.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_QR_CODE, "QR data is required");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(qrData);
        } catch (JsonProcessingException ex) {
            throw new ValidationException(ErrorCode.INVALID_QR_CODE, "Invalid QR code format");
        }
        JsonNode idNode = node == null ? null : node.get("eventId");
        if (idNode == null || !idNode.isTextual() || idNode.asText().isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_QR_CODE, "Invalid event QR code");
        }
        try {
            return UUID.fromString(idNode.asText().trim());
        } catch (IllegalArgumentException ex) {
            throw new ValidationException(ErrorCode.INVALID_QR_CODE, "Invalid event QR code");
        }
    }

    String toJson(JsonNode deviceInfo) {
        if (deviceInfo == null || deviceInfo.isNull()) return null;
        try {
            return objectMapper.writeValueAsString(deviceInfo);
        } catch (JsonProcessingException ex) {
            throw new ValidationException("Invalid deviceInfo");
        }
    }

    private static String firstNonBlank(String a, String b) {
        return a != null && !a.isBlank() ? a : b;
    }
}

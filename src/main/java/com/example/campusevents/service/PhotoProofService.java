package com.example.campusevents.service;

import com.example.campusevents.dto.AttendanceLogView;
import com.example.campusevents.dto.PhotoUploadRequest;
import com.example.campusevents.entities.AppUser;
import com.example.campusevents.entities.AttendanceLog;
import com.example.campusevents.entities.Event;
import com.example.campusevents.entities.Student;
import com.example.campusevents.enums.AttendanceStatus;
import com.example.campusevents.exception.ErrorCode;
import com.example.campusevents.exception.NotFoundException;
import com.example.campusevents.exception.ValidationException;
import com.example.campusevents.repository.AttendanceLogRepository;
import com.example.campusevents.repository.EventRepository;
import com.example.campusevents.storage.FileStorageService;
import com.example.campusevents.storage.PhotoPayloadDecoder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * Attaches photo + GPS proof to the attendance log of a student, creating the log when the
 * student uploads before scanning. Event-scoped uploads are only accepted while the event is
 * open for check-in.
 */
@Service
@RequiredArgsConstructor
public class PhotoProofService {

    public static final String PHOTO_CATEGORY = "attendance-photos";
    public static final String PROOF_ONLY_NOTE = "Attendance recorded via photo proof";

    private static final BigDecimal MAX_LATITUDE = BigDecimal.valueOf(90);
    private static final BigDecimal MAX_LONGITUDE = BigDecimal.valueOf(180);

    private final Logger log = LoggerFactory.getLogger(PhotoProofService.class);

    private final AttendanceLogRepository attendanceLogRepository;
    private final EventRepository eventRepository;
    private final AttendanceRecordService recordService;
    private final StudentService studentService;
    private final FileStorageService fileStorageService;
    private final PhotoPayloadDecoder photoPayloadDecoder;
    private final EventSchedule eventSchedule;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public AttendanceLogView uploadPhoto(AppUser user, PhotoUploadRequest req) {
        if (req.getAttendanceLogId() == null && req.getEventId() == null) {
            throw new ValidationException("Either attendanceLogId or eventId is required");
        }
        if (req.getAttendanceLogId() != null && req.getEventId() != null) {
            throw new ValidationException("Provide only one of attendanceLogId or eventId");
        }
        validateCoordinates(req.getLatitude(), req.getLongitude());
        byte[] photo = photoPayloadDecoder.decode(req.getPhotoData());

        Student student = studentService.requireForUser(user);
        Instant now = Instant.now(clock);

        if (req.getAttendanceLogId() != null) {
            AttendanceLog target = attendanceLogRepository.findByIdAndStudentId(req.getAttendanceLogId(), student.getId())
                    .orElseThrow(() -> new NotFoundException("Attendance record not found"));
            String url = fileStorageService.save(photo, PHOTO_CATEGORY, target.getEventId() + "_" + student.getId());
            target.setProofPhotoUrl(url);
            target.setLatitude(req.getLatitude());
            target.setLongitude(req.getLongitude());
            target.setPhotoTakenAt(now);
            target.setUpdatedAt(now);
            AttendanceLog saved = attendanceLogRepository.save(target);
            log.info("Photo proof attached to attendance log {} student={}", saved.getId(), student.getId());
            return AttendanceService.toView(saved, eventRepository.findById(saved.getEventId()).orElse(null));
        }

        Event event = eventRepository.findById(req.getEventId())
                .orElseThrow(() -> new NotFoundException(ErrorCode.EVENT_NOT_FOUND, "Event not found"));
        // same window as a QR scan, checked before anything is written to disk
        eventSchedule.admitCheckIn(event, now);
        String url = fileStorageService.save(photo, PHOTO_CATEGORY, event.getId() + "_" + student.getId());
        try {
            AttendanceLog saved = recordService.upsertAttendance(student.getId(), event.getId(), AttendancePatch.builder()
                    .status(AttendanceStatus.ATTENDED)
                    .preserveLate(true)
                    .location(req.getLocation())
                    .scannedQrData(req.getQrData())
                    .deviceInfo(toJson(req))
                    .proofPhotoUrl(url)
                    .latitude(req.getLatitude())
                    .longitude(req.getLongitude())
                    .photoTakenAt(now)
                    .build());
            recordService.upsertParticipant(event.getId(), student.getId(), AttendanceStatus.ATTENDED, null, PROOF_ONLY_NOTE, true);
            log.info("Photo proof recorded for student={} event={} log={}", student.getId(), event.getId(), saved.getId());
            return AttendanceService.toView(saved, event);
        } catch (RuntimeException ex) {
            log.warn("Photo {} stored but attendance update failed for student={} event={}", url, student.getId(), event.getId());
            throw ex;
        }
    }

    private void validateCoordinates(BigDecimal latitude, BigDecimal longitude) {
        if (latitude == null || longitude == null) {
            throw new ValidationException("latitude and longitude are required");
        }
        if (latitude.abs().compareTo(MAX_LATITUDE) > 0) {
            throw new ValidationException("latitude must be between -90 and 90");
        }
        if (longitude.abs().compareTo(MAX_LONGITUDE) > 0) {
            throw new ValidationException("longitude must be between -180 and 180");
        }
    }

    private String toJson(PhotoUploadRequest req) {
        if (req.getDeviceInfo() == null || req.getDeviceInfo().isNull()) return null;
        try {
            return objectMapper.writeValueAsString(req.getDeviceInfo());
        } catch (JsonProcessingException ex) {
            throw new ValidationException("Invalid deviceInfo");
        }
    }
}

package com.example.campusevents.service;

import com.example.campusevents.dto.EventRequest;
import com.example.campusevents.dto.EventView;
import com.example.campusevents.dto.ParticipantView;
import com.example.campusevents.entities.AppUser;
import com.example.campusevents.entities.AttendanceLog;
import com.example.campusevents.entities.Event;
import com.example.campusevents.entities.EventParticipant;
import com.example.campusevents.entities.Student;
import com.example.campusevents.enums.AttendanceStatus;
import com.example.campusevents.enums.EventStatus;
import com.example.campusevents.enums.UserRole;
import com.example.campusevents.exception.ErrorCode;
import com.example.campusevents.exception.NotFoundException;
import com.example.campusevents.exception.ValidationException;
import com.example.campusevents.repository.AttendanceLogRepository;
import com.example.campusevents.repository.CertificateRepository;
import com.example.campusevents.repository.EventParticipantRepository;
import com.example.campusevents.repository.EventRepository;
import com.example.campusevents.repository.StudentRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class EventService {

    public static final String QR_TYPE = "event_attendance";

    private final Logger log = LoggerFactory.getLogger(EventService.class);

    private final EventRepository eventRepository;
    private final EventParticipantRepository participantRepository;
    private final AttendanceLogRepository attendanceLogRepository;
    private final CertificateRepository certificateRepository;
    private final StudentRepository studentRepository;
    private final StudentService studentService;
    private final EventRegistrationService registrationService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${app.events.default-grace-period-minutes:15}")
    private int defaultGracePeriodMinutes = Event.DEFAULT_GRACE_PERIOD_MINUTES;

    @Transactional(readOnly = true)
    public List<EventView> findEvents(EventStatus status, String category, LocalDate fromDate, LocalDate toDate, AppUser caller) {
        Specification<Event> spec = Specification.where(null);
        if (status != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("status"), status));
        }
        if (category != null && !category.isBlank()) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("category"), category));
        }
        if (fromDate != null) {
            spec = spec.and((root, q, cb) -> cb.greaterThanOrEqualTo(root.<LocalDate>get("eventDate"), fromDate));
        }
        if (toDate != null) {
            spec = spec.and((root, q, cb) -> cb.lessThanOrEqualTo(root.<LocalDate>get("eventDate"), toDate));
        }
        List<Event> events = eventRepository.findAll(spec, Sort.by(Sort.Direction.DESC, "eventDate"));
        UUID studentId = callerStudentId(caller);
        List<EventView> out = new ArrayList<>(events.size());
        for (Event e : events) {
            out.add(toView(e, studentId));
        }
        return out;
    }

    @Transactional(readOnly = true)
    public EventView getEvent(UUID id, AppUser caller) {
        return toView(requireEvent(id), callerStudentId(caller));
    }

    @Transactional(readOnly = true)
    public Event requireEvent(UUID id) {
        return eventRepository.findById(id)
                .orElseThrow(() -> new NotFoundException(ErrorCode.EVENT_NOT_FOUND, "Event not found"));
    }

    @Transactional
    public EventView createEvent(EventRequest req, UUID adminId) {
        if (req.getName() == null || req.getName().isBlank() || req.getEventDate() == null) {
            throw new ValidationException("Event name and date are required");
        }
        Instant now = Instant.now(clock);
        UUID id = UUID.randomUUID();
        Event event = Event.builder()
                .id(id)
                .name(req.getName().trim())
                .description(req.getDescription())
                .eventDate(req.getEventDate())
                .eventTime(req.getEventTime())
                .venue(req.getVenue())
                .category(req.getCategory())
                .status(req.getStatus() == null ? EventStatus.ACTIVE : req.getStatus())
                .maxParticipants(req.getMaxParticipants())
                .gracePeriodMinutes(req.getGracePeriodMinutes() == null ? defaultGracePeriodMinutes : req.getGracePeriodMinutes())
                .qrData(buildQrData(id, req.getName().trim(), req.getVenue(), now))
                .createdBy(adminId)
                .createdAt(now)
                .updatedAt(now)
                .build();
        Event saved = eventRepository.save(event);
        log.info("Created event id={} name={} date={} time={}", saved.getId(), saved.getName(), saved.getEventDate(), saved.getEventTime());
        return toView(saved, null);
    }

    /**
     * Partial update. Moving the event to Completed or Archived runs the absence sweep.
     */
    @Transactional
    public EventView updateEvent(UUID id, EventRequest req) {
        Event event = requireEvent(id);
        if (req.getName() != null) event.setName(req.getName().trim());
        if (req.getDescription() != null) event.setDescription(req.getDescription());
        if (req.getEventDate() != null) event.setEventDate(req.getEventDate());
        if (req.getEventTime() != null) event.setEventTime(req.getEventTime());
        if (req.getVenue() != null) event.setVenue(req.getVenue());
        if (req.getCategory() != null) event.setCategory(req.getCategory());
        if (req.getStatus() != null) event.setStatus(req.getStatus());
        if (req.getMaxParticipants() != null) event.setMaxParticipants(req.getMaxParticipants());
        if (req.getGracePeriodMinutes() != null) event.setGracePeriodMinutes(req.getGracePeriodMinutes());
        event.setUpdatedAt(Instant.now(clock));
        Event saved = eventRepository.save(event);

        if (saved.getStatus().isClosed()) {
            registrationService.markPendingParticipantsAbsent(saved);
        }
        log.info("Updated event id={} status={}", saved.getId(), saved.getStatus().getLabel());
        return toView(saved, null);
    }

    @Transactional
    public void deleteEvent(UUID id) {
        Event event = requireEvent(id);
        attendanceLogRepository.deleteByEventId(id);
        participantRepository.deleteByEventId(id);
        int unlinked = certificateRepository.unlinkEvent(id);
        eventRepository.delete(event);
        log.info("Deleted event id={} with its participants and attendance logs, {} certificates unlinked", id, unlinked);
    }

    @Transactional(readOnly = true)
    public String getQrData(UUID id) {
        return requireEvent(id).getQrData();
    }

    /**
     * Participants of an event with their profile and proof fields, latest check-in first.
     */
    @Transactional(readOnly = true)
    public List<ParticipantView> findParticipants(UUID eventId) {
        requireEvent(eventId);
        List<EventParticipant> participants = participantRepository.findByEventIdOrderByCheckInTimeDesc(eventId);
        if (participants.isEmpty()) return Collections.emptyList();

        Map<UUID, Student> students = studentRepository.findByIdIn(
                        participants.stream().map(EventParticipant::getStudentId).collect(Collectors.toSet()))
                .stream().collect(Collectors.toMap(Student::getId, Function.identity()));
        Map<UUID, AttendanceLog> logs = attendanceLogRepository.findByEventId(eventId).stream()
                .collect(Collectors.toMap(AttendanceLog::getStudentId, Function.identity(), (a, b) -> a));

        List<ParticipantView> out = new ArrayList<>(participants.size());
        for (EventParticipant p : participants) {
            Student s = students.get(p.getStudentId());
            AttendanceLog al = logs.get(p.getStudentId());
            ParticipantView.ParticipantViewBuilder b = ParticipantView.builder()
                    .id(p.getId())
                    .eventId(p.getEventId())
                    .studentId(p.getStudentId())
                    .status(p.getStatus())
                    .checkInTime(p.getCheckInTime())
                    .notes(p.getNotes())
                    .createdAt(p.getCreatedAt());
            if (s != null) {
                b.studentName(s.getName())
                        .studentEmail(s.getEmail())
                        .department(s.getDepartment())
                        .college(s.getCollege())
                        .registrationNumber(s.getRegistrationNumber());
            }
            if (al != null) {
                b.proofPhotoUrl(al.getProofPhotoUrl())
                        .latitude(al.getLatitude())
                        .longitude(al.getLongitude())
                        .photoTakenAt(al.getPhotoTakenAt());
            }
            out.add(b.build());
        }
        return out;
    }

    private EventView toView(Event e, UUID studentId) {
        UUID eventId = e.getId();
        EventView.EventViewBuilder b = EventView.builder()
                .id(eventId)
                .name(e.getName())
                .description(e.getDescription())
                .eventDate(e.getEventDate())
                .eventTime(e.getEventTime())
                .venue(e.getVenue())
                .category(e.getCategory())
                .status(e.getStatus())
                .qrData(e.getQrData())
                .maxParticipants(e.getMaxParticipants())
                .gracePeriodMinutes(e.effectiveGracePeriodMinutes())
                .createdBy(e.getCreatedBy())
                .createdAt(e.getCreatedAt())
                .updatedAt(e.getUpdatedAt())
                .totalParticipants(participantRepository.countByEventId(eventId))
                .registeredCount(participantRepository.countByEventIdAndStatus(eventId, AttendanceStatus.REGISTERED))
                .attendedCount(participantRepository.countByEventIdAndStatus(eventId, AttendanceStatus.ATTENDED))
                .lateCount(participantRepository.countByEventIdAndStatus(eventId, AttendanceStatus.LATE))
                .absentCount(participantRepository.countByEventIdAndStatus(eventId, AttendanceStatus.ABSENT))
                .checkInsCount(attendanceLogRepository.countByEventId(eventId))
                .photosUploaded(attendanceLogRepository.countPhotosByEventId(eventId));
        if (studentId != null) {
            participantRepository.findByEventIdAndStudentId(eventId, studentId).ifPresent(p -> b
                    .registrationStatus(p.getStatus())
                    .checkInTime(p.getCheckInTime())
                    .participantId(p.getId()));
        }
        return b.build();
    }

    private UUID callerStudentId(AppUser caller) {
        if (caller == null || caller.getRole() != UserRole.STUDENT) return null;
        return studentService.findByUserId(caller.getId()).map(Student::getId).orElse(null);
    }

    private String buildQrData(UUID eventId, String name, String venue, Instant createdAt) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("eventId", eventId.toString());
        node.put("type", QR_TYPE);
        node.put("name", name);
        node.put("venue", venue);
        node.put("timestamp", createdAt.toString());
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize QR payload", ex);
        }
    }
}

package com.example.campusevents.service;

import com.example.campusevents.dto.RegistrationResult;
import com.example.campusevents.entities.AppUser;
import com.example.campusevents.entities.AttendanceLog;
import com.example.campusevents.entities.Event;
import com.example.campusevents.entities.EventParticipant;
import com.example.campusevents.entities.Student;
import com.example.campusevents.enums.AttendanceStatus;
import com.example.campusevents.enums.EventStatus;
import com.example.campusevents.exception.ConflictException;
import com.example.campusevents.exception.ErrorCode;
import com.example.campusevents.exception.NotFoundException;
import com.example.campusevents.exception.StateException;
import com.example.campusevents.repository.AttendanceLogRepository;
import com.example.campusevents.repository.EventParticipantRepository;
import com.example.campusevents.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Registration of students for events and the absence sweep run when an event is closed.
 */
@Service
@RequiredArgsConstructor
public class EventRegistrationService {

    private static final EnumSet<AttendanceStatus> SEAT_HOLDING =
            EnumSet.of(AttendanceStatus.REGISTERED, AttendanceStatus.ATTENDED, AttendanceStatus.LATE);

    private final Logger log = LoggerFactory.getLogger(EventRegistrationService.class);

    private final EventRepository eventRepository;
    private final EventParticipantRepository participantRepository;
    private final AttendanceLogRepository attendanceLogRepository;
    private final StudentService studentService;
    private final EventSchedule eventSchedule;
    private final Clock clock;

    /**
     * Registers the calling student for an event.
     * <p>
     * The event row stays locked for the whole call, so the capacity count and the insert
     * cannot interleave with another registration for the same event. An existing
     * participant row makes the call idempotent (no write).
     *
     * @param fallbackStudentId only consulted when the caller has no linked student profile
     */
    @Transactional
    public RegistrationResult register(UUID eventId, AppUser user, UUID fallbackStudentId) {
        Instant now = Instant.now(clock);
        Event event = eventRepository.findByIdForUpdate(eventId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.EVENT_NOT_FOUND, "Event not found"));

        if (event.getStatus() == EventStatus.CANCELLED) {
            throw new StateException(ErrorCode.EVENT_CANCELLED, "Event is cancelled");
        }
        if (eventSchedule.isEventCompleted(event, now)) {
            throw new StateException(ErrorCode.REGISTRATION_CLOSED, "Event registration has closed");
        }

        Student student = studentService.resolveForRegistration(user, fallbackStudentId);
        studentService.requireApproved(student, "register for events");

        Optional<EventParticipant> existing = participantRepository.findByEventIdAndStudentId(eventId, student.getId());
        if (existing.isPresent()) {
            return existingRegistration(event, existing.get());
        }

        Integer cap = event.getMaxParticipants();
        if (cap != null) {
            long taken = participantRepository.countByEventIdAndStatusIn(eventId, SEAT_HOLDING);
            if (taken >= cap) {
                log.info("Registration refused, event {} full ({}/{}) student={}", eventId, taken, cap, student.getId());
                throw new ConflictException(ErrorCode.CAPACITY_EXCEEDED, "Event has reached maximum capacity");
            }
        }

        EventParticipant participant = EventParticipant.builder()
                .eventId(eventId)
                .studentId(student.getId())
                .status(AttendanceStatus.REGISTERED)
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            participant = participantRepository.saveAndFlush(participant);
        } catch (DataIntegrityViolationException ex) {
            throw new ConflictException(ErrorCode.CONCURRENT_UPDATE, "Registration is already in progress, please retry", ex);
        }
        log.info("Student {} registered for event {} participant={}", student.getId(), eventId, participant.getId());

        return RegistrationResult.builder()
                .eventId(eventId)
                .participantId(participant.getId())
                .registrationStatus(participant.getStatus())
                .message("Registered successfully")
                .created(true)
                .build();
    }

    private RegistrationResult existingRegistration(Event event, EventParticipant participant) {
        AttendanceStatus status = participant.getStatus();
        if (status == AttendanceStatus.ABSENT) {
            throw new StateException(ErrorCode.REGISTRATION_CLOSED, "Event has concluded. Registration is closed.");
        }
        String message = status.isCheckedIn()
                ? "You have already checked in for this event"
                : "You are already registered for this event";
        return RegistrationResult.builder()
                .eventId(event.getId())
                .participantId(participant.getId())
                .registrationStatus(status)
                .message(message)
                .created(false)
                .build();
    }

    /**
     * Marks every participant still REGISTERED as ABSENT and gives each of them an ABSENT
     * attendance log unless one exists already. Running it twice changes nothing.
     *
     * @return number of participants moved to ABSENT
     */
    @Transactional
    public int markPendingParticipantsAbsent(Event event) {
        List<EventParticipant> pending = participantRepository.findByEventIdAndStatus(event.getId(), AttendanceStatus.REGISTERED);
        if (pending.isEmpty()) {
            return 0;
        }
        Instant now = Instant.now(clock);
        for (EventParticipant participant : pending) {
            if (!attendanceLogRepository.existsByStudentIdAndEventId(participant.getStudentId(), event.getId())) {
                attendanceLogRepository.save(AttendanceLog.builder()
                        .studentId(participant.getStudentId())
                        .eventId(event.getId())
                        .status(AttendanceStatus.ABSENT)
                        .location(event.getVenue())
                        .timestamp(now)
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
            }
            participant.setStatus(AttendanceStatus.ABSENT);
            participant.setUpdatedAt(now);
        }
        participantRepository.saveAll(pending);
        log.info("Event {} closed: {} registered participants marked absent", event.getId(), pending.size());
        return pending.size();
    }
}

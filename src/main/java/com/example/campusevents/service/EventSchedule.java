package com.example.campusevents.service;

import com.example.campusevents.entities.Event;
import com.example.campusevents.enums.AttendanceStatus;
import com.example.campusevents.enums.EventStatus;
import com.example.campusevents.exception.ErrorCode;
import com.example.campusevents.exception.StateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Timing rules of an event: when registration closes and how a check-in is classified.
 * Event dates and times are read as UTC. All methods are side-effect free apart from logging.
 */
@Component
public class EventSchedule {

    private static final Logger log = LoggerFactory.getLogger(EventSchedule.class);

    /**
     * Registration gate.
     * <ul>
     *     <li>Completed/Archived status: completed.</li>
     *     <li>No date: not completed (kept open, logged).</li>
     *     <li>Date after today: open. Date before today: completed.</li>
     *     <li>Today without a time: open all day. Today with a time: completed once the start is reached.</li>
     * </ul>
     */
    public boolean isEventCompleted(Event event, Instant now) {
        EventStatus status = event.getStatus();
        if (status != null && status.isClosed()) {
            return true;
        }

        LocalDate date = event.getEventDate();
        if (date == null) {
            log.warn("Event {} has no usable date, keeping it open", event.getId());
            return false;
        }

        LocalDate today = today(now);
        if (date.isAfter(today)) {
            return false;
        }
        if (date.isBefore(today)) {
            return true;
        }

        LocalTime time = event.getEventTime();
        if (time == null) {
            log.debug("Event {} has no start time, registration stays open today", event.getId());
            return false;
        }

        Instant start = LocalDateTime.of(date, time).toInstant(ZoneOffset.UTC);
        boolean completed = !start.isAfter(now);
        log.debug("Registration window check event={} start={} now={} completed={}", event.getId(), start, now, completed);
        return completed;
    }

    /**
     * Start instant used for check-in timing. Unlike the registration gate a missing time reads as midnight.
     */
    public Optional<Instant> checkInStart(Event event) {
        LocalDate date = event.getEventDate();
        if (date == null) {
            return Optional.empty();
        }
        LocalTime time = event.getEventTime() == null ? LocalTime.MIDNIGHT : event.getEventTime();
        return Optional.of(LocalDateTime.of(date, time).toInstant(ZoneOffset.UTC));
    }

    /**
     * Classifies a scan at {@code now}: ATTENDED up to start + grace period, LATE afterwards.
     *
     * @throws StateException EVENT_NOT_STARTED when {@code now} is before the start
     */
    public AttendanceStatus classifyCheckIn(Event event, Instant now) {
        Optional<Instant> start = checkInStart(event);
        if (start.isEmpty()) {
            return AttendanceStatus.ATTENDED;
        }
        if (now.isBefore(start.get())) {
            throw new StateException(ErrorCode.EVENT_NOT_STARTED, "Event has not started yet");
        }
        Instant graceEnd = start.get().plus(Duration.ofMinutes(event.effectiveGracePeriodMinutes()));
        return now.isAfter(graceEnd) ? AttendanceStatus.LATE : AttendanceStatus.ATTENDED;
    }

    /**
     * Check-in stays possible for the whole event day, late arrivals included. It closes when an
     * admin completes/archives the event or once the calendar date has passed.
     */
    public boolean isCheckInClosed(Event event, Instant now) {
        EventStatus status = event.getStatus();
        if (status != null && status.isClosed()) {
            return true;
        }
        LocalDate date = event.getEventDate();
        return date != null && date.isBefore(today(now));
    }

    /**
     * Gate shared by QR check-in and event-scoped photo proof.
     *
     * @return the status the scan at {@code now} earns
     * @throws StateException ATTENDANCE_CLOSED for a cancelled event, EVENT_NOT_STARTED before the
     *                        start, EVENT_ALREADY_COMPLETED once check-in has closed
     */
    public AttendanceStatus admitCheckIn(Event event, Instant now) {
        if (event.getStatus() == EventStatus.CANCELLED) {
            throw new StateException(ErrorCode.ATTENDANCE_CLOSED, "Event is not open for attendance");
        }
        AttendanceStatus status = classifyCheckIn(event, now);
        if (isCheckInClosed(event, now)) {
            throw new StateException(ErrorCode.EVENT_ALREADY_COMPLETED, "Event is already completed");
        }
        return status;
    }

    public LocalDate today(Instant now) {
        return LocalDate.ofInstant(now, ZoneOffset.UTC);
    }
}

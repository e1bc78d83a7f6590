package com.example.campusevents.service;

import com.example.campusevents.dto.CheckInRequest;
import com.example.campusevents.dto.CheckInResult;
import com.example.campusevents.entities.AppUser;
import com.example.campusevents.entities.AttendanceLog;
import com.example.campusevents.entities.Event;
import com.example.campusevents.entities.Student;
import com.example.campusevents.enums.AttendanceStatus;
import com.example.campusevents.enums.EventStatus;
import com.example.campusevents.enums.StudentStatus;
import com.example.campusevents.enums.UserRole;
import com.example.campusevents.exception.ErrorCode;
import com.example.campusevents.exception.ForbiddenException;
import com.example.campusevents.exception.NotFoundException;
import com.example.campusevents.exception.StateException;
import com.example.campusevents.exception.ValidationException;
import com.example.campusevents.repository.AttendanceLogRepository;
import com.example.campusevents.repository.EventParticipantRepository;
import com.example.campusevents.repository.EventRepository;
import com.example.campusevents.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AttendanceService check-in")
class AttendanceServiceTest {

    @Mock
    private EventRepository eventRepository;

    @Mock
    private EventParticipantRepository participantRepository;

    @Mock
    private AttendanceLogRepository attendanceLogRepository;

    @Mock
    private AttendanceRecordService recordService;

    @Mock
    private StudentService studentService;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MutableClock clock = MutableClock.at("2025-03-15T10:05:00Z");

    private AttendanceService service;
    private Event event;
    private AppUser user;
    private Student student;

    @BeforeEach
    void setUp() {
        service = new AttendanceService(eventRepository, participantRepository, attendanceLogRepository,
                recordService, studentService, new EventSchedule(), objectMapper, clock);
        event = Event.builder()
                .id(UUID.randomUUID())
                .name("Hackathon")
                .venue("Main Hall")
                .eventDate(LocalDate.parse("2025-03-15"))
                .eventTime(LocalTime.parse("10:00"))
                .gracePeriodMinutes(15)
                .status(EventStatus.ACTIVE)
                .build();
        user = AppUser.builder().id(UUID.randomUUID()).email("a@campus.edu").role(UserRole.STUDENT).build();
        student = Student.builder().id(UUID.randomUUID()).userId(user.getId()).status(StudentStatus.APPROVED).build();
    }

    private CheckInRequest scan(String qrData) {
        CheckInRequest req = new CheckInRequest();
        req.setQrData(qrData);
        return req;
    }

    private String qrFor(Event e) {
        return "{\"eventId\":\"" + e.getId() + "\",\"type\":\"event_attendance\"}";
    }

    private void checkInSucceeds() {
        when(eventRepository.findById(event.getId())).thenReturn(Optional.of(event));
        when(studentService.requireForUser(user)).thenReturn(student);
        when(recordService.upsertAttendance(eq(student.getId()), eq(event.getId()), any(AttendancePatch.class)))
                .thenAnswer(inv -> {
                    AttendancePatch patch = inv.getArgument(2);
                    return AttendanceLog.builder()
                            .id(UUID.randomUUID())
                            .studentId(student.getId())
                            .eventId(event.getId())
                            .status(patch.getStatus())
                            .location(patch.getLocation())
                            .scannedQrData(patch.getScannedQrData())
                            .timestamp(patch.getTimestamp())
                            .build();
                });
    }

    @Test
    @DisplayName("Should mark attended within the grace period")
    void onTimeCheckIn() {
        // Given
        checkInSucceeds();

        // When
        CheckInResult result = service.checkIn(user, scan(qrFor(event)));

        // Then
        assertThat(result.getStatus()).isEqualTo(AttendanceStatus.ATTENDED);
        assertThat(result.getLocation()).isEqualTo("Main Hall");
        assertThat(result.getCheckInTime()).isEqualTo(Instant.parse("2025-03-15T10:05:00Z"));
        verify(recordService).upsertParticipant(event.getId(), student.getId(), AttendanceStatus.ATTENDED,
                Instant.parse("2025-03-15T10:05:00Z"), null, false);

        ArgumentCaptor<AttendancePatch> patch = ArgumentCaptor.forClass(AttendancePatch.class);
        verify(recordService).upsertAttendance(eq(student.getId()), eq(event.getId()), patch.capture());
        assertThat(patch.getValue().getScannedQrData()).isEqualTo(qrFor(event));
        assertThat(patch.getValue().getLocation()).isEqualTo("Main Hall");
    }

    @Test
    @DisplayName("Should mark late after the grace period")
    void lateCheckIn() {
        clock.set("2025-03-15T10:20:00Z");
        checkInSucceeds();

        CheckInResult result = service.checkIn(user, scan(qrFor(event)));

        assertThat(result.getStatus()).isEqualTo(AttendanceStatus.LATE);
        verify(recordService).upsertParticipant(eq(event.getId()), eq(student.getId()), eq(AttendanceStatus.LATE),
                any(Instant.class), isNull(), anyBoolean());
    }

    @Test
    void keepsClientLocation() {
        checkInSucceeds();
        CheckInRequest req = scan(qrFor(event));
        req.setLocation("Gate 2");

        assertThat(service.checkIn(user, req).getLocation()).isEqualTo("Gate 2");
    }

    @Test
    void rejectsMalformedQr() {
        assertThatThrownBy(() -> service.checkIn(user, scan("not json")))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid QR code format")
                .extracting("code").isEqualTo(ErrorCode.INVALID_QR_CODE);
        verifyNoInteractions(eventRepository, recordService);
    }

    @Test
    void rejectsQrWithoutEventId() {
        assertThatThrownBy(() -> service.checkIn(user, scan("{\"type\":\"event_attendance\"}")))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid event QR code");
        assertThatThrownBy(() -> service.checkIn(user, scan("{\"eventId\":\"42\"}")))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid event QR code");
    }

    @Test
    void unknownEvent() {
        when(eventRepository.findById(event.getId())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.checkIn(user, scan(qrFor(event))))
                .isInstanceOf(NotFoundException.class)
                .extracting("code").isEqualTo(ErrorCode.EVENT_NOT_FOUND);
    }

    @Test
    void cancelledEvent() {
        event.setStatus(EventStatus.CANCELLED);
        when(eventRepository.findById(event.getId())).thenReturn(Optional.of(event));

        assertThatThrownBy(() -> service.checkIn(user, scan(qrFor(event))))
                .isInstanceOf(StateException.class)
                .extracting("code").isEqualTo(ErrorCode.ATTENDANCE_CLOSED);
    }

    @Test
    @DisplayName("Should reject scans before the start and write nothing")
    void notStarted() {
        clock.set("2025-03-15T09:59:00Z");
        when(eventRepository.findById(event.getId())).thenReturn(Optional.of(event));

        assertThatThrownBy(() -> service.checkIn(user, scan(qrFor(event))))
                .isInstanceOf(StateException.class)
                .extracting("code").isEqualTo(ErrorCode.EVENT_NOT_STARTED);
        verifyNoInteractions(recordService);
    }

    @Test
    void completedEvent() {
        event.setStatus(EventStatus.COMPLETED);
        when(eventRepository.findById(event.getId())).thenReturn(Optional.of(event));

        assertThatThrownBy(() -> service.checkIn(user, scan(qrFor(event))))
                .isInstanceOf(StateException.class)
                .hasMessage("Event is already completed");
        verify(recordService, never()).upsertAttendance(any(), any(), any());
    }

    @Test
    @DisplayName("Students may only read their own history")
    void historyOfAnotherStudent() {
        when(studentService.requireForUser(user)).thenReturn(student);

        assertThatThrownBy(() -> service.findHistory(UUID.randomUUID(), user))
                .isInstanceOf(ForbiddenException.class);
        verifyNoInteractions(attendanceLogRepository);
    }
}

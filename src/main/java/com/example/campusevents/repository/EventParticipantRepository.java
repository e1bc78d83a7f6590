package com.example.campusevents.repository;

import com.example.campusevents.entities.EventParticipant;
import com.example.campusevents.enums.AttendanceStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface EventParticipantRepository extends JpaRepository<EventParticipant, UUID> {

    Optional<EventParticipant> findByEventIdAndStudentId(UUID eventId, UUID studentId);

    List<EventParticipant> findByEventIdAndStatus(UUID eventId, AttendanceStatus status);

    List<EventParticipant> findByEventIdOrderByCheckInTimeDesc(UUID eventId);


    long countByEventIdAndStatusIn(UUID eventId, Collection<AttendanceStatus> statuses);

    long countByEventIdAndStatus(UUID eventId, AttendanceStatus status);

    long countByEventId(UUID eventId);

    void deleteByEventId(UUID eventId);

    void deleteByStudentId(UUID studentId);
}

package com.example.campusevents.repository;

import com.example.campusevents.entities.AttendanceLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AttendanceLogRepository extends JpaRepository<AttendanceLog, UUID> {

    Optional<AttendanceLog> findByStudentIdAndEventId(UUID studentId, UUID eventId);

    Optional<AttendanceLog> findByIdAndStudentId(UUID id, UUID studentId);

    boolean existsByStudentIdAndEventId(UUID studentId, UUID eventId);

    List<AttendanceLog> findByStudentIdOrderByTimestampDesc(UUID studentId);

    List<AttendanceLog> findByEventId(UUID eventId);

    long countByEventId(UUID eventId);

    void deleteByEventId(UUID eventId);

    void deleteByStudentId(UUID studentId);

    @Query("SELECT COUNT(a) FROM AttendanceLog a WHERE a.eventId = :eventId AND a.proofPhotoUrl IS NOT NULL")
    long countPhotosByEventId(@Param("eventId") UUID eventId);
}

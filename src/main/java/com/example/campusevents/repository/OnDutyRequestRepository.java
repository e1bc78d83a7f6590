package com.example.campusevents.repository;

import com.example.campusevents.entities.OnDutyRequest;
import com.example.campusevents.enums.OnDutyStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface OnDutyRequestRepository extends JpaRepository<OnDutyRequest, UUID>, JpaSpecificationExecutor<OnDutyRequest> {

    List<OnDutyRequest> findByStudentIdOrderByCreatedAtDesc(UUID studentId);

    Optional<OnDutyRequest> findByIdAndStudentId(UUID id, UUID studentId);

    List<OnDutyRequest> findByStudentIdAndStatusAndStartDateLessThanEqualAndEndDateGreaterThanEqualOrderByStartDateDesc(
            UUID studentId, OnDutyStatus status, LocalDate startBound, LocalDate endBound);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM OnDutyRequest r WHERE r.id = :id AND r.studentId = :studentId")
    Optional<OnDutyRequest> findByIdAndStudentIdForUpdate(@Param("id") UUID id, @Param("studentId") UUID studentId);
}

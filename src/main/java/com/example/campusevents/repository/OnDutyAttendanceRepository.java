package com.example.campusevents.repository;

import com.example.campusevents.entities.OnDutyAttendance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public interface OnDutyAttendanceRepository extends JpaRepository<OnDutyAttendance, UUID>, JpaSpecificationExecutor<OnDutyAttendance> {

    boolean existsByOnDutyRequestIdAndStudentIdAndCheckInDate(UUID onDutyRequestId, UUID studentId, LocalDate checkInDate);

    List<OnDutyAttendance> findByStudentIdOrderByCheckInTimeDesc(UUID studentId);

    List<OnDutyAttendance> findByOnDutyRequestIdOrderByCheckInTimeAsc(UUID onDutyRequestId);

    void deleteByStudentId(UUID studentId);
}

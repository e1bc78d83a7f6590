package com.example.campusevents.repository;

import com.example.campusevents.entities.Certificate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface CertificateRepository extends JpaRepository<Certificate, UUID>, JpaSpecificationExecutor<Certificate> {

    List<Certificate> findByStudentIdOrderByUploadedAtDesc(UUID studentId);

    /**
     * Certificates outlive the event they reference.
     */
    @Modifying
    @Query("UPDATE Certificate c SET c.eventId = null WHERE c.eventId = :eventId")
    int unlinkEvent(@Param("eventId") UUID eventId);
}

package com.example.campusevents.repository;

import com.example.campusevents.entities.Student;
import com.example.campusevents.enums.StudentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface StudentRepository extends JpaRepository<Student, UUID> {

    Optional<Student> findByUserId(UUID userId);

    List<Student> findByStatusOrderByCreatedAtDesc(StudentStatus status);

    List<Student> findAllByOrderByCreatedAtDesc();

    List<Student> findByIdIn(Collection<UUID> ids);

    List<Student> findByNameContainingIgnoreCaseOrEmailContainingIgnoreCaseOrRegistrationNumberContainingIgnoreCase(
            String name, String email, String registrationNumber);

    boolean existsByEmailIgnoreCase(String email);

    boolean existsByRegistrationNumber(String registrationNumber);
}

package com.example.campusevents.service;

import com.example.campusevents.entities.AppUser;
import com.example.campusevents.entities.Student;
import com.example.campusevents.enums.StudentStatus;
import com.example.campusevents.enums.UserRole;
import com.example.campusevents.exception.ErrorCode;
import com.example.campusevents.exception.ForbiddenException;
import com.example.campusevents.exception.NotFoundException;
import com.example.campusevents.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class StudentService {

    private final Logger log = LoggerFactory.getLogger(StudentService.class);

    private final StudentRepository studentRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<Student> findByUserId(UUID userId) {
        if (userId == null) return Optional.empty();
        return studentRepository.findByUserId(userId);
    }

    @Transactional(readOnly = true)
    public Optional<Student> findById(UUID id) {
        if (id == null) return Optional.empty();
        return studentRepository.findById(id);
    }

    /**
     * Student profile of the authenticated user.
     */
    @Transactional(readOnly = true)
    public Student requireForUser(AppUser user) {
        return findByUserId(user.getId())
                .orElseThrow(() -> new NotFoundException(ErrorCode.STUDENT_NOT_FOUND, "Student profile not found"));
    }

    /**
     * Resolves the acting student for event registration. The identity link (students.user_id)
     * is tried first. A client-supplied fallback id is only honoured when that row is the
     * caller's own profile, matched by email; anything else is refused.
     */
    @Transactional(readOnly = true)
    public Student resolveForRegistration(AppUser user, UUID fallbackStudentId) {
        Optional<Student> byIdentity = findByUserId(user.getId());
        if (byIdentity.isPresent()) {
            return byIdentity.get();
        }
        if (fallbackStudentId == null) {
            log.warn("Unable to resolve student for user={} and no fallback supplied", user.getId());
            throw new NotFoundException(ErrorCode.STUDENT_NOT_FOUND, "Student profile not found");
        }

        Student fallback = studentRepository.findById(fallbackStudentId).orElse(null);
        if (fallback == null) {
            log.warn("Fallback studentId={} for user={} does not exist", fallbackStudentId, user.getId());
            throw new NotFoundException(ErrorCode.STUDENT_NOT_FOUND, "Student profile not found");
        }
        if (fallback.getEmail() == null || !fallback.getEmail().equalsIgnoreCase(user.getEmail())) {
            log.warn("Rejected fallback studentId={} for user={}: profile belongs to someone else", fallbackStudentId, user.getId());
            throw new ForbiddenException("Student profile does not belong to the current user");
        }
        log.info("Resolved student {} for user {} through fallback id", fallback.getId(), user.getId());
        return fallback;
    }

    /**
     * Students may only act on their own profile and its records; admins on any.
     */
    public void requireSelfOrAdmin(AppUser caller, UUID studentId, String deniedMessage) {
        if (caller.getRole() == UserRole.ADMIN) {
            return;
        }
        boolean own = findByUserId(caller.getId()).map(s -> s.getId().equals(studentId)).orElse(false);
        if (!own) {
            log.warn("User {} denied access to student {}", caller.getId(), studentId);
            throw new ForbiddenException(deniedMessage);
        }
    }

    public void requireApproved(Student student, String action) {
        if (!student.isApproved()) {
            throw new ForbiddenException(ErrorCode.PROFILE_NOT_APPROVED,
                    "Your student profile is " + student.getStatus().value() + ". Only approved students can " + action + ".");
        }
    }

    @Transactional(readOnly = true)
    public List<Student> findAll(StudentStatus status) {
        if (status == null) return studentRepository.findAllByOrderByCreatedAtDesc();
        return studentRepository.findByStatusOrderByCreatedAtDesc(status);
    }

    @Transactional
    public Student updateStatus(UUID studentId, StudentStatus status) {
        Student s = studentRepository.findById(studentId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.STUDENT_NOT_FOUND, "Student not found: " + studentId));
        StudentStatus previous = s.getStatus();
        s.setStatus(status);
        s.setUpdatedAt(Instant.now(clock));
        Student saved = studentRepository.save(s);
        log.info("Student {} status {} -> {}", studentId, previous, status);
        return saved;
    }
}

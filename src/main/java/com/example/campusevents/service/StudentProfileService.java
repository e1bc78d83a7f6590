package com.example.campusevents.service;

import com.example.campusevents.dto.StudentProfileUpdateRequest;
import com.example.campusevents.entities.AppUser;
import com.example.campusevents.entities.Certificate;
import com.example.campusevents.entities.OnDutyRequest;
import com.example.campusevents.entities.Student;
import com.example.campusevents.exception.ErrorCode;
import com.example.campusevents.exception.NotFoundException;
import com.example.campusevents.exception.ValidationException;
import com.example.campusevents.repository.AttendanceLogRepository;
import com.example.campusevents.repository.CertificateRepository;
import com.example.campusevents.repository.EventParticipantRepository;
import com.example.campusevents.repository.OnDutyAttendanceRepository;
import com.example.campusevents.repository.OnDutyRequestRepository;
import com.example.campusevents.repository.StudentRepository;
import com.example.campusevents.storage.FileStorageService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Self-service side of the student profile: viewing, editing, the profile photo, and removal
 * of a student together with everything recorded for them.
 */
@Service
@RequiredArgsConstructor
public class StudentProfileService {

    public static final String PROFILE_PHOTO_CATEGORY = "profile-photos";

    static final Set<String> PHOTO_TYPES = Set.of("image/jpeg", "image/jpg", "image/png", "image/gif", "image/webp");
    private static final long MAX_PHOTO_BYTES = 5L * 1024 * 1024;

    private final Logger log = LoggerFactory.getLogger(StudentProfileService.class);

    private final StudentRepository studentRepository;
    private final StudentService studentService;
    private final AppUserService appUserService;
    private final EventParticipantRepository participantRepository;
    private final AttendanceLogRepository attendanceLogRepository;
    private final OnDutyRequestRepository onDutyRequestRepository;
    private final OnDutyAttendanceRepository onDutyAttendanceRepository;
    private final CertificateRepository certificateRepository;
    private final FileStorageService fileStorageService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Student getProfile(AppUser caller, UUID studentId) {
        studentService.requireSelfOrAdmin(caller, studentId, "Unauthorized");
        return requireStudent(studentId);
    }

    @Transactional
    public Student updateProfile(AppUser caller, UUID studentId, StudentProfileUpdateRequest req) {
        studentService.requireSelfOrAdmin(caller, studentId, "Unauthorized");
        Student student = requireStudent(studentId);

        if (req.getName() != null) {
            if (req.getName().isBlank()) {
                throw new ValidationException("name cannot be blank");
            }
            student.setName(req.getName().trim());
        }
        if (req.getPhone() != null) student.setPhone(blankToNull(req.getPhone()));
        if (req.getCollege() != null) student.setCollege(blankToNull(req.getCollege()));
        if (req.getDepartment() != null) student.setDepartment(blankToNull(req.getDepartment()));
        if (req.getYear() != null) student.setYear(blankToNull(req.getYear()));
        if (req.getAddress() != null) student.setAddress(blankToNull(req.getAddress()));
        if (req.getDateOfBirth() != null) student.setDateOfBirth(req.getDateOfBirth());

        if (req.getPassword() != null && !req.getPassword().isBlank()) {
            appUserService.changePassword(student.getUserId(), req.getPassword());
        }
        student.setUpdatedAt(Instant.now(clock));
        Student saved = studentRepository.save(student);
        log.info("Student profile {} updated by user {}", studentId, caller.getId());
        return saved;
    }

    @Transactional
    public Student uploadProfilePhoto(AppUser caller, UUID studentId, MultipartFile photo) {
        if (photo == null || photo.isEmpty()) {
            throw new ValidationException("No file uploaded");
        }
        String type = photo.getContentType() == null ? "" : photo.getContentType().toLowerCase(Locale.ROOT);
        if (!PHOTO_TYPES.contains(type)) {
            throw new ValidationException("Invalid file type. Only JPEG, PNG, GIF, and WebP images are allowed.");
        }
        if (photo.getSize() > MAX_PHOTO_BYTES) {
            throw new ValidationException(ErrorCode.PHOTO_TOO_LARGE, "Profile photo exceeds maximum of 5MB");
        }
        studentService.requireSelfOrAdmin(caller, studentId, "Unauthorized");
        Student student = requireStudent(studentId);

        String previous = student.getProfilePhotoUrl();
        student.setProfilePhotoUrl(fileStorageService.store(photo, PROFILE_PHOTO_CATEGORY));
        student.setUpdatedAt(Instant.now(clock));
        Student saved = studentRepository.save(student);
        if (previous != null) {
            fileStorageService.delete(previous);
        }
        log.info("Profile photo of student {} replaced", studentId);
        return saved;
    }

    /**
     * Removes the student, their login and every participant row, attendance log, on-duty
     * request and certificate recorded for them. Stored files are deleted after the rows.
     */
    @Transactional
    public void deleteStudent(UUID studentId) {
        Student student = requireStudent(studentId);

        List<String> files = new ArrayList<>();
        if (student.getProfilePhotoUrl() != null) {
            files.add(student.getProfilePhotoUrl());
        }
        List<OnDutyRequest> requests = onDutyRequestRepository.findByStudentIdOrderByCreatedAtDesc(studentId);
        for (OnDutyRequest r : requests) {
            if (r.getDocumentUrl() != null) files.add(r.getDocumentUrl());
        }
        List<Certificate> certificates = certificateRepository.findByStudentIdOrderByUploadedAtDesc(studentId);
        for (Certificate c : certificates) {
            if (c.getFileUrl() != null) files.add(c.getFileUrl());
        }

        participantRepository.deleteByStudentId(studentId);
        attendanceLogRepository.deleteByStudentId(studentId);
        onDutyAttendanceRepository.deleteByStudentId(studentId);
        onDutyRequestRepository.deleteAll(requests);
        certificateRepository.deleteAll(certificates);
        studentRepository.delete(student);
        appUserService.deleteUser(student.getUserId());

        int removed = 0;
        for (String url : files) {
            if (fileStorageService.delete(url)) removed++;
        }
        log.info("Deleted student {} (user {}), {} of {} files removed", studentId, student.getUserId(), removed, files.size());
    }

    private Student requireStudent(UUID studentId) {
        return studentRepository.findById(studentId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.STUDENT_NOT_FOUND, "Student not found"));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}

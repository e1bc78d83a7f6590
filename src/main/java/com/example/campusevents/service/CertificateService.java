package com.example.campusevents.service;

import com.example.campusevents.dto.CertificateForm;
import com.example.campusevents.dto.CertificateGenerateRequest;
import com.example.campusevents.dto.CertificateStatusRequest;
import com.example.campusevents.dto.CertificateView;
import com.example.campusevents.entities.Admin;
import com.example.campusevents.entities.AppUser;
import com.example.campusevents.entities.Certificate;
import com.example.campusevents.entities.Event;
import com.example.campusevents.entities.Student;
import com.example.campusevents.enums.CertificateStatus;
import com.example.campusevents.enums.UserRole;
import com.example.campusevents.exception.ErrorCode;
import com.example.campusevents.exception.ForbiddenException;
import com.example.campusevents.exception.NotFoundException;
import com.example.campusevents.exception.ValidationException;
import com.example.campusevents.repository.AdminRepository;
import com.example.campusevents.repository.CertificateRepository;
import com.example.campusevents.repository.EventRepository;
import com.example.campusevents.repository.StudentRepository;
import com.example.campusevents.storage.FileStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Certificates students upload for review, and ones admins issue directly. Students work on
 * their own certificates only; admins on any, and only admins change the review status.
 */
@Service
public class CertificateService {

    public static final String CATEGORY = "certificates";

    private static final Logger log = LoggerFactory.getLogger(CertificateService.class);

    private final CertificateRepository certificateRepository;
    private final StudentRepository studentRepository;
    private final EventRepository eventRepository;
    private final AdminRepository adminRepository;
    private final StudentService studentService;
    private final FileStorageService fileStorageService;
    private final Clock clock;
    private final Set<String> allowedTypes;

    public CertificateService(CertificateRepository certificateRepository,
                              StudentRepository studentRepository,
                              EventRepository eventRepository,
                              AdminRepository adminRepository,
                              StudentService studentService,
                              FileStorageService fileStorageService,
                              Clock clock,
                              @Value("${app.certificates.allowed-types:image/jpeg,image/png,image/jpg,application/pdf}") String allowedTypes) {
        this.certificateRepository = certificateRepository;
        this.studentRepository = studentRepository;
        this.eventRepository = eventRepository;
        this.adminRepository = adminRepository;
        this.studentService = studentService;
        this.fileStorageService = fileStorageService;
        this.clock = clock;
        this.allowedTypes = Arrays.stream(allowedTypes.split(","))
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toSet());
    }

    @Transactional
    public CertificateView upload(AppUser user, CertificateForm form, MultipartFile file) {
        requireAllowedFile(file);
        if (isBlank(form.getTitle())) {
            throw new ValidationException("title is required");
        }
        Student student = studentService.requireForUser(user);

        Instant now = Instant.now(clock);
        Certificate certificate = Certificate.builder()
                .studentId(student.getId())
                .title(form.getTitle().trim())
                .category(blankToNull(form.getCategory()))
                .issueDate(parseDate(form.getIssueDate()))
                .description(blankToNull(form.getDescription()))
                .fileName(file.getOriginalFilename())
                .status(CertificateStatus.PENDING)
                .uploadedAt(now)
                .updatedAt(now)
                .build();
        certificate.setFileUrl(fileStorageService.store(file, CATEGORY));
        Certificate saved = certificateRepository.save(certificate);
        log.info("Certificate {} uploaded by student {}", saved.getId(), student.getId());
        return toView(saved, student, null);
    }

    @Transactional(readOnly = true)
    public List<CertificateView> findForStudent(AppUser caller, UUID studentId) {
        studentService.requireSelfOrAdmin(caller, studentId, "Unauthorized");
        return toViews(certificateRepository.findByStudentIdOrderByUploadedAtDesc(studentId));
    }

    @Transactional(readOnly = true)
    public List<CertificateView> findAll(CertificateStatus status, UUID studentId, UUID eventId) {
        Specification<Certificate> spec = Specification.where(null);
        if (status != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("status"), status));
        }
        if (studentId != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("studentId"), studentId));
        }
        if (eventId != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("eventId"), eventId));
        }
        return toViews(certificateRepository.findAll(spec, Sort.by(Sort.Direction.DESC, "uploadedAt")));
    }

    @Transactional(readOnly = true)
    public CertificateView get(AppUser caller, UUID id) {
        Certificate certificate = requireCertificate(id);
        studentService.requireSelfOrAdmin(caller, certificate.getStudentId(), "Not authorized to view this certificate");
        return toViews(List.of(certificate)).get(0);
    }

    /**
     * Admin review. Notes replace the remarks only when given.
     */
    @Transactional
    public CertificateView updateStatus(AppUser adminUser, UUID id, CertificateStatusRequest req) {
        CertificateStatus status = parseStatus(req.getStatus());
        Admin admin = requireAdmin(adminUser);
        Certificate certificate = requireCertificate(id);

        applyStatus(certificate, status, admin);
        if (req.getNotes() != null) {
            certificate.setRemarks(blankToNull(req.getNotes()));
        }
        certificate.setUpdatedAt(Instant.now(clock));
        Certificate saved = certificateRepository.save(certificate);
        log.info("Certificate {} marked {} by admin {}", id, status.getLabel(), admin.getId());
        return toViews(List.of(saved)).get(0);
    }

    /**
     * Issues an already approved certificate to a student, without a file.
     */
    @Transactional
    public CertificateView generate(AppUser adminUser, CertificateGenerateRequest req) {
        Admin admin = requireAdmin(adminUser);
        Student student = studentRepository.findById(req.getStudentId())
                .orElseThrow(() -> new NotFoundException(ErrorCode.STUDENT_NOT_FOUND, "Student not found"));
        if (req.getEventId() != null && !eventRepository.existsById(req.getEventId())) {
            throw new NotFoundException(ErrorCode.EVENT_NOT_FOUND, "Event not found");
        }

        Instant now = Instant.now(clock);
        Certificate certificate = Certificate.builder()
                .studentId(student.getId())
                .eventId(req.getEventId())
                .title(req.getTitle().trim())
                .certificateType(blankToNull(req.getCertificateType()))
                .issuedBy(blankToNull(req.getIssuedBy()))
                .issueDate(req.getIssuedDate() != null ? req.getIssuedDate() : LocalDate.ofInstant(now, ZoneOffset.UTC))
                .uploadedAt(now)
                .updatedAt(now)
                .build();
        applyStatus(certificate, CertificateStatus.APPROVED, admin);
        Certificate saved = certificateRepository.save(certificate);
        log.info("Certificate {} generated for student {} by admin {}", saved.getId(), student.getId(), admin.getId());
        return toViews(List.of(saved)).get(0);
    }

    /**
     * Edits metadata and optionally replaces the file. Status and remarks in the form are
     * ignored unless the caller is an admin.
     */
    @Transactional
    public CertificateView update(AppUser caller, UUID id, CertificateForm form, MultipartFile file) {
        Certificate certificate = requireCertificate(id);
        studentService.requireSelfOrAdmin(caller, certificate.getStudentId(), "Not authorized to update this certificate");
        boolean admin = caller.getRole() == UserRole.ADMIN;

        if (!isBlank(form.getTitle())) certificate.setTitle(form.getTitle().trim());
        if (form.getCategory() != null) certificate.setCategory(blankToNull(form.getCategory()));
        if (!isBlank(form.getIssueDate())) certificate.setIssueDate(parseDate(form.getIssueDate()));
        if (form.getDescription() != null) certificate.setDescription(blankToNull(form.getDescription()));

        if (admin && !isBlank(form.getStatus())) {
            applyStatus(certificate, parseStatus(form.getStatus()), requireAdmin(caller));
        }
        if (admin && form.getRemarks() != null) {
            certificate.setRemarks(blankToNull(form.getRemarks()));
        }

        String replaced = null;
        if (file != null && !file.isEmpty()) {
            requireAllowedFile(file);
            replaced = certificate.getFileUrl();
            certificate.setFileUrl(fileStorageService.store(file, CATEGORY));
            certificate.setFileName(file.getOriginalFilename());
        }
        certificate.setUpdatedAt(Instant.now(clock));
        Certificate saved = certificateRepository.save(certificate);
        if (replaced != null) {
            fileStorageService.delete(replaced);
        }
        log.info("Certificate {} updated by user {}", id, caller.getId());
        return toViews(List.of(saved)).get(0);
    }

    @Transactional
    public void delete(AppUser caller, UUID id) {
        Certificate certificate = requireCertificate(id);
        studentService.requireSelfOrAdmin(caller, certificate.getStudentId(), "Not authorized to delete this certificate");

        certificateRepository.delete(certificate);
        if (certificate.getFileUrl() != null && !fileStorageService.delete(certificate.getFileUrl())) {
            log.warn("File {} of certificate {} was not found on disk", certificate.getFileUrl(), id);
        }
        log.info("Certificate {} deleted by user {}", id, caller.getId());
    }

    private void applyStatus(Certificate certificate, CertificateStatus status, Admin admin) {
        certificate.setStatus(status);
        if (status == CertificateStatus.APPROVED) {
            certificate.setApprovedAt(Instant.now(clock));
            certificate.setApprovedBy(admin.getId());
        } else {
            certificate.setApprovedAt(null);
            certificate.setApprovedBy(null);
        }
    }

    private void requireAllowedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ValidationException("Please upload a file");
        }
        String type = file.getContentType() == null ? "" : file.getContentType().toLowerCase(Locale.ROOT);
        if (!allowedTypes.contains(type)) {
            throw new ValidationException("Invalid file type");
        }
    }

    private Admin requireAdmin(AppUser user) {
        return adminRepository.findByUserId(user.getId())
                .orElseThrow(() -> new ForbiddenException("Admin profile not found"));
    }

    private Certificate requireCertificate(UUID id) {
        return certificateRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Certificate not found"));
    }

    static CertificateStatus parseStatus(String raw) {
        CertificateStatus status;
        try {
            status = CertificateStatus.fromValue(raw);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException(ErrorCode.VALIDATION_FAILED, "Invalid status", ex);
        }
        if (status == null) {
            throw new ValidationException("Invalid status");
        }
        return status;
    }

    private static LocalDate parseDate(String raw) {
        if (isBlank(raw)) return null;
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException ex) {
            throw new ValidationException(ErrorCode.VALIDATION_FAILED, "issueDate must be a date (yyyy-MM-dd)", ex);
        }
    }

    private List<CertificateView> toViews(List<Certificate> certificates) {
        if (certificates.isEmpty()) return List.of();
        Map<UUID, Student> students = studentRepository.findByIdIn(certificates.stream()
                        .map(Certificate::getStudentId).collect(Collectors.toSet()))
                .stream().collect(Collectors.toMap(Student::getId, Function.identity()));
        Map<UUID, Event> events = eventRepository.findAllById(certificates.stream()
                        .map(Certificate::getEventId).filter(Objects::nonNull).collect(Collectors.toSet()))
                .stream().collect(Collectors.toMap(Event::getId, Function.identity()));
        List<CertificateView> out = new ArrayList<>(certificates.size());
        for (Certificate c : certificates) {
            out.add(toView(c, students.get(c.getStudentId()), c.getEventId() == null ? null : events.get(c.getEventId())));
        }
        return out;
    }

    static CertificateView toView(Certificate c, Student student, Event event) {
        CertificateView.CertificateViewBuilder b = CertificateView.builder()
                .id(c.getId())
                .studentId(c.getStudentId())
                .eventId(c.getEventId())
                .title(c.getTitle())
                .category(c.getCategory())
                .certificateType(c.getCertificateType())
                .issueDate(c.getIssueDate())
                .issuedBy(c.getIssuedBy())
                .description(c.getDescription())
                .fileName(c.getFileName())
                .fileUrl(c.getFileUrl())
                .status(c.getStatus())
                .remarks(c.getRemarks())
                .approvedAt(c.getApprovedAt())
                .approvedBy(c.getApprovedBy())
                .uploadedAt(c.getUploadedAt())
                .updatedAt(c.getUpdatedAt());
        if (student != null) {
            b.studentName(student.getName()).studentEmail(student.getEmail()).department(student.getDepartment());
        }
        if (event != null) {
            b.eventName(event.getName()).eventDate(event.getEventDate());
        }
        return b.build();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String blankToNull(String s) {
        return isBlank(s) ? null : s.trim();
    }
}

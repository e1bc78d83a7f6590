package com.example.campusevents.service;

import com.example.campusevents.dto.OnDutyAttendanceForm;
import com.example.campusevents.dto.OnDutyAttendanceView;
import com.example.campusevents.dto.OnDutyDecisionRequest;
import com.example.campusevents.dto.OnDutyRequestForm;
import com.example.campusevents.dto.OnDutyRequestView;
import com.example.campusevents.entities.Admin;
import com.example.campusevents.entities.AppUser;
import com.example.campusevents.entities.OnDutyAttendance;
import com.example.campusevents.entities.OnDutyRequest;
import com.example.campusevents.entities.Student;
import com.example.campusevents.enums.OnDutyStatus;
import com.example.campusevents.exception.ConflictException;
import com.example.campusevents.exception.ErrorCode;
import com.example.campusevents.exception.ForbiddenException;
import com.example.campusevents.exception.NotFoundException;
import com.example.campusevents.exception.StateException;
import com.example.campusevents.exception.ValidationException;
import com.example.campusevents.repository.AdminRepository;
import com.example.campusevents.repository.OnDutyAttendanceRepository;
import com.example.campusevents.repository.OnDutyRequestRepository;
import com.example.campusevents.repository.StudentRepository;
import com.example.campusevents.storage.FileStorageService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * On-duty leave: student requests, admin decisions and the per-day attendance marks taken
 * while the leave is running.
 */
@Service
@RequiredArgsConstructor
public class OnDutyService {

    public static final String DOCUMENT_CATEGORY = "onduty-documents";
    public static final String SELFIE_CATEGORY = "onduty-selfies";

    private static final BigDecimal MAX_LATITUDE = BigDecimal.valueOf(90);
    private static final BigDecimal MAX_LONGITUDE = BigDecimal.valueOf(180);

    private final Logger log = LoggerFactory.getLogger(OnDutyService.class);

    private final OnDutyRequestRepository requestRepository;
    private final OnDutyAttendanceRepository attendanceRepository;
    private final StudentRepository studentRepository;
    private final AdminRepository adminRepository;
    private final StudentService studentService;
    private final FileStorageService fileStorageService;
    private final Clock clock;

    @Transactional
    public OnDutyRequestView createRequest(AppUser user, OnDutyRequestForm form, MultipartFile document) {
        Student student = studentService.requireForUser(user);
        studentService.requireApproved(student, "submit on-duty requests");

        OnDutyRequest request = OnDutyRequest.builder()
                .studentId(student.getId())
                .status(OnDutyStatus.PENDING)
                .createdAt(Instant.now(clock))
                .updatedAt(Instant.now(clock))
                .build();
        applyForm(request, form, true);

        if (document != null && !document.isEmpty()) {
            request.setDocumentUrl(fileStorageService.store(document, DOCUMENT_CATEGORY));
        }
        OnDutyRequest saved = requestRepository.save(request);
        log.info("On-duty request {} submitted by student {} for {}..{}", saved.getId(), student.getId(),
                saved.getStartDate(), saved.getEndDate());
        return toView(saved, student, null);
    }

    /**
     * Edits an own request while it is still pending. Omitted fields keep their value; the
     * resulting window is validated again. A new document replaces the old one.
     */
    @Transactional
    public OnDutyRequestView updateRequest(AppUser user, UUID requestId, OnDutyRequestForm form, MultipartFile document) {
        Student student = studentService.requireForUser(user);
        OnDutyRequest request = requireOwn(requestId, student);
        requirePending(request, "updated");

        applyForm(request, form, false);
        if (document != null && !document.isEmpty()) {
            String previous = request.getDocumentUrl();
            request.setDocumentUrl(fileStorageService.store(document, DOCUMENT_CATEGORY));
            if (previous != null) {
                fileStorageService.delete(previous);
            }
        }
        request.setUpdatedAt(Instant.now(clock));
        OnDutyRequest saved = requestRepository.save(request);
        log.info("On-duty request {} updated by student {}", saved.getId(), student.getId());
        return toView(saved, student, null);
    }

    @Transactional
    public void deleteRequest(AppUser user, UUID requestId) {
        Student student = studentService.requireForUser(user);
        OnDutyRequest request = requireOwn(requestId, student);
        requirePending(request, "deleted");

        requestRepository.delete(request);
        if (request.getDocumentUrl() != null && !fileStorageService.delete(request.getDocumentUrl())) {
            log.warn("Document {} of on-duty request {} was not found on disk", request.getDocumentUrl(), requestId);
        }
        log.info("On-duty request {} deleted by student {}", requestId, student.getId());
    }

    @Transactional(readOnly = true)
    public List<OnDutyRequestView> findMyRequests(AppUser user) {
        Student student = studentService.requireForUser(user);
        return toViews(requestRepository.findByStudentIdOrderByCreatedAtDesc(student.getId()));
    }

    /**
     * Approved requests of the caller whose window contains today.
     */
    @Transactional(readOnly = true)
    public List<OnDutyRequestView> findActiveApproved(AppUser user) {
        Student student = studentService.requireForUser(user);
        LocalDate today = today();
        return toViews(requestRepository
                .findByStudentIdAndStatusAndStartDateLessThanEqualAndEndDateGreaterThanEqualOrderByStartDateDesc(
                        student.getId(), OnDutyStatus.APPROVED, today, today));
    }

    @Transactional(readOnly = true)
    public List<OnDutyAttendanceView> findMyAttendance(AppUser user) {
        Student student = studentService.requireForUser(user);
        return toAttendanceViews(attendanceRepository.findByStudentIdOrderByCheckInTimeDesc(student.getId()));
    }

    /**
     * Admin listing. {@code search} matches student name, email or registration number;
     * the date bounds select requests whose window overlaps [startDate, endDate].
     */
    @Transactional(readOnly = true)
    public List<OnDutyRequestView> findRequests(OnDutyStatus status, String search, LocalDate startDate, LocalDate endDate) {
        Specification<OnDutyRequest> spec = Specification.where(null);
        if (status != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("status"), status));
        }
        if (startDate != null) {
            spec = spec.and((root, q, cb) -> cb.greaterThanOrEqualTo(root.<LocalDate>get("endDate"), startDate));
        }
        if (endDate != null) {
            spec = spec.and((root, q, cb) -> cb.lessThanOrEqualTo(root.<LocalDate>get("startDate"), endDate));
        }
        if (search != null && !search.isBlank()) {
            String term = search.trim();
            Set<UUID> ids = studentRepository
                    .findByNameContainingIgnoreCaseOrEmailContainingIgnoreCaseOrRegistrationNumberContainingIgnoreCase(term, term, term)
                    .stream().map(Student::getId).collect(Collectors.toSet());
            if (ids.isEmpty()) {
                return List.of();
            }
            spec = spec.and((root, q, cb) -> root.get("studentId").in(ids));
        }
        return toViews(requestRepository.findAll(spec, Sort.by(Sort.Direction.DESC, "createdAt")));
    }

    /**
     * Approves or rejects a pending request. Decisions are final.
     */
    @Transactional
    public OnDutyRequestView decide(AppUser adminUser, UUID requestId, OnDutyDecisionRequest decision) {
        OnDutyStatus target = parseDecision(decision.getStatus());
        String reason = decision.getRejectionReason();
        if (target == OnDutyStatus.REJECTED && (reason == null || reason.isBlank())) {
            throw new ValidationException("Rejection reason is required when rejecting a request");
        }
        Admin admin = adminRepository.findByUserId(adminUser.getId())
                .orElseThrow(() -> new ForbiddenException("Admin profile not found"));

        OnDutyRequest request = requestRepository.findById(requestId)
                .orElseThrow(() -> new NotFoundException("On-duty request not found"));
        if (request.getStatus() != OnDutyStatus.PENDING) {
            throw new StateException("On-duty request is already " + request.getStatus().value());
        }

        request.setStatus(target);
        request.setApprovedBy(admin.getId());
        request.setRejectionReason(target == OnDutyStatus.REJECTED ? reason.trim() : null);
        request.setUpdatedAt(Instant.now(clock));
        OnDutyRequest saved = requestRepository.save(request);
        log.info("On-duty request {} {} by admin {}", requestId, target.value(), admin.getId());

        Student student = studentRepository.findById(saved.getStudentId()).orElse(null);
        return toView(saved, student, admin.getName());
    }

    @Transactional(readOnly = true)
    public List<OnDutyAttendanceView> findAttendance(UUID studentId, LocalDate startDate, LocalDate endDate) {
        Specification<OnDutyAttendance> spec = Specification.where(null);
        if (studentId != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("studentId"), studentId));
        }
        if (startDate != null) {
            spec = spec.and((root, q, cb) -> cb.greaterThanOrEqualTo(root.<LocalDate>get("checkInDate"), startDate));
        }
        if (endDate != null) {
            spec = spec.and((root, q, cb) -> cb.lessThanOrEqualTo(root.<LocalDate>get("checkInDate"), endDate));
        }
        return toAttendanceViews(attendanceRepository.findAll(spec, Sort.by(Sort.Direction.DESC, "checkInTime")));
    }

    /**
     * Records today's presence for an approved request. At most one mark per request and
     * calendar day: the request row is locked for the check and the table carries a unique
     * key on (request, student, day).
     */
    @Transactional
    public OnDutyAttendanceView markAttendance(AppUser user, OnDutyAttendanceForm form, MultipartFile selfie) {
        if (form.getOnDutyRequestId() == null || form.getLatitude() == null || form.getLongitude() == null) {
            throw new ValidationException("On-duty request ID, latitude, and longitude are required");
        }
        if (form.getLatitude().abs().compareTo(MAX_LATITUDE) > 0 || form.getLongitude().abs().compareTo(MAX_LONGITUDE) > 0) {
            throw new ValidationException("latitude/longitude out of range");
        }
        Student student = studentService.requireForUser(user);

        OnDutyRequest request = requestRepository.findByIdAndStudentIdForUpdate(form.getOnDutyRequestId(), student.getId())
                .orElseThrow(() -> new NotFoundException("On-duty request not found"));
        if (request.getStatus() != OnDutyStatus.APPROVED) {
            throw new StateException("On-duty request is not approved");
        }

        Instant now = Instant.now(clock);
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        if (!request.covers(today)) {
            throw new StateException("On-duty request is not valid for today");
        }
        if (attendanceRepository.existsByOnDutyRequestIdAndStudentIdAndCheckInDate(request.getId(), student.getId(), today)) {
            throw new ConflictException(ErrorCode.DUPLICATE_ATTENDANCE,
                    "Attendance already marked for this on-duty request today");
        }

        String selfieUrl = selfie != null && !selfie.isEmpty() ? fileStorageService.store(selfie, SELFIE_CATEGORY) : null;
        OnDutyAttendance attendance = OnDutyAttendance.builder()
                .onDutyRequestId(request.getId())
                .studentId(student.getId())
                .checkInTime(now)
                .checkInDate(today)
                .latitude(form.getLatitude())
                .longitude(form.getLongitude())
                .address(blankToNull(form.getAddress()))
                .selfiePhotoUrl(selfieUrl)
                .qrData(blankToNull(form.getQrData()))
                .createdAt(now)
                .build();
        try {
            attendance = attendanceRepository.saveAndFlush(attendance);
        } catch (DataIntegrityViolationException ex) {
            log.warn("Concurrent on-duty mark for request={} student={} day={}", request.getId(), student.getId(), today);
            throw new ConflictException(ErrorCode.DUPLICATE_ATTENDANCE,
                    "Attendance already marked for this on-duty request today", ex);
        }
        log.info("On-duty attendance {} marked request={} student={} day={}", attendance.getId(), request.getId(),
                student.getId(), today);
        return toAttendanceView(attendance, request, student);
    }

    private OnDutyRequest requireOwn(UUID requestId, Student student) {
        return requestRepository.findByIdAndStudentId(requestId, student.getId())
                .orElseThrow(() -> new NotFoundException("On-duty request not found"));
    }

    private void requirePending(OnDutyRequest request, String action) {
        if (request.getStatus() != OnDutyStatus.PENDING) {
            throw new StateException("Only pending requests can be " + action);
        }
    }

    /**
     * Copies form values onto the request and validates the resulting window against now.
     */
    void applyForm(OnDutyRequest request, OnDutyRequestForm form, boolean allRequired) {
        if (allRequired && (isBlank(form.getCollegeName()) || isBlank(form.getStartDate()) || isBlank(form.getStartTime())
                || isBlank(form.getEndDate()) || isBlank(form.getEndTime()) || isBlank(form.getReason()))) {
            throw new ValidationException("All fields are required");
        }
        if (!isBlank(form.getCollegeName())) request.setCollegeName(form.getCollegeName().trim());
        if (!isBlank(form.getReason())) request.setReason(form.getReason().trim());
        if (!isBlank(form.getStartDate())) request.setStartDate(parseDate(form.getStartDate(), "startDate"));
        if (!isBlank(form.getStartTime())) request.setStartTime(parseTime(form.getStartTime(), "startTime"));
        if (!isBlank(form.getEndDate())) request.setEndDate(parseDate(form.getEndDate(), "endDate"));
        if (!isBlank(form.getEndTime())) request.setEndTime(parseTime(form.getEndTime(), "endTime"));

        LocalDateTime now = LocalDateTime.ofInstant(Instant.now(clock), ZoneOffset.UTC);
        LocalDateTime start = LocalDateTime.of(request.getStartDate(), request.getStartTime());
        LocalDateTime end = LocalDateTime.of(request.getEndDate(), request.getEndTime());
        if (start.isBefore(now)) {
            throw new ValidationException("Start date/time cannot be in the past");
        }
        if (!end.isAfter(start)) {
            throw new ValidationException("End date/time must be after start date/time");
        }
        if (start.isAfter(now.plusYears(1))) {
            throw new ValidationException("On-duty requests cannot be more than one year in advance");
        }
    }

    private static OnDutyStatus parseDecision(String raw) {
        OnDutyStatus status;
        try {
            status = OnDutyStatus.fromValue(raw);
        } catch (IllegalArgumentException ex) {
            status = null;
        }
        if (status != OnDutyStatus.APPROVED && status != OnDutyStatus.REJECTED) {
            throw new ValidationException("status must be approved or rejected");
        }
        return status;
    }

    private static LocalDate parseDate(String raw, String field) {
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException ex) {
            throw new ValidationException(field + " must be a date (yyyy-MM-dd)");
        }
    }

    private static LocalTime parseTime(String raw, String field) {
        try {
            return LocalTime.parse(raw.trim());
        } catch (DateTimeParseException ex) {
            throw new ValidationException(field + " must be a time (HH:mm)");
        }
    }

    private LocalDate today() {
        return LocalDate.ofInstant(Instant.now(clock), ZoneOffset.UTC);
    }

    private List<OnDutyRequestView> toViews(List<OnDutyRequest> requests) {
        Map<UUID, Student> students = studentsById(requests.stream().map(OnDutyRequest::getStudentId).collect(Collectors.toSet()));
        Map<UUID, String> adminNames = adminRepository.findAllById(requests.stream()
                        .map(OnDutyRequest::getApprovedBy).filter(id -> id != null).collect(Collectors.toSet()))
                .stream().collect(Collectors.toMap(Admin::getId, Admin::getName));
        List<OnDutyRequestView> out = new ArrayList<>(requests.size());
        for (OnDutyRequest r : requests) {
            out.add(toView(r, students.get(r.getStudentId()), adminNames.get(r.getApprovedBy())));
        }
        return out;
    }

    private List<OnDutyAttendanceView> toAttendanceViews(List<OnDutyAttendance> rows) {
        Map<UUID, Student> students = studentsById(rows.stream().map(OnDutyAttendance::getStudentId).collect(Collectors.toSet()));
        Map<UUID, OnDutyRequest> requests = requestRepository.findAllById(rows.stream()
                        .map(OnDutyAttendance::getOnDutyRequestId).collect(Collectors.toSet()))
                .stream().collect(Collectors.toMap(OnDutyRequest::getId, Function.identity()));
        List<OnDutyAttendanceView> out = new ArrayList<>(rows.size());
        for (OnDutyAttendance a : rows) {
            out.add(toAttendanceView(a, requests.get(a.getOnDutyRequestId()), students.get(a.getStudentId())));
        }
        return out;
    }

    private Map<UUID, Student> studentsById(Collection<UUID> ids) {
        if (ids.isEmpty()) return Map.of();
        return studentRepository.findByIdIn(ids).stream().collect(Collectors.toMap(Student::getId, Function.identity()));
    }

    static OnDutyRequestView toView(OnDutyRequest r, Student student, String approvedByName) {
        OnDutyRequestView.OnDutyRequestViewBuilder b = OnDutyRequestView.builder()
                .id(r.getId())
                .studentId(r.getStudentId())
                .collegeName(r.getCollegeName())
                .startDate(r.getStartDate())
                .startTime(r.getStartTime())
                .endDate(r.getEndDate())
                .endTime(r.getEndTime())
                .reason(r.getReason())
                .documentUrl(r.getDocumentUrl())
                .status(r.getStatus())
                .approvedBy(r.getApprovedBy())
                .approvedByName(approvedByName)
                .rejectionReason(r.getRejectionReason())
                .createdAt(r.getCreatedAt())
                .updatedAt(r.getUpdatedAt());
        if (student != null) {
            b.studentName(student.getName())
                    .studentEmail(student.getEmail())
                    .registrationNumber(student.getRegistrationNumber())
                    .department(student.getDepartment())
                    .college(student.getCollege());
        }
        return b.build();
    }

    static OnDutyAttendanceView toAttendanceView(OnDutyAttendance a, OnDutyRequest request, Student student) {
        OnDutyAttendanceView.OnDutyAttendanceViewBuilder b = OnDutyAttendanceView.builder()
                .id(a.getId())
                .onDutyRequestId(a.getOnDutyRequestId())
                .studentId(a.getStudentId())
                .checkInTime(a.getCheckInTime())
                .checkInDate(a.getCheckInDate())
                .latitude(a.getLatitude())
                .longitude(a.getLongitude())
                .address(a.getAddress())
                .selfiePhotoUrl(a.getSelfiePhotoUrl())
                .qrData(a.getQrData());
        if (request != null) {
            b.collegeName(request.getCollegeName()).startDate(request.getStartDate()).endDate(request.getEndDate());
        }
        if (student != null) {
            b.studentName(student.getName()).studentEmail(student.getEmail()).registrationNumber(student.getRegistrationNumber());
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

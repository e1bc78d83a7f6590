package com.example.campusevents.service;

import com.example.campusevents.dto.StudentProfileUpdateRequest;
import com.example.campusevents.entities.AppUser;
import com.example.campusevents.entities.Certificate;
import com.example.campusevents.entities.OnDutyRequest;
import com.example.campusevents.entities.Student;
import com.example.campusevents.enums.StudentStatus;
import com.example.campusevents.enums.UserRole;
import com.example.campusevents.exception.ErrorCode;
import com.example.campusevents.exception.ForbiddenException;
import com.example.campusevents.exception.NotFoundException;
import com.example.campusevents.exception.ValidationException;
import com.example.campusevents.repository.AttendanceLogRepository;
import com.example.campusevents.repository.CertificateRepository;
import com.example.campusevents.repository.EventParticipantRepository;
import com.example.campusevents.repository.OnDutyAttendanceRepository;
import com.example.campusevents.repository.OnDutyRequestRepository;
import com.example.campusevents.repository.StudentRepository;
import com.example.campusevents.storage.FileStorageService;
import com.example.campusevents.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StudentProfileService Unit Tests")
class StudentProfileServiceTest {

    @Mock
    private StudentRepository studentRepository;

    @Mock
    private StudentService studentService;

    @Mock
    private AppUserService appUserService;

    @Mock
    private EventParticipantRepository participantRepository;

    @Mock
    private AttendanceLogRepository attendanceLogRepository;

    @Mock
    private OnDutyRequestRepository onDutyRequestRepository;

    @Mock
    private OnDutyAttendanceRepository onDutyAttendanceRepository;

    @Mock
    private CertificateRepository certificateRepository;

    @Mock
    private FileStorageService fileStorageService;

    private final MutableClock clock = MutableClock.at("2025-05-20T12:00:00Z");

    private StudentProfileService service;
    private AppUser user;
    private Student student;

    @BeforeEach
    void setUp() {
        service = new StudentProfileService(studentRepository, studentService, appUserService, participantRepository,
                attendanceLogRepository, onDutyRequestRepository, onDutyAttendanceRepository, certificateRepository,
                fileStorageService, clock);
        user = AppUser.builder().id(UUID.randomUUID()).email("kiran@campus.edu").role(UserRole.STUDENT).build();
        student = Student.builder()
                .id(UUID.randomUUID())
                .userId(user.getId())
                .name("Kiran")
                .email("kiran@campus.edu")
                .department("ECE")
                .status(StudentStatus.APPROVED)
                .build();
    }

    @Nested
    @DisplayName("Viewing and editing")
    class ViewAndEdit {

        @Test
        void ownProfile() {
            when(studentRepository.findById(student.getId())).thenReturn(Optional.of(student));

            assertThat(service.getProfile(user, student.getId())).isSameAs(student);
            verify(studentService).requireSelfOrAdmin(user, student.getId(), "Unauthorized");
        }

        @Test
        @DisplayName("Should refuse another student's profile before loading it")
        void foreignProfile() {
            UUID other = UUID.randomUUID();
            doThrow(new ForbiddenException("Unauthorized")).when(studentService).requireSelfOrAdmin(user, other, "Unauthorized");

            assertThatThrownBy(() -> service.getProfile(user, other))
                    .isInstanceOf(ForbiddenException.class);
            verifyNoInteractions(studentRepository);
        }

        @Test
        void missingProfile() {
            UUID missing = UUID.randomUUID();
            AppUser admin = AppUser.builder().id(UUID.randomUUID()).role(UserRole.ADMIN).build();
            when(studentRepository.findById(missing)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.getProfile(admin, missing))
                    .isInstanceOf(NotFoundException.class)
                    .extracting("code").isEqualTo(ErrorCode.STUDENT_NOT_FOUND);
        }

        @Test
        @DisplayName("Should apply only the fields present and change the password through the login")
        void partialUpdate() {
            // Given
            when(studentRepository.findById(student.getId())).thenReturn(Optional.of(student));
            when(studentRepository.save(student)).thenReturn(student);
            StudentProfileUpdateRequest req = new StudentProfileUpdateRequest();
            req.setPhone(" 9876543210 ");
            req.setAddress("");
            req.setDateOfBirth(LocalDate.parse("2004-08-12"));
            req.setPassword("new-secret");

            // When
            Student saved = service.updateProfile(user, student.getId(), req);

            // Then
            assertThat(saved.getName()).isEqualTo("Kiran");
            assertThat(saved.getDepartment()).isEqualTo("ECE");
            assertThat(saved.getPhone()).isEqualTo("9876543210");
            assertThat(saved.getAddress()).isNull();
            assertThat(saved.getDateOfBirth()).isEqualTo(LocalDate.parse("2004-08-12"));
            assertThat(saved.getUpdatedAt()).isEqualTo(clock.instant());
            verify(appUserService).changePassword(user.getId(), "new-secret");
        }

        @Test
        void blankName() {
            when(studentRepository.findById(student.getId())).thenReturn(Optional.of(student));
            StudentProfileUpdateRequest req = new StudentProfileUpdateRequest();
            req.setName("   ");

            assertThatThrownBy(() -> service.updateProfile(user, student.getId(), req))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("name cannot be blank");
            verify(studentRepository, never()).save(any(Student.class));
        }
    }

    @Nested
    @DisplayName("Profile photo")
    class ProfilePhoto {

        @Test
        @DisplayName("Should replace the previous photo and delete its file")
        void replaces() {
            // Given
            student.setProfilePhotoUrl("/uploads/profile-photos/old.png");
            MockMultipartFile photo = new MockMultipartFile("profilePhoto", "me.png", "image/png", new byte[]{1, 2, 3});
            when(studentRepository.findById(student.getId())).thenReturn(Optional.of(student));
            when(fileStorageService.store(photo, StudentProfileService.PROFILE_PHOTO_CATEGORY))
                    .thenReturn("/uploads/profile-photos/new.png");
            when(studentRepository.save(student)).thenReturn(student);

            // When
            Student saved = service.uploadProfilePhoto(user, student.getId(), photo);

            // Then
            assertThat(saved.getProfilePhotoUrl()).isEqualTo("/uploads/profile-photos/new.png");
            verify(fileStorageService).delete("/uploads/profile-photos/old.png");
        }

        @Test
        void missingFile() {
            assertThatThrownBy(() -> service.uploadProfilePhoto(user, student.getId(), null))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("No file uploaded");
        }

        @Test
        @DisplayName("Should refuse a non-image upload")
        void notAnImage() {
            MockMultipartFile pdf = new MockMultipartFile("profilePhoto", "me.pdf", "application/pdf", new byte[]{1});

            assertThatThrownBy(() -> service.uploadProfilePhoto(user, student.getId(), pdf))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageStartingWith("Invalid file type");
            verifyNoInteractions(fileStorageService, studentRepository);
        }

        @Test
        void tooLarge() {
            MockMultipartFile big = new MockMultipartFile("profilePhoto", "me.jpg", "image/jpeg", new byte[5 * 1024 * 1024 + 1]);

            assertThatThrownBy(() -> service.uploadProfilePhoto(user, student.getId(), big))
                    .isInstanceOf(ValidationException.class)
                    .extracting("code").isEqualTo(ErrorCode.PHOTO_TOO_LARGE);
            verifyNoInteractions(fileStorageService);
        }
    }

    @Nested
    @DisplayName("Deleting a student")
    class Delete {

        @Test
        @DisplayName("Should remove dependent rows, the student and the login, then the stored files")
        void cascades() {
            // Given
            student.setProfilePhotoUrl("/uploads/profile-photos/me.png");
            OnDutyRequest request = OnDutyRequest.builder().id(UUID.randomUUID()).studentId(student.getId())
                    .documentUrl("/uploads/od-documents/letter.pdf").build();
            Certificate certificate = Certificate.builder().id(UUID.randomUUID()).studentId(student.getId())
                    .title("Quiz winner").fileUrl("/uploads/certificates/quiz.pdf").build();
            List<OnDutyRequest> requests = List.of(request);
            List<Certificate> certificates = List.of(certificate);
            when(studentRepository.findById(student.getId())).thenReturn(Optional.of(student));
            when(onDutyRequestRepository.findByStudentIdOrderByCreatedAtDesc(student.getId())).thenReturn(requests);
            when(certificateRepository.findByStudentIdOrderByUploadedAtDesc(student.getId())).thenReturn(certificates);
            when(fileStorageService.delete(anyString())).thenReturn(true);

            // When
            service.deleteStudent(student.getId());

            // Then
            InOrder order = inOrder(participantRepository, attendanceLogRepository, onDutyAttendanceRepository,
                    onDutyRequestRepository, certificateRepository, studentRepository, appUserService, fileStorageService);
            order.verify(participantRepository).deleteByStudentId(student.getId());
            order.verify(attendanceLogRepository).deleteByStudentId(student.getId());
            order.verify(onDutyAttendanceRepository).deleteByStudentId(student.getId());
            order.verify(onDutyRequestRepository).deleteAll(requests);
            order.verify(certificateRepository).deleteAll(certificates);
            order.verify(studentRepository).delete(student);
            order.verify(appUserService).deleteUser(user.getId());
            order.verify(fileStorageService).delete("/uploads/profile-photos/me.png");
            order.verify(fileStorageService).delete("/uploads/od-documents/letter.pdf");
            order.verify(fileStorageService).delete("/uploads/certificates/quiz.pdf");
        }

        @Test
        void unknownStudent() {
            UUID missing = UUID.randomUUID();
            when(studentRepository.findById(missing)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.deleteStudent(missing))
                    .isInstanceOf(NotFoundException.class);
            verifyNoInteractions(participantRepository, appUserService, fileStorageService);
        }
    }
}

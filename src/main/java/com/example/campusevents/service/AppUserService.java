package com.example.campusevents.service;

import com.example.campusevents.dto.SignupRequest;
import com.example.campusevents.entities.Admin;
import com.example.campusevents.entities.AppUser;
import com.example.campusevents.entities.Student;
import com.example.campusevents.enums.StudentStatus;
import com.example.campusevents.enums.UserRole;
import com.example.campusevents.exception.ConflictException;
import com.example.campusevents.exception.ErrorCode;
import com.example.campusevents.exception.NotFoundException;
import com.example.campusevents.repository.AdminRepository;
import com.example.campusevents.repository.AppUserRepository;
import com.example.campusevents.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class AppUserService implements UserDetailsService {

    private final Logger log = LoggerFactory.getLogger(AppUserService.class);

    private final AppUserRepository userRepo;
    private final StudentRepository studentRepo;
    private final AdminRepository adminRepo;
    private final PasswordEncoder passwordEncoder;

    @Override
    @Transactional(readOnly = true)
    public AppUser loadUserByUsername(String email) throws UsernameNotFoundException {
        return userRepo.findByEmailIgnoreCase(email).orElseThrow(() -> new UsernameNotFoundException("Not found"));
    }

    @Transactional(readOnly = true)
    public Optional<AppUser> findById(UUID id) {
        return userRepo.findById(id);
    }

    /**
     * Signs up a student: a STUDENT login plus a pending profile awaiting admin approval.
     */
    @Transactional
    public Student registerStudent(SignupRequest req) {
        String email = req.getEmail().trim().toLowerCase();
        if (userRepo.existsByEmailIgnoreCase(email) || studentRepo.existsByEmailIgnoreCase(email)) {
            throw new ConflictException(ErrorCode.DUPLICATE_ACCOUNT, "Email already registered: " + email);
        }
        if (req.getRegistrationNumber() != null && studentRepo.existsByRegistrationNumber(req.getRegistrationNumber())) {
            throw new ConflictException(ErrorCode.DUPLICATE_ACCOUNT, "Registration number already registered");
        }

        AppUser user = AppUser.builder()
                .email(email)
                .password(passwordEncoder.encode(req.getPassword()))
                .role(UserRole.STUDENT)
                .build();
        try {
            user = userRepo.saveAndFlush(user);
            Student student = Student.builder()
                    .userId(user.getId())
                    .name(req.getName().trim())
                    .email(email)
                    .phone(req.getPhone())
                    .college(req.getCollege())
                    .department(req.getDepartment())
                    .year(req.getYear())
                    .registrationNumber(req.getRegistrationNumber())
                    .status(StudentStatus.PENDING)
                    .build();
            Student saved = studentRepo.saveAndFlush(student);
            log.info("Registered student id={} user={} email={}", saved.getId(), user.getId(), email);
            return saved;
        } catch (DataIntegrityViolationException ex) {
            // unique constraint lost a race with a concurrent signup
            throw new ConflictException(ErrorCode.DUPLICATE_ACCOUNT, "Email or registration number already registered", ex);
        }
    }

    /**
     * Creates an admin login with its profile unless the email is already taken.
     */
    @Transactional
    public AppUser createAdminIfMissing(String email, String rawPassword, String name) {
        Optional<AppUser> existing = userRepo.findByEmailIgnoreCase(email);
        if (existing.isPresent()) {
            return existing.get();
        }
        AppUser admin = userRepo.saveAndFlush(AppUser.builder()
                .email(email.trim().toLowerCase())
                .password(passwordEncoder.encode(rawPassword))
                .role(UserRole.ADMIN)
                .build());
        adminRepo.save(Admin.builder().userId(admin.getId()).name(name).build());
        log.info("Created admin user id={} email={}", admin.getId(), admin.getEmail());
        return admin;
    }

    @Transactional(readOnly = true)
    public Optional<Admin> findAdminProfile(UUID userId) {
        return adminRepo.findByUserId(userId);
    }

    @Transactional
    public void changePassword(UUID userId, String rawPassword) {
        AppUser user = userRepo.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found"));
        user.setPassword(passwordEncoder.encode(rawPassword));
        userRepo.save(user);
        log.info("Password changed for user={}", userId);
    }

    @Transactional
    public void deleteUser(UUID userId) {
        userRepo.deleteById(userId);
        log.info("Deleted user={}", userId);
    }
}

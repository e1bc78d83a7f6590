package com.example.campusevents.controller;

import com.example.campusevents.dto.ApiResponse;
import com.example.campusevents.dto.AuthResponse;
import com.example.campusevents.dto.LoginRequest;
import com.example.campusevents.dto.SignupRequest;
import com.example.campusevents.entities.AppUser;
import com.example.campusevents.entities.Student;
import com.example.campusevents.enums.UserRole;
import com.example.campusevents.security.JwtTokenProvider;
import com.example.campusevents.service.AppUserService;
import com.example.campusevents.service.StudentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.AuthenticationProvider;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthController {

    private final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final AppUserService appUserService;
    private final StudentService studentService;
    private final AuthenticationProvider authProvider;
    private final JwtTokenProvider tokenProvider;

    /**
     * Student sign-up. The profile starts pending until an admin approves it.
     */
    @PostMapping("/register")
    public ResponseEntity<ApiResponse<AuthResponse>> register(@Valid @RequestBody SignupRequest req) {
        Student student = appUserService.registerStudent(req);
        AppUser user = appUserService.findById(student.getUserId()).orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(describe(user, tokenProvider.createToken(user)),
                        "Registration successful. Your profile is pending approval."));
    }

    @PostMapping("/login")
    public ApiResponse<AuthResponse> login(@Valid @RequestBody LoginRequest req) {
        Authentication auth;
        try {
            auth = authProvider.authenticate(
                    new UsernamePasswordAuthenticationToken(req.getEmail().trim(), req.getPassword()));
        } catch (AuthenticationException ex) {
            log.info("Failed login for email={}", req.getEmail());
            throw ex;
        }
        AppUser user = (AppUser) auth.getPrincipal();
        log.info("User {} logged in role={}", user.getId(), user.getRole());
        return ApiResponse.ok(describe(user, tokenProvider.createToken(user)), "Login successful");
    }

    @GetMapping("/me")
    public ApiResponse<AuthResponse> me(@AuthenticationPrincipal AppUser user) {
        return ApiResponse.ok(describe(user, null));
    }

    private AuthResponse describe(AppUser user, String token) {
        AuthResponse.AuthResponseBuilder b = AuthResponse.builder()
                .token(token)
                .userId(user.getId())
                .email(user.getEmail())
                .role(user.getRole().name().toLowerCase());
        if (user.getRole() == UserRole.STUDENT) {
            studentService.findByUserId(user.getId()).ifPresent(s ->
                    b.profileId(s.getId()).name(s.getName()).profileStatus(s.getStatus().value()));
        } else {
            appUserService.findAdminProfile(user.getId()).ifPresent(a ->
                    b.profileId(a.getId()).name(a.getName()));
        }
        return b.build();
    }
}

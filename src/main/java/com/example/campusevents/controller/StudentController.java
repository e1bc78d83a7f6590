package com.example.campusevents.controller;

import com.example.campusevents.dto.ApiResponse;
import com.example.campusevents.dto.StudentProfileUpdateRequest;
import com.example.campusevents.entities.AppUser;
import com.example.campusevents.entities.Student;
import com.example.campusevents.service.StudentProfileService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/students")
public class StudentController {

    private final StudentProfileService profileService;

    @GetMapping("/{id}")
    public ApiResponse<Student> get(@PathVariable UUID id, @AuthenticationPrincipal AppUser user) {
        return ApiResponse.ok(profileService.getProfile(user, id));
    }

    @PutMapping("/{id}")
    public ApiResponse<Student> update(@PathVariable UUID id,
                                       @Valid @RequestBody StudentProfileUpdateRequest req,
                                       @AuthenticationPrincipal AppUser user) {
        return ApiResponse.ok(profileService.updateProfile(user, id, req), "Profile updated successfully");
    }

    @PostMapping(value = "/{id}/profile-photo", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ApiResponse<Student> uploadPhoto(@PathVariable UUID id,
                                            @RequestPart(value = "profilePhoto", required = false) MultipartFile profilePhoto,
                                            @AuthenticationPrincipal AppUser user) {
        return ApiResponse.ok(profileService.uploadProfilePhoto(user, id, profilePhoto), "Profile photo uploaded successfully");
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(@PathVariable UUID id) {
        profileService.deleteStudent(id);
        return ApiResponse.message("Student deleted successfully");
    }
}

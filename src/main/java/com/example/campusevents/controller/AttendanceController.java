package com.example.campusevents.controller;

import com.example.campusevents.dto.ApiResponse;
import com.example.campusevents.dto.AttendanceLogView;
import com.example.campusevents.dto.CheckInRequest;
import com.example.campusevents.dto.CheckInResult;
import com.example.campusevents.dto.ParticipantUpdateRequest;
import com.example.campusevents.dto.ParticipantView;
import com.example.campusevents.dto.PhotoUploadRequest;
import com.example.campusevents.entities.AppUser;
import com.example.campusevents.entities.EventParticipant;
import com.example.campusevents.service.AttendanceService;
import com.example.campusevents.service.EventService;
import com.example.campusevents.service.PhotoProofService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/attendance")
public class AttendanceController {

    private final AttendanceService attendanceService;
    private final PhotoProofService photoProofService;
    private final EventService eventService;

    @PostMapping("/checkin")
    public ApiResponse<CheckInResult> checkIn(@Valid @RequestBody CheckInRequest req, @AuthenticationPrincipal AppUser user) {
        CheckInResult result = attendanceService.checkIn(user, req);
        return ApiResponse.ok(result, "Attendance marked as " + result.getStatus().value());
    }

    @PostMapping("/upload-photo")
    public ApiResponse<AttendanceLogView> uploadPhoto(@RequestBody PhotoUploadRequest req, @AuthenticationPrincipal AppUser user) {
        return ApiResponse.ok(photoProofService.uploadPhoto(user, req), "Photo proof uploaded successfully");
    }

    @GetMapping("/event/{eventId}")
    public ApiResponse<List<ParticipantView>> eventAttendance(@PathVariable UUID eventId) {
        return ApiResponse.ok(eventService.findParticipants(eventId));
    }

    @PutMapping("/participant/{participantId}")
    public ApiResponse<EventParticipant> updateParticipant(@PathVariable UUID participantId,
                                                           @RequestBody ParticipantUpdateRequest req) {
        return ApiResponse.ok(attendanceService.updateParticipant(participantId, req), "Participant updated");
    }

    @GetMapping("/student/{studentId}")
    public ApiResponse<List<AttendanceLogView>> history(@PathVariable UUID studentId, @AuthenticationPrincipal AppUser user) {
        return ApiResponse.ok(attendanceService.findHistory(studentId, user));
    }
}

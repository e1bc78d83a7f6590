package com.example.campusevents.controller;

import com.example.campusevents.dto.ApiResponse;
import com.example.campusevents.dto.OnDutyAttendanceForm;
import com.example.campusevents.dto.OnDutyAttendanceView;
import com.example.campusevents.dto.OnDutyDecisionRequest;
import com.example.campusevents.dto.OnDutyRequestForm;
import com.example.campusevents.dto.OnDutyRequestView;
import com.example.campusevents.entities.AppUser;
import com.example.campusevents.enums.OnDutyStatus;
import com.example.campusevents.service.OnDutyService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/onduty")
public class OnDutyController {

    private final OnDutyService onDutyService;

    @PostMapping(value = "/request", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<OnDutyRequestView>> create(@ModelAttribute OnDutyRequestForm form,
                                                                 @RequestPart(value = "document", required = false) MultipartFile document,
                                                                 @AuthenticationPrincipal AppUser user) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(onDutyService.createRequest(user, form, document), "On-duty request submitted successfully"));
    }

    @PutMapping(value = "/request/{id}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ApiResponse<OnDutyRequestView> update(@PathVariable UUID id,
                                                 @ModelAttribute OnDutyRequestForm form,
                                                 @RequestPart(value = "document", required = false) MultipartFile document,
                                                 @AuthenticationPrincipal AppUser user) {
        return ApiResponse.ok(onDutyService.updateRequest(user, id, form, document), "On-duty request updated successfully");
    }

    @DeleteMapping("/request/{id}")
    public ApiResponse<Void> delete(@PathVariable UUID id, @AuthenticationPrincipal AppUser user) {
        onDutyService.deleteRequest(user, id);
        return ApiResponse.message("On-duty request deleted successfully");
    }

    @GetMapping("/my-requests")
    public ApiResponse<List<OnDutyRequestView>> myRequests(@AuthenticationPrincipal AppUser user) {
        return ApiResponse.ok(onDutyService.findMyRequests(user));
    }

    @GetMapping("/approved")
    public ApiResponse<List<OnDutyRequestView>> approved(@AuthenticationPrincipal AppUser user) {
        return ApiResponse.ok(onDutyService.findActiveApproved(user));
    }

    @GetMapping("/attendance-history")
    public ApiResponse<List<OnDutyAttendanceView>> attendanceHistory(@AuthenticationPrincipal AppUser user) {
        return ApiResponse.ok(onDutyService.findMyAttendance(user));
    }

    @PostMapping(value = "/attendance", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<OnDutyAttendanceView>> markAttendance(@ModelAttribute OnDutyAttendanceForm form,
                                                                            @RequestPart(value = "selfie", required = false) MultipartFile selfie,
                                                                            @AuthenticationPrincipal AppUser user) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(onDutyService.markAttendance(user, form, selfie), "On-duty attendance marked successfully"));
    }

    @GetMapping("/admin/requests")
    public ApiResponse<List<OnDutyRequestView>> adminRequests(@RequestParam(required = false) OnDutyStatus status,
                                                              @RequestParam(required = false) String search,
                                                              @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                                                              @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return ApiResponse.ok(onDutyService.findRequests(status, search, startDate, endDate));
    }

    @PutMapping("/admin/requests/{id}")
    public ApiResponse<OnDutyRequestView> decide(@PathVariable UUID id,
                                                 @RequestBody OnDutyDecisionRequest req,
                                                 @AuthenticationPrincipal AppUser user) {
        OnDutyRequestView view = onDutyService.decide(user, id, req);
        return ApiResponse.ok(view, "On-duty request " + view.getStatus().value() + " successfully");
    }

    @GetMapping("/admin/attendance")
    public ApiResponse<List<OnDutyAttendanceView>> adminAttendance(@RequestParam(required = false) UUID studentId,
                                                                   @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                                                                   @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return ApiResponse.ok(onDutyService.findAttendance(studentId, startDate, endDate));
    }
}

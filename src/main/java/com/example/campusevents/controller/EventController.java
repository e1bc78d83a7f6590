package com.example.campusevents.controller;

import com.example.campusevents.dto.ApiResponse;
import com.example.campusevents.dto.EventRequest;
import com.example.campusevents.dto.EventView;
import com.example.campusevents.dto.ParticipantView;
import com.example.campusevents.dto.RegisterEventRequest;
import com.example.campusevents.dto.RegistrationResult;
import com.example.campusevents.entities.Admin;
import com.example.campusevents.entities.AppUser;
import com.example.campusevents.enums.EventStatus;
import com.example.campusevents.exception.ValidationException;
import com.example.campusevents.service.AppUserService;
import com.example.campusevents.service.EventRegistrationService;
import com.example.campusevents.service.EventService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/events")
public class EventController {

    private final EventService eventService;
    private final EventRegistrationService registrationService;
    private final AppUserService appUserService;

    @GetMapping
    public ApiResponse<List<EventView>> list(@RequestParam(required = false) String status,
                                             @RequestParam(required = false) String category,
                                             @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
                                             @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate,
                                             @AuthenticationPrincipal AppUser user) {
        return ApiResponse.ok(eventService.findEvents(parseStatus(status), category, fromDate, toDate, user));
    }

    @GetMapping("/{id}")
    public ApiResponse<EventView> get(@PathVariable UUID id, @AuthenticationPrincipal AppUser user) {
        return ApiResponse.ok(eventService.getEvent(id, user));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<EventView>> create(@Valid @RequestBody EventRequest req,
                                                         @AuthenticationPrincipal AppUser user) {
        UUID adminId = appUserService.findAdminProfile(user.getId()).map(Admin::getId).orElse(null);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(eventService.createEvent(req, adminId), "Event created successfully"));
    }

    @PutMapping("/{id}")
    public ApiResponse<EventView> update(@PathVariable UUID id, @Valid @RequestBody EventRequest req) {
        return ApiResponse.ok(eventService.updateEvent(id, req), "Event updated successfully");
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(@PathVariable UUID id) {
        eventService.deleteEvent(id);
        return ApiResponse.message("Event deleted successfully");
    }

    /**
     * The QR payload; rendering it as an image is left to the client.
     */
    @GetMapping("/{id}/qr")
    public ApiResponse<Map<String, String>> qr(@PathVariable UUID id) {
        return ApiResponse.ok(Map.of("qrData", eventService.getQrData(id)));
    }

    @GetMapping("/{id}/participants")
    public ApiResponse<List<ParticipantView>> participants(@PathVariable UUID id) {
        return ApiResponse.ok(eventService.findParticipants(id));
    }

    @PostMapping("/{id}/register")
    public ResponseEntity<ApiResponse<RegistrationResult>> register(@PathVariable UUID id,
                                                                    @RequestBody(required = false) RegisterEventRequest req,
                                                                    @AuthenticationPrincipal AppUser user) {
        RegistrationResult result = registrationService.register(id, user, req == null ? null : req.getStudentId());
        return ResponseEntity.status(result.isCreated() ? HttpStatus.CREATED : HttpStatus.OK)
                .body(ApiResponse.ok(result, result.getMessage()));
    }

    private static EventStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return EventStatus.fromValue(raw);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("Unknown event status: " + raw);
        }
    }
}

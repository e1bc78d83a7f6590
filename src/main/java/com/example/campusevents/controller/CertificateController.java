package com.example.campusevents.controller;

import com.example.campusevents.dto.ApiResponse;
import com.example.campusevents.dto.CertificateForm;
import com.example.campusevents.dto.CertificateGenerateRequest;
import com.example.campusevents.dto.CertificateStatusRequest;
import com.example.campusevents.dto.CertificateView;
import com.example.campusevents.entities.AppUser;
import com.example.campusevents.enums.CertificateStatus;
import com.example.campusevents.service.CertificateService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
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

import java.util.List;
import java.util.Locale;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/certificates")
public class CertificateController {

    private final CertificateService certificateService;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<CertificateView>> upload(@ModelAttribute CertificateForm form,
                                                               @RequestPart(value = "certificate", required = false) MultipartFile file,
                                                               @AuthenticationPrincipal AppUser user) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(certificateService.upload(user, form, file), "Certificate uploaded successfully"));
    }

    @GetMapping("/student/{studentId}")
    public ApiResponse<List<CertificateView>> forStudent(@PathVariable UUID studentId, @AuthenticationPrincipal AppUser user) {
        return ApiResponse.ok(certificateService.findForStudent(user, studentId));
    }

    @GetMapping
    public ApiResponse<List<CertificateView>> list(@RequestParam(required = false) CertificateStatus status,
                                                   @RequestParam(required = false) UUID studentId,
                                                   @RequestParam(required = false) UUID eventId) {
        return ApiResponse.ok(certificateService.findAll(status, studentId, eventId));
    }

    @PutMapping("/{id}/status")
    public ApiResponse<CertificateView> updateStatus(@PathVariable UUID id,
                                                     @Valid @RequestBody CertificateStatusRequest req,
                                                     @AuthenticationPrincipal AppUser user) {
        CertificateView view = certificateService.updateStatus(user, id, req);
        return ApiResponse.ok(view, "Certificate " + view.getStatus().getLabel().toLowerCase(Locale.ROOT) + " successfully");
    }

    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<CertificateView>> generate(@Valid @RequestBody CertificateGenerateRequest req,
                                                                 @AuthenticationPrincipal AppUser user) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(certificateService.generate(user, req), "Certificate generated successfully"));
    }

    @GetMapping("/{id}")
    public ApiResponse<CertificateView> get(@PathVariable UUID id, @AuthenticationPrincipal AppUser user) {
        return ApiResponse.ok(certificateService.get(user, id));
    }

    @PutMapping(value = "/{id}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ApiResponse<CertificateView> update(@PathVariable UUID id,
                                               @ModelAttribute CertificateForm form,
                                               @RequestPart(value = "certificate", required = false) MultipartFile file,
                                               @AuthenticationPrincipal AppUser user) {
        return ApiResponse.ok(certificateService.update(user, id, form, file), "Certificate updated successfully");
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(@PathVariable UUID id, @AuthenticationPrincipal AppUser user) {
        certificateService.delete(user, id);
        return ApiResponse.message("Certificate deleted successfully");
    }
}

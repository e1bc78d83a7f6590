package com.example.campusevents.controller;

import com.example.campusevents.dto.ApiResponse;
import com.example.campusevents.dto.StudentStatusRequest;
import com.example.campusevents.entities.Student;
import com.example.campusevents.enums.StudentStatus;
import com.example.campusevents.service.StudentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/students")
public class AdminStudentController {

    private final StudentService studentService;

    @GetMapping
    public ApiResponse<List<Student>> list(@RequestParam(required = false) StudentStatus status) {
        return ApiResponse.ok(studentService.findAll(status));
    }

    @PutMapping("/{id}/status")
    public ApiResponse<Student> updateStatus(@PathVariable UUID id, @Valid @RequestBody StudentStatusRequest req) {
        Student s = studentService.updateStatus(id, req.getStatus());
        return ApiResponse.ok(s, "Student " + s.getStatus().value());
    }
}

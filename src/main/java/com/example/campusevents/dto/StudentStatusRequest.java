package com.example.campusevents.dto;

import com.example.campusevents.enums.StudentStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class StudentStatusRequest {
    @NotNull
    private StudentStatus status;
}

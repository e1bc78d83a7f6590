package com.example.campusevents.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDate;

/**
 * Profile edit. Null fields keep their value, blank strings clear the field.
 */
@Data
public class StudentProfileUpdateRequest {
    @Size(max = 255)
    private String name;
    @Size(max = 20)
    private String phone;
    private String college;
    @Size(max = 100)
    private String department;
    @Size(max = 10)
    private String year;
    @Size(max = 500)
    private String address;
    private LocalDate dateOfBirth;
    // changes the login password of the owning user
    @Size(min = 6, max = 100)
    private String password;
}

package com.example.campusevents.enums;

public enum UserRole {
    ADMIN,
    STUDENT
}

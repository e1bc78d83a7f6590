package com.example.campusevents.exception;

public enum ErrorCode {
    VALIDATION_FAILED,
    INVALID_QR_CODE,
    INVALID_PHOTO_DATA,
    PHOTO_TOO_LARGE,

    NOT_FOUND,
    EVENT_NOT_FOUND,
    STUDENT_NOT_FOUND,

    UNAUTHORIZED,
    FORBIDDEN,
    PROFILE_NOT_APPROVED,

    CAPACITY_EXCEEDED,
    DUPLICATE_ATTENDANCE,
    DUPLICATE_ACCOUNT,
    CONCURRENT_UPDATE,

    EVENT_CANCELLED,
    REGISTRATION_CLOSED,
    ATTENDANCE_CLOSED,
    EVENT_NOT_STARTED,
    EVENT_ALREADY_COMPLETED,
    INVALID_STATE,

    PAYLOAD_TOO_LARGE,
    INTERNAL_ERROR
}

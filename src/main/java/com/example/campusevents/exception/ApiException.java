package com.example.campusevents.exception;

import org.springframework.http.HttpStatus;

/**
 * Base of every error the application raises on purpose. Carries the HTTP status the
 * client sees and a machine-readable code.
 */
public abstract class ApiException extends RuntimeException {

    private final ErrorCode code;

    protected ApiException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected ApiException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public abstract HttpStatus getStatus();
}

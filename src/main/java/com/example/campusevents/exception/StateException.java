package com.example.campusevents.exception;

import org.springframework.http.HttpStatus;

public class StateException extends ApiException {

    public StateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }

    public StateException(ErrorCode code, String message) {
        super(code, message);
    }

    public StateException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }
}

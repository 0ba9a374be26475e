package com.freeeemulator.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes surfaced to API callers in the {@code error} field.
 */
public enum ErrorCode {

    INVALID_PARAMETER("invalid_parameter", HttpStatus.BAD_REQUEST),

    INVALID_REQUEST("invalid_request", HttpStatus.BAD_REQUEST),

    UNAUTHORIZED("unauthorized", HttpStatus.UNAUTHORIZED),

    NOT_FOUND("not_found", HttpStatus.NOT_FOUND),

    SERVER_ERROR("server_error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final HttpStatus status;

    ErrorCode(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }
}

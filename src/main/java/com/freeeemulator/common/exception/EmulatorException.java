package com.freeeemulator.common.exception;

/**
 * Base exception for all emulator exceptions.
 * The error code decides the HTTP status and the {@code error} field of the response.
 */
public class EmulatorException extends RuntimeException {

    private final ErrorCode errorCode;

    public EmulatorException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public EmulatorException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}

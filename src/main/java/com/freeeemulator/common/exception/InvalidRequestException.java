package com.freeeemulator.common.exception;

/**
 * Thrown when a request cannot be processed as a whole (unparseable body, unknown session).
 */
public class InvalidRequestException extends EmulatorException {

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }
}

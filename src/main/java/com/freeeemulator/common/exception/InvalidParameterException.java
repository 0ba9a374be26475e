package com.freeeemulator.common.exception;

/**
 * Thrown when a required parameter is missing or has an invalid value.
 */
public class InvalidParameterException extends EmulatorException {

    public InvalidParameterException(String message) {
        super(ErrorCode.INVALID_PARAMETER, message);
    }
}

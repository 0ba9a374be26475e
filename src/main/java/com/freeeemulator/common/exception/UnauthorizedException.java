package com.freeeemulator.common.exception;

/**
 * Thrown when credentials, one-time codes or tokens are rejected.
 */
public class UnauthorizedException extends EmulatorException {

    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}

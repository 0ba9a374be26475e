package com.freeeemulator.common.exception;

/**
 * Thrown when a login step is posted for a session that is not waiting for it.
 */
public class InvalidSessionStateException extends EmulatorException {

    public InvalidSessionStateException(String sessionId, String currentState, String step) {
        super(ErrorCode.INVALID_REQUEST, String.format(
            "Cannot perform step '%s' on authorization session %s in state %s",
            step, sessionId, currentState));
    }
}

package com.freeeemulator.common.exception;

/**
 * Thrown when the embedded store or the receipt file tree fails.
 */
public class StorageException extends EmulatorException {

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.SERVER_ERROR, message, cause);
    }
}

package com.freeeemulator.common.exception;

/**
 * Thrown when a record is not found.
 */
public class RecordNotFoundException extends EmulatorException {

    public RecordNotFoundException(String entityName, Object id) {
        super(ErrorCode.NOT_FOUND, entityName + " not found: " + id);
    }
}

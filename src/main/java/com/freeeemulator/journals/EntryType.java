package com.freeeemulator.journals;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.freeeemulator.common.exception.InvalidParameterException;

import java.util.Arrays;

/**
 * Side of a journal line.
 */
public enum EntryType {

    DEBIT("debit"),
    CREDIT("credit");

    private final String code;

    EntryType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static EntryType parse(String value) {
        return Arrays.stream(values())
            .filter(type -> type.code.equals(value))
            .findFirst()
            .orElseThrow(() -> new InvalidParameterException("Invalid entry_type: " + value));
    }
}

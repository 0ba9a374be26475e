package com.freeeemulator.deals;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.freeeemulator.common.exception.InvalidParameterException;

import java.util.Arrays;

public enum DealType {

    INCOME("income"),
    EXPENSE("expense");

    private final String code;

    DealType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static DealType parse(String value) {
        return Arrays.stream(values())
            .filter(type -> type.code.equals(value))
            .findFirst()
            .orElseThrow(() -> new InvalidParameterException("Invalid type: " + value));
    }
}

package com.freeeemulator.receipts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ReceiptStatus {

    UNCONFIRMED("unconfirmed"),
    CONFIRMED("confirmed");

    private final String code;

    ReceiptStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    static ReceiptStatus of(String value) {
        return Arrays.stream(values())
            .filter(status -> status.code.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown receipt status: " + value));
    }
}

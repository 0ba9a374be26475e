package com.freeeemulator.wallettxns;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.freeeemulator.common.exception.InvalidParameterException;

import java.util.Arrays;

/**
 * Direction of money movement on a walletable.
 */
public enum EntrySide {

    INCOME("income"),
    EXPENSE("expense");

    private final String code;

    EntrySide(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static EntrySide parse(String value) {
        return Arrays.stream(values())
            .filter(side -> side.code.equals(value))
            .findFirst()
            .orElseThrow(() -> new InvalidParameterException("Invalid entry_side: " + value));
    }

    /**
     * Negative amounts leave the walletable, everything else enters it.
     */
    public static EntrySide ofAmount(long amount) {
        return amount < 0 ? EXPENSE : INCOME;
    }
}

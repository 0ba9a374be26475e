package com.freeeemulator.walletables;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of money container, rendered with the upstream's codes.
 */
public enum WalletableType {

    BANK_ACCOUNT("bank_account"),
    CREDIT_CARD("credit_card"),
    WALLET("wallet");

    private final String code;

    WalletableType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static Optional<WalletableType> fromCode(String code) {
        return Arrays.stream(values())
            .filter(type -> type.code.equals(code))
            .findFirst();
    }

    @JsonCreator
    static WalletableType of(String code) {
        return fromCode(code)
            .orElseThrow(() -> new IllegalArgumentException("Unknown walletable type: " + code));
    }
}

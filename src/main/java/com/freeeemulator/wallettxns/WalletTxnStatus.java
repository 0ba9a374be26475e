package com.freeeemulator.wallettxns;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.freeeemulator.common.exception.InvalidParameterException;

import java.util.Arrays;

/**
 * Booking state of a wallet transaction.
 *
 * The upstream API accepts either the string code or a numeric code in
 * filters and updates; both spellings resolve to the same constant.
 */
public enum WalletTxnStatus {

    UNBOOKED("unbooked", "1"),
    SETTLED("settled", "2");

    private final String code;
    private final String numericCode;

    WalletTxnStatus(String code, String numericCode) {
        this.code = code;
        this.numericCode = numericCode;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getNumericCode() {
        return numericCode;
    }

    /**
     * Resolve {@code "1"}, {@code "unbooked"}, {@code "2"} or {@code "settled"}.
     *
     * @throws InvalidParameterException for any other value
     */
    @JsonCreator
    public static WalletTxnStatus parse(String value) {
        return Arrays.stream(values())
            .filter(status -> status.code.equals(value) || status.numericCode.equals(value))
            .findFirst()
            .orElseThrow(() -> new InvalidParameterException("Invalid status: " + value));
    }
}

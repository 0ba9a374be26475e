package com.freeeemulator.deals;

/**
 * Consumption tax of a detail line.
 *
 * A flat 10% rate truncated to whole yen applies to every non-zero tax code.
 * Tax code 0 means the line is out of scope.
 */
public final class TaxCalculator {

    public static final int TAX_CODE_NONE = 0;
    private static final long RATE_DIVISOR = 10;

    private TaxCalculator() {
    }

    public static long vatOf(int taxCode, long amount) {
        if (taxCode == TAX_CODE_NONE) {
            return 0;
        }
        return amount / RATE_DIVISOR;
    }
}

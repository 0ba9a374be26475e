package com.freeeemulator.settlement;

/**
 * What settlement does when a payment matches more than one unbooked wallet transaction.
 */
public enum AmbiguousMatchPolicy {

    /** Leave every candidate unbooked. */
    SKIP,

    /** Settle the candidate with the lowest id. */
    EARLIEST_CREATED
}

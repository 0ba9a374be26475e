package com.freeeemulator.storage;

import java.util.List;

/**
 * Names of the collections declared in the embedded store.
 *
 * Every collection used by the application must be listed in {@link #ALL};
 * the storage engine declares them at startup and rejects any other name.
 */
public final class StorageCollections {

    public static final String ACCESS_TOKENS = "access_tokens";
    public static final String REFRESH_TOKENS = "refresh_tokens";
    public static final String AUTHORIZATION_SESSIONS = "authorization_sessions";
    public static final String AUTHORIZATION_CODES = "authorization_codes";

    public static final String WALLET_TXNS = "wallet_txns";
    public static final String DEALS = "deals";
    public static final String DEAL_DETAILS = "deal_details";
    public static final String DEAL_PAYMENTS = "deal_payments";
    public static final String JOURNALS = "journals";
    public static final String JOURNAL_DETAILS = "journal_details";
    public static final String RECEIPTS = "receipts";

    public static final List<String> ALL = List.of(
        ACCESS_TOKENS,
        REFRESH_TOKENS,
        AUTHORIZATION_SESSIONS,
        AUTHORIZATION_CODES,
        WALLET_TXNS,
        DEALS,
        DEAL_DETAILS,
        DEAL_PAYMENTS,
        JOURNALS,
        JOURNAL_DETAILS,
        RECEIPTS
    );

    private StorageCollections() {
    }
}

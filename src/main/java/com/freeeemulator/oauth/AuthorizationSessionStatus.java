package com.freeeemulator.oauth;

/**
 * Steps of the simulated browser login.
 */
public enum AuthorizationSessionStatus {
    AWAITING_CREDENTIALS,
    AWAITING_SECOND_FACTOR,
    AWAITING_CONSENT,
    CODE_ISSUED
}

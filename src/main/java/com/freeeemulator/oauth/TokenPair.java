package com.freeeemulator.oauth;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A freshly issued access token with its refresh token.
 */
@Data
@AllArgsConstructor
public class TokenPair {

    private String accessToken;
    private String refreshToken;
    private long expiresInSeconds;
}

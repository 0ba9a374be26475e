package com.freeeemulator.oauth;

import com.freeeemulator.storage.StorageCollections;
import com.freeeemulator.storage.StorageEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;

/**
 * Issues, validates and revokes opaque bearer tokens.
 *
 * Tokens are 32 random bytes in URL-safe Base64. Each token is stored with
 * its absolute expiry in epoch millis; an expired token is removed the first
 * time it is looked up.
 */
@Service
@Slf4j
public class TokenService {

    private static final int TOKEN_BYTES = 32;

    private final StorageEngine storage;
    private final Clock clock;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final SecureRandom random = new SecureRandom();

    public TokenService(
            StorageEngine storage,
            Clock clock,
            @Value("${freee-emulator.oauth.access-token-ttl-seconds:3600}") long accessTokenTtlSeconds,
            @Value("${freee-emulator.oauth.refresh-token-ttl-seconds:2592000}") long refreshTokenTtlSeconds) {
        this.storage = storage;
        this.clock = clock;
        this.accessTokenTtl = Duration.ofSeconds(accessTokenTtlSeconds);
        this.refreshTokenTtl = Duration.ofSeconds(refreshTokenTtlSeconds);
    }

    public String issueAccessToken() {
        return issue(StorageCollections.ACCESS_TOKENS, accessTokenTtl);
    }

    public String issueRefreshToken() {
        return issue(StorageCollections.REFRESH_TOKENS, refreshTokenTtl);
    }

    @Transactional
    public TokenPair issueTokenPair() {
        String accessToken = issueAccessToken();
        String refreshToken = issueRefreshToken();
        log.info("Issued token pair, access token expires in {}s", accessTokenTtl.getSeconds());
        return new TokenPair(accessToken, refreshToken, accessTokenTtl.getSeconds());
    }

    /**
     * Check an access token.
     *
     * @return false for blank, unknown or expired tokens
     */
    @Transactional
    public boolean validate(String token) {
        return isLive(StorageCollections.ACCESS_TOKENS, token);
    }

    @Transactional
    public boolean isKnownRefreshToken(String token) {
        return isLive(StorageCollections.REFRESH_TOKENS, token);
    }

    /**
     * Remove a token of either kind. Revoking an unknown token is a no-op.
     */
    @Transactional
    public void revoke(String token) {
        if (token == null || token.isBlank()) {
            return;
        }
        storage.deleteString(StorageCollections.ACCESS_TOKENS, token);
        storage.deleteString(StorageCollections.REFRESH_TOKENS, token);
        log.debug("Revoked token");
    }

    public long getAccessTokenTtlSeconds() {
        return accessTokenTtl.getSeconds();
    }

    private String issue(String collection, Duration ttl) {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        String token = Base64.getUrlEncoder().encodeToString(bytes);

        long expiresAt = clock.instant().plus(ttl).toEpochMilli();
        storage.putString(collection, token, Long.toString(expiresAt));
        return token;
    }

    private boolean isLive(String collection, String token) {
        if (token == null || token.isBlank()) {
            return false;
        }

        Optional<String> expiry = storage.getString(collection, token);
        if (expiry.isEmpty()) {
            return false;
        }

        if (clock.millis() >= Long.parseLong(expiry.get())) {
            log.debug("Token in {} expired, removing it", collection);
            storage.deleteString(collection, token);
            return false;
        }
        return true;
    }
}

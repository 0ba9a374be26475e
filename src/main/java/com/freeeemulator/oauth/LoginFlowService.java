package com.freeeemulator.oauth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.freeeemulator.common.exception.InvalidRequestException;
import com.freeeemulator.common.exception.StorageException;
import com.freeeemulator.common.exception.UnauthorizedException;
import com.freeeemulator.storage.StorageCollections;
import com.freeeemulator.storage.StorageEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.UUID;

/**
 * Simulated three-step browser login: credentials, one-time code, consent.
 *
 * Each step checks fixed test credentials and advances the session. The
 * final step mints a single-use authorization code that the token endpoint
 * accepts as a grant.
 */
@Service
@Slf4j
public class LoginFlowService {

    static final String CODE_PREFIX = "AUTH_CODE_";

    private final StorageEngine storage;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String testEmail;
    private final String testPassword;
    private final String testOtp;
    private final SecureRandom random = new SecureRandom();

    public LoginFlowService(
            StorageEngine storage,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${freee-emulator.login.email:test@example.com}") String testEmail,
            @Value("${freee-emulator.login.password:password}") String testPassword,
            @Value("${freee-emulator.login.otp:123456}") String testOtp) {
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.testEmail = testEmail;
        this.testPassword = testPassword;
        this.testOtp = testOtp;
    }

    @Transactional
    public AuthorizationSession startSession(String clientId, String redirectUri, String state) {
        AuthorizationSession session = AuthorizationSession.builder()
            .sessionId(UUID.randomUUID().toString())
            .clientId(clientId)
            .redirectUri(redirectUri)
            .state(state)
            .status(AuthorizationSessionStatus.AWAITING_CREDENTIALS)
            .createdAt(clock.instant())
            .build();

        save(session);
        log.info("Started authorization session {} for client {}", session.getSessionId(), clientId);
        return session;
    }

    @Transactional(readOnly = true)
    public AuthorizationSession getSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new InvalidRequestException("Missing session_id");
        }
        String json = storage.getString(StorageCollections.AUTHORIZATION_SESSIONS, sessionId)
            .orElseThrow(() -> new InvalidRequestException("Unknown authorization session: " + sessionId));
        return read(json);
    }

    /**
     * Step 1. Wrong credentials leave the session where it was.
     */
    @Transactional
    public AuthorizationSession submitCredentials(String sessionId, String email, String password) {
        AuthorizationSession session = getSession(sessionId);
        session.requireStatus(AuthorizationSessionStatus.AWAITING_CREDENTIALS, "login");

        if (!testEmail.equals(email) || !testPassword.equals(password)) {
            log.info("Rejected credentials for authorization session {}", sessionId);
            throw new UnauthorizedException("Invalid email or password");
        }

        session.acceptCredentials();
        save(session);
        return session;
    }

    /**
     * Step 2. A wrong code leaves the session where it was.
     */
    @Transactional
    public AuthorizationSession submitSecondFactor(String sessionId, String otp) {
        AuthorizationSession session = getSession(sessionId);
        session.requireStatus(AuthorizationSessionStatus.AWAITING_SECOND_FACTOR, "2fa");

        if (!testOtp.equals(otp)) {
            log.info("Rejected one-time code for authorization session {}", sessionId);
            throw new UnauthorizedException("Invalid one-time code");
        }

        session.acceptSecondFactor();
        save(session);
        return session;
    }

    /**
     * Step 3. Mints the authorization code.
     */
    @Transactional
    public AuthorizationSession confirm(String sessionId) {
        AuthorizationSession session = getSession(sessionId);

        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        String code = CODE_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);

        session.issueCode(code);
        save(session);
        storage.putString(StorageCollections.AUTHORIZATION_CODES, code, sessionId);

        log.info("Issued authorization code for session {}", sessionId);
        return session;
    }

    /**
     * Consume an authorization code minted by this flow.
     *
     * @return true if the code was known and is now spent
     */
    @Transactional
    public boolean redeemCode(String code) {
        if (code == null || code.isBlank()) {
            return false;
        }
        if (storage.getString(StorageCollections.AUTHORIZATION_CODES, code).isEmpty()) {
            return false;
        }
        storage.deleteString(StorageCollections.AUTHORIZATION_CODES, code);
        return true;
    }

    private void save(AuthorizationSession session) {
        try {
            storage.putString(StorageCollections.AUTHORIZATION_SESSIONS,
                session.getSessionId(), objectMapper.writeValueAsString(session));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize authorization session", e);
        }
    }

    private AuthorizationSession read(String json) {
        try {
            return objectMapper.readValue(json, AuthorizationSession.class);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to deserialize authorization session", e);
        }
    }
}

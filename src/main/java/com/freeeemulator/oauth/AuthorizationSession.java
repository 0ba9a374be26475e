package com.freeeemulator.oauth;

import com.freeeemulator.common.exception.InvalidSessionStateException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Server-side state of one simulated login journey.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthorizationSession {

    private static final String OOB_REDIRECT_URI = "urn:ietf:wg:oauth:2.0:oob";

    private String sessionId;
    private String clientId;
    private String redirectUri;
    private String state;
    private AuthorizationSessionStatus status;
    private String authorizationCode;
    private Instant createdAt;

    public void acceptCredentials() {
        require(AuthorizationSessionStatus.AWAITING_CREDENTIALS, "login");
        this.status = AuthorizationSessionStatus.AWAITING_SECOND_FACTOR;
    }

    public void acceptSecondFactor() {
        require(AuthorizationSessionStatus.AWAITING_SECOND_FACTOR, "2fa");
        this.status = AuthorizationSessionStatus.AWAITING_CONSENT;
    }

    public void issueCode(String code) {
        require(AuthorizationSessionStatus.AWAITING_CONSENT, "confirm");
        this.authorizationCode = code;
        this.status = AuthorizationSessionStatus.CODE_ISSUED;
    }

    public void requireStatus(AuthorizationSessionStatus expected, String step) {
        require(expected, step);
    }

    /**
     * Whether the code should be delivered by redirect rather than shown on a page.
     */
    public boolean redirectsWithCode() {
        return redirectUri != null
            && !redirectUri.isBlank()
            && !OOB_REDIRECT_URI.equals(redirectUri);
    }

    private void require(AuthorizationSessionStatus expected, String step) {
        if (status != expected) {
            throw new InvalidSessionStateException(sessionId, String.valueOf(status), step);
        }
    }
}

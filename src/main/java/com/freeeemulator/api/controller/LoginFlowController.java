package com.freeeemulator.api.controller;

import com.freeeemulator.common.exception.UnauthorizedException;
import com.freeeemulator.oauth.AuthorizationSession;
import com.freeeemulator.oauth.LoginFlowService;
import com.freeeemulator.oauth.LoginPages;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * HTML pages of the simulated browser login.
 */
@RestController
@RequestMapping("/oauth/authorize")
@RequiredArgsConstructor
@Tag(name = "Login flow", description = "Simulated browser login for OAuth clients")
public class LoginFlowController {

    private final LoginFlowService loginFlowService;
    private final LoginPages loginPages;

    @GetMapping
    @Operation(summary = "Start a login and show the credentials form")
    public ResponseEntity<String> authorize(
            @RequestParam(name = "client_id", required = false) String clientId,
            @RequestParam(name = "redirect_uri", required = false) String redirectUri,
            @RequestParam(name = "state", required = false) String state) {
        AuthorizationSession session = loginFlowService.startSession(clientId, redirectUri, state);
        return html(HttpStatus.OK, loginPages.credentialsForm(session.getSessionId(), null));
    }

    @PostMapping("/login")
    @Operation(summary = "Submit email and password")
    public ResponseEntity<String> login(
            @RequestParam(name = "session_id", required = false) String sessionId,
            @RequestParam(name = "email", required = false) String email,
            @RequestParam(name = "password", required = false) String password) {
        try {
            loginFlowService.submitCredentials(sessionId, email, password);
        } catch (UnauthorizedException e) {
            return html(HttpStatus.UNAUTHORIZED, loginPages.credentialsForm(sessionId, e.getMessage()));
        }
        return html(HttpStatus.OK, loginPages.secondFactorForm(sessionId, null));
    }

    @PostMapping("/2fa")
    @Operation(summary = "Submit the one-time code")
    public ResponseEntity<String> secondFactor(
            @RequestParam(name = "session_id", required = false) String sessionId,
            @RequestParam(name = "otp", required = false) String otp) {
        AuthorizationSession session;
        try {
            session = loginFlowService.submitSecondFactor(sessionId, otp);
        } catch (UnauthorizedException e) {
            return html(HttpStatus.UNAUTHORIZED, loginPages.secondFactorForm(sessionId, e.getMessage()));
        }
        return html(HttpStatus.OK, loginPages.consentPage(session));
    }

    @PostMapping("/confirm")
    @Operation(summary = "Grant consent and receive the authorization code")
    public ResponseEntity<String> confirm(@RequestParam(name = "session_id", required = false) String sessionId) {
        AuthorizationSession session = loginFlowService.confirm(sessionId);

        if (session.redirectsWithCode()) {
            UriComponentsBuilder target = UriComponentsBuilder.fromUriString(session.getRedirectUri())
                .queryParam("code", session.getAuthorizationCode());
            if (session.getState() != null) {
                target.queryParam("state", session.getState());
            }
            URI location = target.encode().build().toUri();
            return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
        }
        return html(HttpStatus.OK, loginPages.codePage(session.getAuthorizationCode()));
    }

    private ResponseEntity<String> html(HttpStatus status, String body) {
        return ResponseEntity.status(status).contentType(MediaType.TEXT_HTML).body(body);
    }
}

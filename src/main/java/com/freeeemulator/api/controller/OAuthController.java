package com.freeeemulator.api.controller;

import com.freeeemulator.api.dto.TokenResponse;
import com.freeeemulator.common.exception.InvalidRequestException;
import com.freeeemulator.oauth.LoginFlowService;
import com.freeeemulator.oauth.TokenPair;
import com.freeeemulator.oauth.TokenService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * OAuth2 token endpoint.
 *
 * Any grant type is accepted and always yields a fresh token pair. Codes
 * minted by the login flow are consumed and known refresh tokens are rotated,
 * but unknown ones are accepted as well.
 */
@RestController
@RequestMapping("/oauth")
@Slf4j
@Tag(name = "OAuth", description = "Token issuance and revocation")
public class OAuthController {

    private static final String GRANT_AUTHORIZATION_CODE = "authorization_code";
    private static final String GRANT_REFRESH_TOKEN = "refresh_token";

    private final TokenService tokenService;
    private final LoginFlowService loginFlowService;
    private final long defaultCompanyId;

    public OAuthController(
            TokenService tokenService,
            LoginFlowService loginFlowService,
            @Value("${freee-emulator.oauth.default-company-id:1}") long defaultCompanyId) {
        this.tokenService = tokenService;
        this.loginFlowService = loginFlowService;
        this.defaultCompanyId = defaultCompanyId;
    }

    @PostMapping("/token")
    @Operation(summary = "Issue an access and refresh token pair")
    public ResponseEntity<TokenResponse> token(
            @RequestParam(name = "grant_type", required = false) String grantType,
            @RequestParam(name = "code", required = false) String code,
            @RequestParam(name = "refresh_token", required = false) String refreshToken) {

        if (grantType == null || grantType.isBlank()) {
            throw new InvalidRequestException("Missing grant_type");
        }

        if (GRANT_AUTHORIZATION_CODE.equals(grantType) && loginFlowService.redeemCode(code)) {
            log.info("Redeemed authorization code from the login flow");
        }
        if (GRANT_REFRESH_TOKEN.equals(grantType) && tokenService.isKnownRefreshToken(refreshToken)) {
            tokenService.revoke(refreshToken);
            log.info("Rotated refresh token");
        }

        TokenPair pair = tokenService.issueTokenPair();
        TokenResponse response = TokenResponse.builder()
            .accessToken(pair.getAccessToken())
            .refreshToken(pair.getRefreshToken())
            .tokenType("Bearer")
            .expiresIn(pair.getExpiresInSeconds())
            .companyId(defaultCompanyId)
            .build();
        return ResponseEntity.ok(response);
    }

    @PostMapping("/revoke")
    @Operation(summary = "Revoke an access or refresh token")
    public ResponseEntity<Void> revoke(@RequestParam(name = "token", required = false) String token) {
        tokenService.revoke(token);
        return ResponseEntity.ok().build();
    }
}

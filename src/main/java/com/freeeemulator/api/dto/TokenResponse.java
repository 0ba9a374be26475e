package com.freeeemulator.api.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Body of a successful token grant.
 */
@Data
@Builder
public class TokenResponse {

    private String accessToken;
    private String refreshToken;
    private String tokenType;
    private long expiresIn;
    private long companyId;
}

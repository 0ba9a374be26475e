package com.freeeemulator.oauth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.freeeemulator.common.exception.ErrorCode;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Requires a valid bearer token on every {@code /api/1/} request.
 * Rejected requests get a 401 with the standard error body and never reach a controller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BearerTokenFilter extends OncePerRequestFilter {

    static final String PROTECTED_PREFIX = "/api/1/";
    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;
    private final ObjectMapper objectMapper;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(PROTECTED_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || header.isBlank()) {
            reject(response, "Missing Authorization header");
            return;
        }
        if (!header.startsWith(BEARER_PREFIX)) {
            reject(response, "Invalid Authorization header format");
            return;
        }

        String token = header.substring(BEARER_PREFIX.length()).trim();
        if (!tokenService.validate(token)) {
            reject(response, "Invalid or expired token");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, String description) throws IOException {
        log.debug("Rejected API request: {}", description);

        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", ErrorCode.UNAUTHORIZED.getCode());
        body.put("error_description", description);

        response.setStatus(ErrorCode.UNAUTHORIZED.getStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}

package com.freeeemulator.oauth;

import com.freeeemulator.common.exception.StorageException;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Renders the HTML pages of the simulated login.
 *
 * Templates live under {@code templates/oauth/} on the classpath and use
 * {@code {{name}}} placeholders. Every substituted value is HTML-escaped.
 */
@Component
public class LoginPages {

    private static final String TEMPLATE_ROOT = "templates/oauth/";

    private final Map<String, String> templates = new ConcurrentHashMap<>();

    public String credentialsForm(String sessionId, String error) {
        return render("login.html", Map.of(
            "session_id", sessionId,
            "error", error == null ? "" : error));
    }

    public String secondFactorForm(String sessionId, String error) {
        return render("otp.html", Map.of(
            "session_id", sessionId,
            "error", error == null ? "" : error));
    }

    public String consentPage(AuthorizationSession session) {
        return render("consent.html", Map.of(
            "session_id", session.getSessionId(),
            "client_id", session.getClientId() == null ? "" : session.getClientId()));
    }

    public String codePage(String code) {
        return render("code.html", Map.of("code", code));
    }

    String render(String templateName, Map<String, String> values) {
        String html = templates.computeIfAbsent(templateName, this::load);
        for (Map.Entry<String, String> value : values.entrySet()) {
            html = html.replace("{{" + value.getKey() + "}}", HtmlUtils.htmlEscape(value.getValue()));
        }
        return html;
    }

    private String load(String templateName) {
        try (InputStream in = new ClassPathResource(TEMPLATE_ROOT + templateName).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed to load login page template " + templateName, e);
        }
    }
}

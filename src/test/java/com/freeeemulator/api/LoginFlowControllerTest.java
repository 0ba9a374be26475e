package com.freeeemulator.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Walks the simulated browser login through its HTML pages.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class LoginFlowControllerTest {

    private static final Pattern SESSION_ID = Pattern.compile("name=\"session_id\" value=\"([^\"]+)\"");
    private static final Pattern CODE = Pattern.compile("<code id=\"authorization-code\">([^<]+)</code>");

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testAuthorize_ShowsCredentialsForm() throws Exception {
        mockMvc.perform(get("/oauth/authorize").param("client_id", "test-client"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
            .andExpect(content().string(containsString("action=\"/oauth/authorize/login\"")));
    }

    @Test
    void testLogin_WrongPassword() throws Exception {
        String sessionId = startSession("urn:ietf:wg:oauth:2.0:oob", null);

        mockMvc.perform(post("/oauth/authorize/login")
                .param("session_id", sessionId)
                .param("email", "test@example.com")
                .param("password", "wrong"))
            .andExpect(status().isUnauthorized())
            .andExpect(content().string(containsString("Invalid email or password")));
    }

    @Test
    void testSecondFactor_WrongCode() throws Exception {
        String sessionId = startSession("urn:ietf:wg:oauth:2.0:oob", null);
        submitCredentials(sessionId);

        mockMvc.perform(post("/oauth/authorize/2fa")
                .param("session_id", sessionId)
                .param("otp", "000000"))
            .andExpect(status().isUnauthorized())
            .andExpect(content().string(containsString("Invalid one-time code")));
    }

    @Test
    void testFullFlow_RedirectsWithCodeAndState() throws Exception {
        String sessionId = startSession("http://localhost:3000/callback", "xyz");
        submitCredentials(sessionId);
        submitSecondFactor(sessionId);

        mockMvc.perform(post("/oauth/authorize/confirm").param("session_id", sessionId))
            .andExpect(status().isFound())
            .andExpect(header().string("Location", startsWith("http://localhost:3000/callback?code=AUTH_CODE_")))
            .andExpect(header().string("Location", containsString("&state=xyz")));
    }

    @Test
    void testFullFlow_OutOfBandShowsCode() throws Exception {
        String sessionId = startSession("urn:ietf:wg:oauth:2.0:oob", null);
        submitCredentials(sessionId);
        submitSecondFactor(sessionId);

        String page = mockMvc.perform(post("/oauth/authorize/confirm").param("session_id", sessionId))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();

        Matcher matcher = CODE.matcher(page);
        assertTrue(matcher.find());
        String code = matcher.group(1);
        assertTrue(code.startsWith("AUTH_CODE_"));

        mockMvc.perform(post("/oauth/token")
                .param("grant_type", "authorization_code")
                .param("code", code))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.access_token").isNotEmpty());
    }

    @Test
    void testConfirm_BeforeSecondFactor() throws Exception {
        String sessionId = startSession("urn:ietf:wg:oauth:2.0:oob", null);
        submitCredentials(sessionId);

        mockMvc.perform(post("/oauth/authorize/confirm").param("session_id", sessionId))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void testLogin_UnknownSession() throws Exception {
        mockMvc.perform(post("/oauth/authorize/login")
                .param("session_id", "no-such-session")
                .param("email", "test@example.com")
                .param("password", "password"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    private String startSession(String redirectUri, String state) throws Exception {
        var request = get("/oauth/authorize")
            .param("client_id", "test-client")
            .param("redirect_uri", redirectUri);
        if (state != null) {
            request.param("state", state);
        }
        String page = mockMvc.perform(request)
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();

        Matcher matcher = SESSION_ID.matcher(page);
        assertTrue(matcher.find(), "credentials form carries the session id");
        return matcher.group(1);
    }

    private void submitCredentials(String sessionId) throws Exception {
        mockMvc.perform(post("/oauth/authorize/login")
                .param("session_id", sessionId)
                .param("email", "test@example.com")
                .param("password", "password"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("action=\"/oauth/authorize/2fa\"")));
    }

    private void submitSecondFactor(String sessionId) throws Exception {
        mockMvc.perform(post("/oauth/authorize/2fa")
                .param("session_id", sessionId)
                .param("otp", "123456"))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("action=\"/oauth/authorize/confirm\"")));
    }
}

package com.linecommerce.api.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPath;
import com.linecommerce.api.dto.ItemCreateRequest;
import com.linecommerce.api.dto.ItemUpdateRequest;
import com.linecommerce.api.dto.LoginRequest;
import com.linecommerce.api.dto.RegisterRequest;
import com.linecommerce.api.security.oauth.GoogleOAuthClient;
import com.linecommerce.api.security.oauth.GoogleOAuthUserInfo;
import com.linecommerce.api.security.oauth.OAuthExchangeException;
import com.linecommerce.api.security.oauth.OAuthProvider;
import com.linecommerce.api.service.AccountResolver;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end tests through the HTTP layer with an in-memory database.
 * Google is replaced by a mock client; Apple has no credentials in the test profile.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CommerceApiIntegrationTest {

    private static final String PASSWORD = "SecurePass123!";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AccountResolver accountResolver;

    @MockBean
    private GoogleOAuthClient googleClient;

    @BeforeEach
    void setUp() {
        when(googleClient.getProvider()).thenReturn(OAuthProvider.GOOGLE);
        when(googleClient.isConfigured()).thenReturn(true);
    }

    private static String uniqueEmail(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8) + "@example.com";
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    private void register(String email) throws Exception {
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new RegisterRequest(email, PASSWORD, null))))
                .andExpect(status().isCreated());
    }

    private String login(String email) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(email, PASSWORD))))
                .andExpect(status().isOk())
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.accessToken");
    }

    // ========================================
    // PASSWORD FLOW
    // ========================================

    @Test
    @DisplayName("register, login and /me should work end to end")
    void passwordFlow_shouldAuthenticateWithBearerAndCookie() throws Exception {
        String email = uniqueEmail("jane");

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new RegisterRequest(email, PASSWORD, "Jane"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.email").value(email))
                .andExpect(jsonPath("$.displayName").value("Jane"))
                .andExpect(jsonPath("$.passwordHash").doesNotExist());

        MvcResult loginResult = mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(email, PASSWORD))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokenType").value("bearer"))
                .andExpect(jsonPath("$.expiresAt").isNotEmpty())
                .andExpect(jsonPath("$.user.email").value(email))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, allOf(
                        startsWith("access_token="),
                        containsString("HttpOnly"),
                        containsString("Secure"),
                        containsString("SameSite=Lax"),
                        containsString("Max-Age=1800"))))
                .andReturn();
        String token = JsonPath.read(loginResult.getResponse().getContentAsString(), "$.accessToken");

        mockMvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(email));

        mockMvc.perform(get("/api/auth/me").cookie(new Cookie("access_token", token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(email));
    }

    @Test
    @DisplayName("registering the same email twice should be rejected")
    void register_shouldReturn400_whenEmailTaken() throws Exception {
        String email = uniqueEmail("dup");
        register(email);

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new RegisterRequest(email.toUpperCase(), PASSWORD, null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("duplicate_account"))
                .andExpect(jsonPath("$.detail").value("User with this email already exists"));
    }

    @Test
    @DisplayName("register should report invalid fields")
    void register_shouldReturn400_whenPayloadInvalid() throws Exception {
        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new RegisterRequest("not-an-email", "short", null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_failed"))
                .andExpect(jsonPath("$.fields.email").exists())
                .andExpect(jsonPath("$.fields.password").exists());
    }

    @Test
    @DisplayName("wrong password and unknown email should get the same 401")
    void login_shouldReturnSame401_forWrongPasswordAndUnknownEmail() throws Exception {
        String email = uniqueEmail("known");
        register(email);

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(email, "WrongPass123!"))))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                .andExpect(jsonPath("$.error").value("invalid_credentials"))
                .andExpect(jsonPath("$.detail").value("Invalid email or password"));

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(uniqueEmail("ghost"), PASSWORD))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("invalid_credentials"))
                .andExpect(jsonPath("$.detail").value("Invalid email or password"));
    }

    @Test
    @DisplayName("/me should answer 401 without a token or with a bad one")
    void me_shouldReturn401_whenTokenMissingOrInvalid() throws Exception {
        mockMvc.perform(get("/api/auth/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("token_invalid"));

        mockMvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, "Bearer not.a.token"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Could not validate credentials"));
    }

    @Test
    @DisplayName("a token issued before deactivation should stop working on /me")
    void me_shouldReturn401_whenAccountDeactivatedAfterLogin() throws Exception {
        String email = uniqueEmail("leaver");
        register(email);
        MvcResult loginResult = mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(email, PASSWORD))))
                .andExpect(status().isOk())
                .andReturn();
        String body = loginResult.getResponse().getContentAsString();
        String token = JsonPath.read(body, "$.accessToken");
        UUID userId = UUID.fromString(JsonPath.read(body, "$.user.id"));

        mockMvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk());

        assertThat(accountResolver.deactivate(userId)).isTrue();

        mockMvc.perform(get("/api/auth/me").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("token_invalid"));
        mockMvc.perform(get("/api/auth/me").cookie(new Cookie("access_token", token)))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(email, PASSWORD))))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("logout should expire the session cookie")
    void logout_shouldClearCookie() throws Exception {
        mockMvc.perform(post("/api/auth/logout"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.SET_COOKIE, allOf(
                        startsWith("access_token=;"),
                        containsString("Max-Age=0"))));
    }

    // ========================================
    // OAUTH FLOW
    // ========================================

    @Test
    @DisplayName("Google sign-in should link to the existing password account, which can still log in")
    void googleCallback_shouldLinkExistingAccount() throws Exception {
        // Arrange
        String email = uniqueEmail("linked");
        register(email);
        when(googleClient.fetchUserInfo("google-code")).thenReturn(new GoogleOAuthUserInfo(Map.of(
                "id", "g-" + UUID.randomUUID(),
                "email", email,
                "name", "Linked User",
                "picture", "https://lh3.googleusercontent.com/a/linked")));

        // Act & Assert
        mockMvc.perform(get("/api/auth/google/callback").param("code", "google-code").param("state", "s"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.SET_COOKIE, startsWith("access_token=")))
                .andExpect(jsonPath("$.user.email").value(email))
                .andExpect(jsonPath("$.user.oauthProvider").value("google"))
                .andExpect(jsonPath("$.user.displayName").value("Linked User"));

        login(email);
    }

    @Test
    @DisplayName("a failed Google exchange should answer 400 oauth_failed")
    void googleCallback_shouldReturn400_whenExchangeFails() throws Exception {
        when(googleClient.fetchUserInfo("bad-code")).thenThrow(new OAuthExchangeException("invalid_grant"));

        mockMvc.perform(get("/api/auth/google/callback").param("code", "bad-code").param("state", "s"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("oauth_failed"))
                .andExpect(jsonPath("$.detail").value("OAuth authentication failed"));
    }

    @Test
    @DisplayName("Apple endpoints should answer 501 while Apple has no credentials")
    void apple_shouldReturn501_whenNotConfigured() throws Exception {
        mockMvc.perform(get("/api/auth/apple"))
                .andExpect(status().isNotImplemented())
                .andExpect(jsonPath("$.error").value("oauth_not_configured"));

        mockMvc.perform(post("/api/auth/apple/callback")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("code", "apple-code")
                        .param("state", "s"))
                .andExpect(status().isNotImplemented());
    }

    // ========================================
    // ITEMS
    // ========================================

    @Test
    @DisplayName("items should be readable by anyone and writable only by their owner")
    void items_shouldEnforceOwnership() throws Exception {
        String owner = uniqueEmail("owner");
        String stranger = uniqueEmail("stranger");
        register(owner);
        register(stranger);
        String ownerToken = login(owner);
        String strangerToken = login(stranger);

        mockMvc.perform(post("/api/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new ItemCreateRequest("Sencha", null, new BigDecimal("8.00")))))
                .andExpect(status().isUnauthorized());

        MvcResult created = mockMvc.perform(post("/api/items")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new ItemCreateRequest("Sencha", "First flush", new BigDecimal("8.00")))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Sencha"))
                .andReturn();
        String itemId = JsonPath.read(created.getResponse().getContentAsString(), "$.id");
        String ownerId = JsonPath.read(created.getResponse().getContentAsString(), "$.userId");

        mockMvc.perform(get("/api/items/{id}", itemId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.description").value("First flush"));

        mockMvc.perform(get("/api/items").param("user_id", ownerId).param("per_page", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.perPage").value(20))
                .andExpect(jsonPath("$.items[0].id").value(itemId));

        mockMvc.perform(put("/api/items/{id}", itemId)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + strangerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new ItemUpdateRequest("Stolen", null, null))))
                .andExpect(status().isNotFound());

        mockMvc.perform(put("/api/items/{id}", itemId)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + ownerToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new ItemUpdateRequest("Sencha Premium", null, null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Sencha Premium"))
                .andExpect(jsonPath("$.description").value("First flush"));

        mockMvc.perform(delete("/api/items/{id}", itemId)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + strangerToken))
                .andExpect(status().isNotFound());

        mockMvc.perform(delete("/api/items/{id}", itemId)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + ownerToken))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/items/{id}", itemId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Item not found"));
    }

    @Test
    @DisplayName("/healthz should report a connected database")
    void healthz_shouldReportHealthy() throws Exception {
        mockMvc.perform(get("/healthz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.database").value("connected"));
    }
}

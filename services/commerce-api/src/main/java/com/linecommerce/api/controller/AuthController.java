package com.linecommerce.api.controller;

import com.linecommerce.api.dto.LoginRequest;
import com.linecommerce.api.dto.LoginResponse;
import com.linecommerce.api.dto.OAuthAuthorizationResponse;
import com.linecommerce.api.dto.RegisterRequest;
import com.linecommerce.api.dto.UserResponse;
import com.linecommerce.api.security.JwtAuthenticationFilter;
import com.linecommerce.api.security.JwtUtil;
import com.linecommerce.api.security.oauth.OAuthProvider;
import com.linecommerce.api.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * AuthController - REST API endpoints for authentication operations.
 *
 * Endpoints:
 * - POST /api/auth/register         - Create a password account
 * - POST /api/auth/login            - Email/password login, returns token and sets cookie
 * - POST /api/auth/logout           - Clear the session cookie
 * - GET  /api/auth/me               - Current account (requires auth)
 * - GET  /api/auth/google           - Google authorization URL and state
 * - GET  /api/auth/google/callback  - Complete Google sign-in
 * - GET  /api/auth/apple            - Apple authorization URL and state
 * - POST /api/auth/apple/callback   - Complete Apple sign-in (form post)
 *
 * Security Model:
 * - Stateless authentication using signed JWT session tokens
 * - Token returned in the body and as an HTTP-only, Secure, SameSite=Lax cookie
 * - Logout only clears the cookie; the token itself stays valid until it expires
 *
 * Error Handling (see GlobalExceptionHandler):
 * - 400 Bad Request: Invalid input, duplicate account, failed OAuth exchange
 * - 401 Unauthorized: Invalid credentials or invalid/expired token
 * - 501 Not Implemented: OAuth provider not configured
 *
 * @see AuthService for business logic
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    private final JwtUtil jwtUtil;

    @PostMapping("/register")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        UserResponse user = authService.register(request.getEmail(), request.getPassword(), request.getDisplayName());
        return ResponseEntity.status(HttpStatus.CREATED).body(user);
    }

    /**
     * Authenticate with email and password.
     *
     * @param request email and password
     * @return token and account; the token is also set as the access_token cookie
     */
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        LoginResponse response = authService.login(request.getEmail(), request.getPassword());
        return withSessionCookie(response);
    }

    /**
     * Since tokens are stateless, "logout" on the server side only removes the
     * cookie. A copied token remains usable until its expiry.
     */
    @PostMapping("/logout")
    public ResponseEntity<Map<String, String>> logout() {
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookie("", Duration.ZERO).toString())
                .body(Map.of("message", "Successfully logged out"));
    }

    /**
     * The principal name is the user id placed there by JwtAuthenticationFilter.
     */
    @GetMapping("/me")
    public ResponseEntity<UserResponse> me(Principal principal) {
        UUID userId = UUID.fromString(principal.getName());
        return ResponseEntity.ok(authService.getCurrentUser(userId));
    }

    @GetMapping("/google")
    public ResponseEntity<OAuthAuthorizationResponse> googleAuthorization() {
        return ResponseEntity.ok(authService.getAuthorizationUrl(OAuthProvider.GOOGLE));
    }

    @GetMapping("/google/callback")
    public ResponseEntity<LoginResponse> googleCallback(@RequestParam String code, @RequestParam String state) {
        return withSessionCookie(authService.oauthLogin(OAuthProvider.GOOGLE, code, state));
    }

    @GetMapping("/apple")
    public ResponseEntity<OAuthAuthorizationResponse> appleAuthorization() {
        return ResponseEntity.ok(authService.getAuthorizationUrl(OAuthProvider.APPLE));
    }

    /**
     * Apple uses response_mode=form_post, so code and state arrive as form fields.
     */
    @PostMapping("/apple/callback")
    public ResponseEntity<LoginResponse> appleCallback(@RequestParam String code, @RequestParam String state) {
        return withSessionCookie(authService.oauthLogin(OAuthProvider.APPLE, code, state));
    }

    private ResponseEntity<LoginResponse> withSessionCookie(LoginResponse response) {
        ResponseCookie cookie = sessionCookie(response.getAccessToken(), jwtUtil.getDefaultTtl());
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .body(response);
    }

    private static ResponseCookie sessionCookie(String value, Duration maxAge) {
        return ResponseCookie.from(JwtAuthenticationFilter.ACCESS_TOKEN_COOKIE, value)
                .httpOnly(true)
                .secure(true)
                .sameSite("Lax")
                .path("/")
                .maxAge(maxAge)
                .build();
    }
}

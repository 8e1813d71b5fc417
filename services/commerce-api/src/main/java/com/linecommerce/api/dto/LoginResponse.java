package com.linecommerce.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * LoginResponse - Data Transfer Object for successful authentication responses.
 *
 * Returned by password login and by both OAuth callbacks. The same token is
 * also set as an HTTP-only cookie by the controller, so browser clients may
 * ignore the body and API clients may ignore the cookie.
 *
 * Example Response:
 * <pre>
 * {
 *   "accessToken": "eyJhbGciOiJIUzI1NiJ9...",
 *   "tokenType": "bearer",
 *   "expiresAt": "2024-01-15T10:30:00Z",
 *   "user": { "id": "123e4567-e89b-12d3-a456-426614174000", "email": "user@example.com", ... }
 * }
 * </pre>
 *
 * Frontend Usage:
 * 1. Send accessToken as "Authorization: Bearer ..." on subsequent API calls
 * 2. Monitor expiresAt and send the user back to login when it passes
 *
 * There is no refresh token; an expired session requires a new login.
 *
 * @see com.linecommerce.api.controller.AuthController#login for endpoint
 * @see com.linecommerce.api.service.AuthService#login for response generation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginResponse {

    /**
     * Signed session token (compact JWS).
     */
    private String accessToken;

    /**
     * Always "bearer".
     */
    @Builder.Default
    private String tokenType = "bearer";

    /**
     * Instant after which the token is rejected.
     */
    private Instant expiresAt;

    /**
     * The authenticated account.
     */
    private UserResponse user;
}

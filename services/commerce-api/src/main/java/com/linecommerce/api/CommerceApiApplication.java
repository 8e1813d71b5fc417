package com.linecommerce.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CommerceApiApplication - Main entry point for the LINE Commerce API.
 *
 * This service is the back end of the LINE Commerce platform, responsible for:
 * - Account registration and email/password login
 * - Sign-in with Google and Apple (OAuth 2.0 authorization-code flow)
 * - Issuing and verifying stateless, HMAC-signed session tokens
 * - Ownership-scoped item management
 *
 * Architecture Context:
 * - Connects to PostgreSQL for accounts and items
 * - Stateless design: all session state lives in the signed token
 * - Configuration bound once at start-up from application.yml (auth.*)
 *
 * API Base Paths: /api/auth, /api/items, /healthz
 *
 * @see com.linecommerce.api.controller.AuthController for authentication endpoints
 * @see com.linecommerce.api.service.AuthService for the authentication flows
 * @see com.linecommerce.api.security.JwtUtil for token operations
 */
@SpringBootApplication
public class CommerceApiApplication {

    /**
     * Application entry point.
     *
     * @param args Command-line arguments (supports standard Spring Boot args)
     */
    public static void main(String[] args) {
        SpringApplication.run(CommerceApiApplication.class, args);
    }
}

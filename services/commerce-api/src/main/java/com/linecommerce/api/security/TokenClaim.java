package com.linecommerce.api.security;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Decoded payload of a verified session token.
 *
 * Only ever constructed by {@link JwtUtil} after the signature and expiry have
 * been checked.
 */
@Value
@Builder
public class TokenClaim {

    UUID subjectId;

    String email;

    Instant issuedAt;

    Instant expiresAt;
}

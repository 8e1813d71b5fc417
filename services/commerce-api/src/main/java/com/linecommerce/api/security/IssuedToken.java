package com.linecommerce.api.security;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A freshly signed session token together with the timestamps written into it.
 *
 * The instants are exactly the {@code iat} and {@code exp} claims, at second precision.
 */
@Value
@Builder
public class IssuedToken {

    String value;

    Instant issuedAt;

    Instant expiresAt;
}

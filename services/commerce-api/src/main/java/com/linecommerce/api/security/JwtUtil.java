package com.linecommerce.api.security;

import com.linecommerce.api.config.AuthProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * JwtUtil - Issues and verifies the signed session tokens of the LINE Commerce API.
 *
 * JWT Structure (RFC 7519):
 * - Header: HMAC algorithm (HS256 by default, HS384/HS512 configurable)
 * - Payload: sub (user id), email, iat, exp
 * - Signature: HMAC over header and payload using the server-held secret
 *
 * Tokens are stateless. There is no revocation list and no server-side session
 * store: a token is valid exactly while its signature checks out and the
 * current time is not after its expiry. Rotating the secret therefore
 * invalidates every outstanding token.
 *
 * Verification failures (bad signature, malformed token, missing claims,
 * expiry) all collapse to {@link Optional#empty()}. Callers cannot learn why a
 * token was rejected.
 *
 * Time comes from the single injected {@link Clock}; no clock-skew allowance
 * is granted.
 *
 * Configuration (application.yml):
 * - auth.jwt.secret: HMAC key, at least 32 bytes
 * - auth.jwt.algorithm: HS256 | HS384 | HS512
 * - auth.jwt.expire-minutes: default token lifetime, 1 to 1440
 *
 * @see com.linecommerce.api.service.AuthService for where tokens are minted and checked
 */
@Slf4j
@Component
public class JwtUtil {

    static final String EMAIL_CLAIM = "email";

    private final Clock clock;

    private final SignatureAlgorithm algorithm;

    private final Key signingKey;

    private final Duration defaultTtl;

    private final JwtParser parser;

    public JwtUtil(AuthProperties properties, Clock clock) {
        AuthProperties.Jwt jwt = properties.getJwt();
        this.clock = clock;
        this.algorithm = SignatureAlgorithm.forName(jwt.getAlgorithm());
        this.signingKey = Keys.hmacShaKeyFor(jwt.getSecret().getBytes(StandardCharsets.UTF_8));
        this.defaultTtl = jwt.getExpiry();
        this.parser = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    /**
     * Lifetime applied when {@link #issueToken(UUID, String)} is used.
     */
    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    /**
     * Issue a token with the configured default lifetime.
     *
     * @param userId subject of the token
     * @param email email of the subject at issuance time
     * @return compact serialised JWS (header.payload.signature) and its timestamps
     */
    public IssuedToken issueToken(UUID userId, String email) {
        return issueToken(userId, email, defaultTtl);
    }

    /**
     * Issue a token with an explicit lifetime.
     *
     * @param userId subject of the token
     * @param email email of the subject at issuance time
     * @param ttl time until the token expires, must be positive
     * @return compact serialised JWS and its timestamps
     */
    public IssuedToken issueToken(UUID userId, String email, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Token lifetime must be positive");
        }
        // one clock read; NumericDate claims carry whole seconds
        Instant now = clock.instant();
        Instant issuedAt = now.truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = now.plus(ttl).truncatedTo(ChronoUnit.SECONDS);

        String value = Jwts.builder()
                .setSubject(userId.toString())
                .claim(EMAIL_CLAIM, email)
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(expiresAt))
                .signWith(signingKey, algorithm)
                .compact();

        return IssuedToken.builder()
                .value(value)
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .build();
    }

    /**
     * Verify a token's signature and expiry and decode its claims.
     *
     * @param token compact serialised JWS, without any "Bearer " prefix
     * @return the claim if the token is authentic, well-formed and unexpired; empty otherwise
     */
    public Optional<TokenClaim> verifyToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Jws<Claims> jws = parser.parseClaimsJws(token);
            if (!algorithm.getValue().equals(jws.getHeader().getAlgorithm())) {
                return Optional.empty();
            }

            Claims claims = jws.getBody();
            if (claims.getSubject() == null || claims.getExpiration() == null) {
                return Optional.empty();
            }

            return Optional.of(TokenClaim.builder()
                    .subjectId(UUID.fromString(claims.getSubject()))
                    .email(claims.get(EMAIL_CLAIM, String.class))
                    .issuedAt(claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null)
                    .expiresAt(claims.getExpiration().toInstant())
                    .build());
        } catch (JwtException | IllegalArgumentException e) {
            // UUID.fromString and claim type mismatches raise IllegalArgumentException
            log.debug("Session token rejected: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }
    }
}

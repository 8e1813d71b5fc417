package com.linecommerce.api.security;

import com.linecommerce.api.TestAuthProperties;
import com.linecommerce.api.config.AuthProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JwtUtil.
 * Each JwtUtil reads time from a fixed clock, so issuing and verifying at
 * different instants uses two instances sharing the same configuration.
 */
class JwtUtilTest {

    private static final Instant ISSUED_AT = Instant.parse("2024-03-01T12:00:00Z");

    private static final UUID USER_ID = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");

    private static JwtUtil jwtAt(AuthProperties properties, Instant instant) {
        return new JwtUtil(properties, Clock.fixed(instant, ZoneOffset.UTC));
    }

    private static JwtUtil jwtAt(Instant instant) {
        return jwtAt(TestAuthProperties.create(), instant);
    }

    @Test
    @DisplayName("verifyToken should return the claims of a freshly issued token")
    void verifyToken_shouldReturnClaims_whenTokenFresh() {
        // Arrange
        JwtUtil jwt = jwtAt(ISSUED_AT);
        String token = jwt.issueToken(USER_ID, "user@example.com").getValue();

        // Act
        Optional<TokenClaim> claim = jwt.verifyToken(token);

        // Assert
        assertThat(claim).isPresent();
        assertThat(claim.get().getSubjectId()).isEqualTo(USER_ID);
        assertThat(claim.get().getEmail()).isEqualTo("user@example.com");
        assertThat(claim.get().getIssuedAt()).isEqualTo(ISSUED_AT);
        assertThat(claim.get().getExpiresAt()).isEqualTo(ISSUED_AT.plus(Duration.ofMinutes(30)));
    }

    @Test
    @DisplayName("token should be valid at exactly its expiry and invalid one second later")
    void verifyToken_shouldRespectExpiryBoundary() {
        String token = jwtAt(ISSUED_AT).issueToken(USER_ID, "user@example.com", Duration.ofMinutes(5)).getValue();
        Instant expiry = ISSUED_AT.plus(Duration.ofMinutes(5));

        assertThat(jwtAt(expiry.minusSeconds(1)).verifyToken(token)).isPresent();
        assertThat(jwtAt(expiry).verifyToken(token)).isPresent();
        assertThat(jwtAt(expiry.plusSeconds(1)).verifyToken(token)).isEmpty();
    }

    @Test
    @DisplayName("verifyToken should reject a token with a single altered signature character")
    void verifyToken_shouldReturnEmpty_whenSignatureTampered() {
        JwtUtil jwt = jwtAt(ISSUED_AT);
        String token = jwt.issueToken(USER_ID, "user@example.com").getValue();

        int signatureStart = token.lastIndexOf('.') + 1;
        char original = token.charAt(signatureStart);
        char replacement = original == 'A' ? 'B' : 'A';
        String tampered = token.substring(0, signatureStart) + replacement + token.substring(signatureStart + 1);

        assertThat(jwt.verifyToken(tampered)).isEmpty();
    }

    @Test
    @DisplayName("verifyToken should reject a token whose payload was altered")
    void verifyToken_shouldReturnEmpty_whenPayloadTampered() {
        JwtUtil jwt = jwtAt(ISSUED_AT);
        String[] parts = jwt.issueToken(USER_ID, "user@example.com").getValue().split("\\.");
        String otherPayload = jwt.issueToken(UUID.randomUUID(), "other@example.com").getValue().split("\\.")[1];

        assertThat(jwt.verifyToken(parts[0] + "." + otherPayload + "." + parts[2])).isEmpty();
    }

    @Test
    @DisplayName("verifyToken should reject a token signed with another secret")
    void verifyToken_shouldReturnEmpty_whenSignedWithOtherSecret() {
        AuthProperties other = TestAuthProperties.create();
        other.getJwt().setSecret("a-completely-different-secret-0123456789-xyz");
        String token = jwtAt(other, ISSUED_AT).issueToken(USER_ID, "user@example.com").getValue();

        assertThat(jwtAt(ISSUED_AT).verifyToken(token)).isEmpty();
    }

    @Test
    @DisplayName("verifyToken should reject a token signed with a different algorithm than configured")
    void verifyToken_shouldReturnEmpty_whenAlgorithmDiffers() {
        String secret = "0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef";
        AuthProperties hs512 = TestAuthProperties.create();
        hs512.getJwt().setSecret(secret);
        hs512.getJwt().setAlgorithm("HS512");
        AuthProperties hs256 = TestAuthProperties.create();
        hs256.getJwt().setSecret(secret);

        String token = jwtAt(hs512, ISSUED_AT).issueToken(USER_ID, "user@example.com").getValue();

        assertThat(jwtAt(hs512, ISSUED_AT).verifyToken(token)).isPresent();
        assertThat(jwtAt(hs256, ISSUED_AT).verifyToken(token)).isEmpty();
    }

    @Test
    @DisplayName("verifyToken should reject malformed input without throwing")
    void verifyToken_shouldReturnEmpty_whenMalformed() {
        JwtUtil jwt = jwtAt(ISSUED_AT);

        assertThat(jwt.verifyToken(null)).isEmpty();
        assertThat(jwt.verifyToken("")).isEmpty();
        assertThat(jwt.verifyToken("not-a-token")).isEmpty();
        assertThat(jwt.verifyToken("a.b.c")).isEmpty();
    }

    @Test
    @DisplayName("issueToken should use the configured default lifetime")
    void issueToken_shouldUseDefaultTtl() {
        AuthProperties properties = TestAuthProperties.create();
        properties.getJwt().setExpireMinutes(90);
        JwtUtil jwt = jwtAt(properties, ISSUED_AT);

        TokenClaim claim = jwt.verifyToken(jwt.issueToken(USER_ID, "user@example.com").getValue()).orElseThrow();

        assertThat(jwt.getDefaultTtl()).isEqualTo(Duration.ofMinutes(90));
        assertThat(claim.getExpiresAt()).isEqualTo(ISSUED_AT.plus(Duration.ofMinutes(90)));
    }

    @Test
    @DisplayName("issueToken should reject a non-positive lifetime")
    void issueToken_shouldThrowException_whenTtlNotPositive() {
        JwtUtil jwt = jwtAt(ISSUED_AT);

        assertThatThrownBy(() -> jwt.issueToken(USER_ID, "user@example.com", Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> jwt.issueToken(USER_ID, "user@example.com", Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("issueToken should report exactly the iat and exp written into the token")
    void issueToken_shouldReportTimestampsOfTheToken_whenClockAdvances() {
        // first read sits just before a second boundary, later reads after it
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(
                Instant.parse("2024-03-01T12:00:00.900Z"),
                Instant.parse("2024-03-01T12:00:01.100Z"));
        JwtUtil jwt = new JwtUtil(TestAuthProperties.create(), clock);

        IssuedToken issued = jwt.issueToken(USER_ID, "user@example.com");
        TokenClaim claim = jwt.verifyToken(issued.getValue()).orElseThrow();

        assertThat(issued.getIssuedAt()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
        assertThat(issued.getExpiresAt()).isEqualTo(Instant.parse("2024-03-01T12:30:00Z"));
        assertThat(claim.getIssuedAt()).isEqualTo(issued.getIssuedAt());
        assertThat(claim.getExpiresAt()).isEqualTo(issued.getExpiresAt());
    }
}

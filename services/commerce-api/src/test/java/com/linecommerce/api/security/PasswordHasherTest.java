package com.linecommerce.api.security;

import com.linecommerce.api.TestAuthProperties;
import com.linecommerce.api.config.AuthProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PasswordHasher.
 * Uses low Argon2 costs; the format and verification logic do not depend on them.
 */
class PasswordHasherTest {

    private final PasswordHasher hasher = new PasswordHasher(TestAuthProperties.create());

    // ========================================
    // HASHING TESTS
    // ========================================

    @Test
    @DisplayName("hash should produce different credentials for the same password")
    void hash_shouldProduceDifferentCredentials_whenCalledTwiceWithSamePassword() {
        // Act
        String first = hasher.hash("SecurePass123!");
        String second = hasher.hash("SecurePass123!");

        // Assert: random salt
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    @DisplayName("hash should produce an Argon2id PHC string with the configured costs")
    void hash_shouldProduceArgon2idFormat_whenPasswordValid() {
        String credential = hasher.hash("ValidPass123!");

        assertThat(credential).startsWith("$argon2id$");
        assertThat(credential).contains("m=1024");
        assertThat(credential).contains("t=1");
        assertThat(credential).contains("p=1");
        assertThat(credential).doesNotContain("ValidPass123!");
    }

    @Test
    @DisplayName("hash should reject null and empty passwords")
    void hash_shouldThrowException_whenPasswordIsNullOrEmpty() {
        assertThatThrownBy(() -> hasher.hash(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Password cannot be null or empty");
        assertThatThrownBy(() -> hasher.hash(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ========================================
    // VERIFICATION TESTS
    // ========================================

    @Test
    @DisplayName("verify should accept the password the credential was made from")
    void verify_shouldReturnTrue_whenPasswordMatches() {
        String credential = hasher.hash("SecurePass123!");

        assertThat(hasher.verify("SecurePass123!", credential)).isTrue();
    }

    @Test
    @DisplayName("verify should reject any other password")
    void verify_shouldReturnFalse_whenPasswordDiffers() {
        String credential = hasher.hash("SecurePass123!");

        assertThat(hasher.verify("SecurePass123", credential)).isFalse();
        assertThat(hasher.verify("securepass123!", credential)).isFalse();
        assertThat(hasher.verify("", credential)).isFalse();
    }

    @Test
    @DisplayName("verify should treat missing or malformed credentials as a mismatch")
    void verify_shouldReturnFalse_whenCredentialInvalid() {
        assertThat(hasher.verify("SecurePass123!", null)).isFalse();
        assertThat(hasher.verify("SecurePass123!", "")).isFalse();
        assertThat(hasher.verify("SecurePass123!", "not-a-phc-string")).isFalse();
        assertThat(hasher.verify(null, hasher.hash("SecurePass123!"))).isFalse();
    }

    @Test
    @DisplayName("verify should still accept credentials hashed under other cost parameters")
    void verify_shouldReturnTrue_whenCredentialUsesOtherCosts() {
        AuthProperties stronger = TestAuthProperties.create();
        stronger.getPassword().setMemory(2048);
        stronger.getPassword().setIterations(2);
        String credential = new PasswordHasher(stronger).hash("SecurePass123!");

        assertThat(hasher.verify("SecurePass123!", credential)).isTrue();
    }
}

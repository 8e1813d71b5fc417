package com.linecommerce.api.security;

import com.linecommerce.api.config.AuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * PasswordHasher - One-way password hashing and verification using Argon2id.
 *
 * Argon2id is salted and memory-hard. The produced credential is a PHC string
 * that embeds the algorithm, its cost parameters and the salt:
 * <pre>
 * $argon2id$v=19$m=19456,t=2,p=1$&lt;salt&gt;$&lt;hash&gt;
 * </pre>
 * Verification therefore needs nothing but the stored string, and credentials
 * hashed under older parameters keep verifying after the configuration changes.
 *
 * Both operations are pure: no I/O, no shared mutable state. Cost is bounded
 * by the configured memory and iteration parameters.
 *
 * @see AuthProperties.Password for the cost parameters
 */
@Slf4j
@Component
public class PasswordHasher {

    private final Argon2PasswordEncoder encoder;

    public PasswordHasher(AuthProperties properties) {
        AuthProperties.Password params = properties.getPassword();
        this.encoder = new Argon2PasswordEncoder(
                params.getSaltLength(),
                params.getHashLength(),
                params.getParallelism(),
                params.getMemory(),
                params.getIterations());
    }

    /**
     * Hash a plaintext password with a fresh random salt.
     *
     * @param plaintext the password as entered by the user
     * @return PHC-formatted Argon2id credential
     * @throws IllegalArgumentException if the password is null or empty
     */
    public String hash(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        return encoder.encode(plaintext);
    }

    /**
     * Check a plaintext password against a stored credential.
     *
     * The hash comparison is constant-time. A null, empty or malformed
     * credential is a mismatch, never an error.
     *
     * @param plaintext the password to check
     * @param credential the stored PHC string
     * @return true only if the password hashes to the credential
     */
    public boolean verify(String plaintext, String credential) {
        if (plaintext == null || credential == null || credential.isEmpty()) {
            return false;
        }
        try {
            return encoder.matches(plaintext, credential);
        } catch (RuntimeException e) {
            log.warn("Stored password credential could not be parsed");
            return false;
        }
    }
}

package com.linecommerce.api.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * AuthProperties - Typed, validated view of the {@code auth.*} configuration tree.
 *
 * Bound once at start-up and handed to each component through its constructor,
 * so nothing in the authentication core reads configuration from ambient state.
 * A failed validation aborts start-up with the offending property named.
 *
 * Example (application.yml):
 * <pre>
 * auth:
 *   jwt:
 *     secret: ${JWT_SECRET_KEY}
 *     algorithm: HS256
 *     expire-minutes: 30
 *   oauth:
 *     google:
 *       client-id: ${GOOGLE_CLIENT_ID:}
 *       client-secret: ${GOOGLE_CLIENT_SECRET:}
 * </pre>
 *
 * @see ApplicationConfig for where the properties are enabled
 */
@Data
@Validated
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    @Valid
    @NotNull
    private Jwt jwt = new Jwt();

    @Valid
    @NotNull
    private Password password = new Password();

    @Valid
    @NotNull
    private OAuth oauth = new OAuth();

    /**
     * Session token signing settings.
     */
    @Data
    public static class Jwt {

        /**
         * Secrets that ship in sample files and tutorials. Compared case-insensitively.
         */
        static final List<String> WEAK_SECRETS = List.of(
                "your-secret-key-change-in-production",
                "dev-jwt-secret-key-not-for-production-use-only",
                "change-me",
                "secret",
                "password",
                "12345");

        /**
         * HMAC signing secret. Must be at least 32 bytes (UTF-8).
         */
        @NotBlank
        private String secret;

        @NotBlank
        @Pattern(regexp = "HS256|HS384|HS512", message = "must be one of HS256, HS384, HS512")
        private String algorithm = "HS256";

        /**
         * Token lifetime. Bounded to one day.
         */
        @Min(1)
        @Max(1440)
        private int expireMinutes = 30;

        @AssertTrue(message = "JWT secret key must be at least 32 bytes and long enough for the signing algorithm")
        public boolean isSecretLongEnough() {
            if (secret == null) {
                return true; // reported by @NotBlank
            }
            int length = secret.getBytes(StandardCharsets.UTF_8).length;
            return length >= 32 && length >= minimumKeyBytes();
        }

        @AssertTrue(message = "JWT secret key appears to be a default/weak value")
        public boolean isSecretNotWeak() {
            if (secret == null) {
                return true;
            }
            String candidate = secret.trim().toLowerCase(Locale.ROOT);
            return WEAK_SECRETS.stream().noneMatch(weak -> weak.toLowerCase(Locale.ROOT).equals(candidate));
        }

        public Duration getExpiry() {
            return Duration.ofMinutes(expireMinutes);
        }

        private int minimumKeyBytes() {
            if ("HS512".equals(algorithm)) {
                return 64;
            }
            if ("HS384".equals(algorithm)) {
                return 48;
            }
            return 32;
        }
    }

    /**
     * Argon2id cost parameters. Defaults follow the OWASP minimum for Argon2id
     * (19 MiB, 2 iterations, 1 lane).
     */
    @Data
    public static class Password {

        @Min(8)
        private int saltLength = 16;

        @Min(16)
        private int hashLength = 32;

        @Min(1)
        private int parallelism = 1;

        /** Memory cost in KiB. */
        @Min(8)
        private int memory = 19456;

        @Min(1)
        private int iterations = 2;
    }

    /**
     * Federated login settings. A provider is enabled only when both its client id
     * and client secret are present.
     */
    @Data
    public static class OAuth {

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(10);

        @Valid
        @NotNull
        private Provider google = Provider.google();

        @Valid
        @NotNull
        private Provider apple = Provider.apple();
    }

    /**
     * Client credentials and endpoints for one OAuth provider.
     */
    @Data
    public static class Provider {

        private String clientId;
        private String clientSecret;
        private String redirectUri;

        @NotBlank
        private String authorizationUri;

        @NotBlank
        private String tokenUri;

        /** Profile endpoint (Google). */
        private String userInfoUri;

        /** Profile attribute holding the provider's subject id (Google). */
        private String userNameAttribute;

        /** Signing keys of the identity token (Apple). */
        private String jwkSetUri;

        /** Expected {@code iss} of the identity token (Apple). */
        private String issuer;

        public boolean isConfigured() {
            return clientId != null && !clientId.isBlank()
                    && clientSecret != null && !clientSecret.isBlank();
        }

        static Provider google() {
            Provider provider = new Provider();
            provider.setAuthorizationUri("https://accounts.google.com/o/oauth2/auth");
            provider.setTokenUri("https://oauth2.googleapis.com/token");
            provider.setUserInfoUri("https://www.googleapis.com/oauth2/v2/userinfo");
            provider.setUserNameAttribute("id");
            return provider;
        }

        static Provider apple() {
            Provider provider = new Provider();
            provider.setAuthorizationUri("https://appleid.apple.com/auth/authorize");
            provider.setTokenUri("https://appleid.apple.com/auth/token");
            provider.setJwkSetUri("https://appleid.apple.com/auth/keys");
            provider.setIssuer("https://appleid.apple.com");
            return provider;
        }
    }
}

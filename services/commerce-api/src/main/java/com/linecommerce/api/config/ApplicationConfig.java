package com.linecommerce.api.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.security.oauth2.client.http.OAuth2ErrorResponseErrorHandler;
import org.springframework.security.oauth2.core.http.converter.OAuth2AccessTokenResponseHttpMessageConverter;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimNames;
import org.springframework.security.oauth2.jwt.JwtClaimValidator;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.List;

/**
 * General application configuration.
 *
 * Provides the shared infrastructure beans of the authentication core:
 * - the single authoritative {@link Clock} used for token timestamps
 * - the {@link RestTemplate} used for OAuth provider calls, with bounded timeouts
 * - the decoder that verifies Apple identity tokens against Apple's published keys
 */
@Configuration
@EnableConfigurationProperties(AuthProperties.class)
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * RestTemplate for OAuth provider endpoints. A provider that does not answer
     * within the configured timeouts fails the login attempt instead of hanging it.
     *
     * Carries the OAuth2 token response converter and error handler so it can back
     * the Spring Security token and userinfo clients.
     */
    @Bean
    public RestTemplate oauthRestTemplate(AuthProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) properties.getOauth().getConnectTimeout().toMillis());
        factory.setReadTimeout((int) properties.getOauth().getReadTimeout().toMillis());

        RestTemplate restTemplate = new RestTemplate(factory);
        restTemplate.getMessageConverters().add(0, new OAuth2AccessTokenResponseHttpMessageConverter());
        restTemplate.setErrorHandler(new OAuth2ErrorResponseErrorHandler());
        return restTemplate;
    }

    /**
     * Decoder for Apple identity tokens. Keys are fetched lazily from the JWK set
     * endpoint, so start-up does not depend on Apple being reachable.
     */
    @Bean
    public JwtDecoder appleIdentityTokenDecoder(AuthProperties properties, RestTemplate oauthRestTemplate) {
        AuthProperties.Provider apple = properties.getOauth().getApple();

        NimbusJwtDecoder decoder = NimbusJwtDecoder.withJwkSetUri(apple.getJwkSetUri())
                .restOperations(oauthRestTemplate)
                .build();

        String clientId = apple.getClientId();
        JwtClaimValidator<List<String>> audience = new JwtClaimValidator<>(
                JwtClaimNames.AUD, aud -> clientId != null && aud != null && aud.contains(clientId));
        decoder.setJwtValidator(new DelegatingOAuth2TokenValidator<Jwt>(
                JwtValidators.createDefaultWithIssuer(apple.getIssuer()), audience));

        return decoder;
    }
}

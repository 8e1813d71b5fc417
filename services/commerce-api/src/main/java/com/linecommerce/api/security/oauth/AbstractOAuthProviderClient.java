package com.linecommerce.api.security.oauth;

import com.linecommerce.api.config.AuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.client.endpoint.DefaultAuthorizationCodeTokenResponseClient;
import org.springframework.security.oauth2.client.endpoint.OAuth2AuthorizationCodeGrantRequest;
import org.springframework.security.oauth2.client.registration.ClientRegistration;
import org.springframework.security.oauth2.core.OAuth2AuthorizationException;
import org.springframework.security.oauth2.core.endpoint.OAuth2AccessTokenResponse;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationExchange;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationRequest;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationResponse;
import org.springframework.web.client.RestOperations;

import java.util.Map;

/**
 * Shared authorization-code plumbing on top of Spring Security's OAuth2 client.
 *
 * Each provider describes itself as a {@link ClientRegistration}; the authorization
 * URL is rendered from an {@link OAuth2AuthorizationRequest} and the code is
 * redeemed through {@link DefaultAuthorizationCodeTokenResponseClient}. Nothing
 * is kept in the HTTP session: the registration is built per call from
 * {@link AuthProperties.Provider}.
 */
@Slf4j
public abstract class AbstractOAuthProviderClient implements OAuthProviderClient {

    /**
     * Used as the registration redirect when none is configured. Only the
     * configured value is ever sent to a provider.
     */
    static final String DEFAULT_REDIRECT_URI = "{baseUrl}/login/oauth2/code/{registrationId}";

    protected final AuthProperties.Provider config;

    private final DefaultAuthorizationCodeTokenResponseClient tokenResponseClient;

    protected AbstractOAuthProviderClient(AuthProperties.Provider config, RestOperations restOperations) {
        this.config = config;
        this.tokenResponseClient = new DefaultAuthorizationCodeTokenResponseClient();
        this.tokenResponseClient.setRestOperations(restOperations);
    }

    @Override
    public boolean isConfigured() {
        return config.isConfigured();
    }

    /**
     * Registration for this provider. Only valid once the provider is configured.
     */
    protected abstract ClientRegistration clientRegistration();

    /**
     * Hook for provider-specific authorization URL parameters.
     */
    protected Map<String, Object> additionalAuthorizationParameters() {
        return Map.of();
    }

    @Override
    public String buildAuthorizationUrl(String state) {
        return authorizationRequest(clientRegistration(), state).getAuthorizationRequestUri();
    }

    /**
     * Redeem the authorization code at the provider's token endpoint.
     *
     * @param registration the provider registration
     * @param code authorization code from the callback
     * @return the token response
     * @throws OAuthExchangeException if the call fails or the response is unusable
     */
    protected OAuth2AccessTokenResponse exchangeCode(ClientRegistration registration, String code) {
        OAuth2AuthorizationResponse callback = OAuth2AuthorizationResponse.success(code)
                .redirectUri(registration.getRedirectUri())
                .build();
        OAuth2AuthorizationExchange exchange =
                new OAuth2AuthorizationExchange(authorizationRequest(registration, null), callback);

        try {
            return tokenResponseClient.getTokenResponse(new OAuth2AuthorizationCodeGrantRequest(registration, exchange));
        } catch (OAuth2AuthorizationException | IllegalArgumentException e) {
            log.warn("Token exchange with {} failed: {}", getProvider().getDisplayName(), e.getClass().getSimpleName());
            throw new OAuthExchangeException("Token exchange with " + getProvider().getDisplayName() + " failed", e);
        }
    }

    /**
     * @return the redirect URI to put in the registration, never empty
     */
    protected String registrationRedirectUri() {
        String configured = configuredRedirectUri();
        return configured != null ? configured : DEFAULT_REDIRECT_URI;
    }

    private OAuth2AuthorizationRequest authorizationRequest(ClientRegistration registration, String state) {
        return OAuth2AuthorizationRequest.authorizationCode()
                .authorizationUri(registration.getProviderDetails().getAuthorizationUri())
                .clientId(registration.getClientId())
                .redirectUri(configuredRedirectUri())
                .scopes(registration.getScopes())
                .state(state)
                .additionalParameters(additionalAuthorizationParameters())
                .build();
    }

    private String configuredRedirectUri() {
        String redirectUri = config.getRedirectUri();
        return redirectUri != null && !redirectUri.isBlank() ? redirectUri : null;
    }
}

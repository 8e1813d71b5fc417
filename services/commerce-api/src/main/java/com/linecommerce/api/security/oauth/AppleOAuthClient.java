package com.linecommerce.api.security.oauth;

import com.linecommerce.api.config.AuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.client.registration.ClientRegistration;
import org.springframework.security.oauth2.core.AuthorizationGrantType;
import org.springframework.security.oauth2.core.ClientAuthenticationMethod;
import org.springframework.security.oauth2.core.endpoint.OAuth2AccessTokenResponse;
import org.springframework.security.oauth2.core.oidc.endpoint.OidcParameterNames;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * AppleOAuthClient - Sign in with Apple through the authorization-code flow.
 *
 * Apple has no userinfo endpoint. The identity comes from the {@code id_token}
 * returned by the token endpoint, and that token is only trusted after its
 * signature has been checked against Apple's published JWK set and its
 * issuer, audience (our client id) and expiry have been validated.
 *
 * Apple posts the callback as a form ({@code response_mode=form_post}).
 */
@Slf4j
@Component
public class AppleOAuthClient extends AbstractOAuthProviderClient {

    private final JwtDecoder identityTokenDecoder;

    public AppleOAuthClient(AuthProperties properties, RestTemplate oauthRestTemplate, JwtDecoder appleIdentityTokenDecoder) {
        super(properties.getOauth().getApple(), oauthRestTemplate);
        this.identityTokenDecoder = appleIdentityTokenDecoder;
    }

    @Override
    public OAuthProvider getProvider() {
        return OAuthProvider.APPLE;
    }

    @Override
    protected ClientRegistration clientRegistration() {
        return ClientRegistration.withRegistrationId(getProvider().getId())
                .clientName(getProvider().getDisplayName())
                .clientId(config.getClientId())
                .clientSecret(config.getClientSecret())
                .clientAuthenticationMethod(ClientAuthenticationMethod.CLIENT_SECRET_POST)
                .authorizationGrantType(AuthorizationGrantType.AUTHORIZATION_CODE)
                .redirectUri(registrationRedirectUri())
                .scope("name", "email")
                .authorizationUri(config.getAuthorizationUri())
                .tokenUri(config.getTokenUri())
                .jwkSetUri(config.getJwkSetUri())
                .issuerUri(config.getIssuer())
                .build();
    }

    @Override
    protected Map<String, Object> additionalAuthorizationParameters() {
        return Map.of("response_mode", "form_post");
    }

    @Override
    public OAuthUserInfo fetchUserInfo(String code) {
        OAuth2AccessTokenResponse tokens = exchangeCode(clientRegistration(), code);

        Object idToken = tokens.getAdditionalParameters().get(OidcParameterNames.ID_TOKEN);
        if (!(idToken instanceof String) || ((String) idToken).isBlank()) {
            throw new OAuthExchangeException("Apple token response is missing 'id_token'");
        }

        Jwt verified;
        try {
            verified = identityTokenDecoder.decode((String) idToken);
        } catch (JwtException e) {
            log.warn("Apple identity token rejected: {}", e.getClass().getSimpleName());
            throw new OAuthExchangeException("Apple identity token could not be verified", e);
        }

        return new AppleOAuthUserInfo(verified.getClaims());
    }
}

package com.linecommerce.api.security.oauth;

import com.linecommerce.api.config.AuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.config.oauth2.client.CommonOAuth2Provider;
import org.springframework.security.oauth2.client.registration.ClientRegistration;
import org.springframework.security.oauth2.client.userinfo.DefaultOAuth2UserService;
import org.springframework.security.oauth2.client.userinfo.OAuth2UserRequest;
import org.springframework.security.oauth2.core.ClientAuthenticationMethod;
import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.security.oauth2.core.endpoint.OAuth2AccessTokenResponse;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * GoogleOAuthClient - Google sign-in through the authorization-code flow.
 *
 * Flow:
 * 1. Browser is sent to the authorization URL (scope "openid email profile")
 * 2. Google redirects back with a code
 * 3. The code is exchanged for an access token at the token endpoint
 * 4. The access token is used once against the userinfo endpoint
 *
 * Starts from {@link CommonOAuth2Provider#GOOGLE}; endpoints can be overridden
 * under auth.oauth.google.*.
 */
@Slf4j
@Component
public class GoogleOAuthClient extends AbstractOAuthProviderClient {

    private final DefaultOAuth2UserService userService;

    public GoogleOAuthClient(AuthProperties properties, RestTemplate oauthRestTemplate) {
        super(properties.getOauth().getGoogle(), oauthRestTemplate);
        this.userService = new DefaultOAuth2UserService();
        this.userService.setRestOperations(oauthRestTemplate);
    }

    @Override
    public OAuthProvider getProvider() {
        return OAuthProvider.GOOGLE;
    }

    @Override
    protected ClientRegistration clientRegistration() {
        return CommonOAuth2Provider.GOOGLE.getBuilder(getProvider().getId())
                .clientId(config.getClientId())
                .clientSecret(config.getClientSecret())
                .clientAuthenticationMethod(ClientAuthenticationMethod.CLIENT_SECRET_POST)
                .redirectUri(registrationRedirectUri())
                .scope("openid", "email", "profile")
                .authorizationUri(config.getAuthorizationUri())
                .tokenUri(config.getTokenUri())
                .userInfoUri(config.getUserInfoUri())
                .userNameAttributeName(config.getUserNameAttribute())
                .build();
    }

    @Override
    public OAuthUserInfo fetchUserInfo(String code) {
        ClientRegistration registration = clientRegistration();
        OAuth2AccessTokenResponse tokens = exchangeCode(registration, code);

        OAuth2User user;
        try {
            user = userService.loadUser(new OAuth2UserRequest(
                    registration, tokens.getAccessToken(), tokens.getAdditionalParameters()));
        } catch (OAuth2AuthenticationException | IllegalArgumentException e) {
            log.warn("Google userinfo request failed: {}", e.getClass().getSimpleName());
            throw new OAuthExchangeException("Google userinfo request failed", e);
        }

        return new GoogleOAuthUserInfo(user.getAttributes());
    }
}

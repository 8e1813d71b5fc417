package com.linecommerce.api.security.oauth;

/**
 * Client side of one OAuth provider's authorization-code flow.
 *
 * <p>Implementations make exactly one attempt per call; nothing is retried.
 */
public interface OAuthProviderClient {

    /**
     * @return the provider this client talks to
     */
    OAuthProvider getProvider();

    /**
     * @return true when client id and secret are both configured
     */
    boolean isConfigured();

    /**
     * Build the URL the browser is sent to in order to sign in.
     *
     * @param state opaque value the provider echoes back on the callback
     * @return absolute authorization URL
     */
    String buildAuthorizationUrl(String state);

    /**
     * Exchange an authorization code and obtain the signed-in identity.
     *
     * @param code authorization code from the callback
     * @return the identity as reported by the provider
     * @throws OAuthExchangeException on network, timeout, HTTP or decoding failure
     */
    OAuthUserInfo fetchUserInfo(String code);
}

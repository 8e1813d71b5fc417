package com.linecommerce.api.security.oauth;

/**
 * Provider-agnostic view of the identity returned by an OAuth provider.
 *
 * <p>Implementations map provider-specific attribute names (Google's profile
 * endpoint, Apple's identity token claims) onto the fields the account
 * resolver needs.
 */
public interface OAuthUserInfo {

    /**
     * @return which provider issued this identity
     */
    OAuthProvider getProvider();

    /**
     * @return the provider's stable subject identifier for the user
     */
    String getId();

    /**
     * @return the user's email address, or null if the provider did not disclose it
     */
    String getEmail();

    /**
     * @return the user's display name, or null
     */
    String getName();

    /**
     * @return URL of the user's profile picture, or null
     */
    String getImageUrl();
}

package com.linecommerce.api.security.oauth;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Supported federated identity providers.
 *
 * The {@link #getId() id} is the value stored in {@code users.oauth_provider}
 * and used in request paths ("/api/auth/google").
 */
@Getter
@RequiredArgsConstructor
public enum OAuthProvider {

    GOOGLE("google", "Google"),
    APPLE("apple", "Apple");

    private final String id;

    private final String displayName;
}

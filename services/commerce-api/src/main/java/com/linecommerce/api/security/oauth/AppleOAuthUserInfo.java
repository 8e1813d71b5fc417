package com.linecommerce.api.security.oauth;

import java.util.Map;

/**
 * Apple user information, taken from the claims of a verified identity token.
 *
 * <p>Apple has no profile endpoint and never puts a picture in the token; the
 * name is only present when the client forwarded it.
 */
public class AppleOAuthUserInfo implements OAuthUserInfo {

    private final Map<String, Object> claims;

    public AppleOAuthUserInfo(Map<String, Object> claims) {
        this.claims = claims;
    }

    @Override
    public OAuthProvider getProvider() {
        return OAuthProvider.APPLE;
    }

    @Override
    public String getId() {
        Object sub = claims.get("sub");
        return sub != null ? sub.toString() : null;
    }

    @Override
    public String getEmail() {
        Object email = claims.get("email");
        return email instanceof String ? (String) email : null;
    }

    @Override
    public String getName() {
        Object name = claims.get("name");
        return name instanceof String ? (String) name : null;
    }

    @Override
    public String getImageUrl() {
        return null;
    }
}

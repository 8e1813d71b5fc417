package com.linecommerce.api.security.oauth;

import java.util.Map;

/**
 * Google user information as returned by the userinfo endpoint.
 *
 * <p>The v2 endpoint returns:
 * <ul>
 *   <li>id - The unique Google user ID ("sub" on the OpenID Connect endpoint)</li>
 *   <li>email - The user's email address</li>
 *   <li>name - The user's full name</li>
 *   <li>picture - The user's profile picture URL</li>
 * </ul>
 *
 * @see <a href="https://developers.google.com/identity/protocols/oauth2/openid-connect#obtainuserinfo">Google OpenID Connect</a>
 */
public class GoogleOAuthUserInfo implements OAuthUserInfo {

    private final Map<String, Object> attributes;

    public GoogleOAuthUserInfo(Map<String, Object> attributes) {
        this.attributes = attributes;
    }

    @Override
    public OAuthProvider getProvider() {
        return OAuthProvider.GOOGLE;
    }

    @Override
    public String getId() {
        Object id = attributes.get("id");
        if (id == null) {
            id = attributes.get("sub");
        }
        return id != null ? id.toString() : null;
    }

    @Override
    public String getEmail() {
        return stringAttribute("email");
    }

    @Override
    public String getName() {
        return stringAttribute("name");
    }

    @Override
    public String getImageUrl() {
        return stringAttribute("picture");
    }

    /**
     * A member of any other JSON type reads as absent.
     */
    private String stringAttribute(String name) {
        Object value = attributes.get(name);
        return value instanceof String ? (String) value : null;
    }
}

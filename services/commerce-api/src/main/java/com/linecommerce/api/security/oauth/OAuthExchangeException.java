package com.linecommerce.api.security.oauth;

/**
 * Failure while talking to an OAuth provider or interpreting its answer.
 */
public class OAuthExchangeException extends RuntimeException {

    public OAuthExchangeException(String message) {
        super(message);
    }

    public OAuthExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.linecommerce.api.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * AuthErrorKind - Closed set of outcomes an authentication request can be rejected with.
 *
 * Several kinds deliberately cover more than one cause so that callers cannot
 * tell them apart:
 * - INVALID_CREDENTIALS: unknown email, account without a password, wrong password
 * - OAUTH_FAILED: network error, timeout, malformed provider response, missing email, store conflict
 * - TOKEN_INVALID: bad signature, malformed token, expired token
 *
 * Each kind carries a fixed message; no collaborator detail is ever appended.
 */
@Getter
@RequiredArgsConstructor
public enum AuthErrorKind {

    DUPLICATE_ACCOUNT("duplicate_account", HttpStatus.BAD_REQUEST, "User with this email already exists"),
    INVALID_CREDENTIALS("invalid_credentials", HttpStatus.UNAUTHORIZED, "Invalid email or password"),
    ACCOUNT_DISABLED("account_disabled", HttpStatus.UNAUTHORIZED, "User account is disabled"),
    OAUTH_NOT_CONFIGURED("oauth_not_configured", HttpStatus.NOT_IMPLEMENTED, "OAuth provider is not configured"),
    OAUTH_FAILED("oauth_failed", HttpStatus.BAD_REQUEST, "OAuth authentication failed"),
    TOKEN_INVALID("token_invalid", HttpStatus.UNAUTHORIZED, "Could not validate credentials"),
    NOT_FOUND("not_found", HttpStatus.UNAUTHORIZED, "Could not validate credentials");

    /** Stable machine-readable code returned to clients. */
    private final String code;

    private final HttpStatus status;

    private final String message;
}

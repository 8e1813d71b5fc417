package com.linecommerce.api.exception;

import lombok.Getter;

/**
 * Terminal rejection of an authentication request.
 *
 * The message is always the fixed message of the {@link AuthErrorKind}. A cause
 * may be attached for server-side logging but is never exposed to the caller.
 */
@Getter
public class AuthException extends RuntimeException {

    private final AuthErrorKind kind;

    public AuthException(AuthErrorKind kind) {
        super(kind.getMessage());
        this.kind = kind;
    }

    public AuthException(AuthErrorKind kind, Throwable cause) {
        super(kind.getMessage(), cause);
        this.kind = kind;
    }
}

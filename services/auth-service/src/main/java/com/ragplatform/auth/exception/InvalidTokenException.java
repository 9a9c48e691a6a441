package com.ragplatform.auth.exception;

/**
 * Bearer token rejected. The {@link TokenFailureReason} is logged, never returned.
 */
public class InvalidTokenException extends IdentityException {

    private final TokenFailureReason reason;

    public InvalidTokenException(TokenFailureReason reason, String message) {
        super(ErrorCode.INVALID_TOKEN, message);
        this.reason = reason;
    }

    public InvalidTokenException(TokenFailureReason reason, String message, Throwable cause) {
        super(ErrorCode.INVALID_TOKEN, message, cause);
        this.reason = reason;
    }

    public TokenFailureReason getReason() {
        return reason;
    }
}

package com.ragplatform.auth.exception;

/**
 * Base class for identity failures. The {@link ErrorCode} decides what the
 * caller sees; the exception message may carry more detail for the logs.
 */
public class IdentityException extends RuntimeException {

    private final ErrorCode errorCode;

    public IdentityException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    public IdentityException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public IdentityException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}

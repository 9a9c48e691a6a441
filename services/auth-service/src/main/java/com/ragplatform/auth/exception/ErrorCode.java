package com.ragplatform.auth.exception;

/**
 * Caller-visible failure kinds, each with its HTTP status and the message
 * returned in the response body.
 */
public enum ErrorCode {

    // 400 Bad Request
    INCORRECT_CREDENTIALS("INCORRECT_CREDENTIALS", 400, "Incorrect username or password"),

    // 401 Unauthorized
    NOT_AUTHENTICATED("NOT_AUTHENTICATED", 401, "Not authenticated"),
    INVALID_TOKEN("INVALID_TOKEN", 401, "Could not validate credentials"),

    // 403 Forbidden
    INSUFFICIENT_ROLE("INSUFFICIENT_ROLE", 403, "Insufficient role"),

    // 500 Internal Server Error
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", 500, "Service is misconfigured");

    private final String code;
    private final int httpStatus;
    private final String defaultMessage;

    ErrorCode(String code, int httpStatus, String defaultMessage) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}

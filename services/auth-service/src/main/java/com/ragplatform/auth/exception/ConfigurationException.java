package com.ragplatform.auth.exception;

/**
 * Invalid startup configuration, e.g. a missing signing secret.
 */
public class ConfigurationException extends IdentityException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, message, cause);
    }
}

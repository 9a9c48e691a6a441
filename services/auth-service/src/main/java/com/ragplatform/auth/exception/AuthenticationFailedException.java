package com.ragplatform.auth.exception;

/**
 * Login-time failure. Raised identically for an unknown identifier and for a
 * wrong password.
 */
public class AuthenticationFailedException extends IdentityException {

    public AuthenticationFailedException() {
        super(ErrorCode.INCORRECT_CREDENTIALS);
    }
}

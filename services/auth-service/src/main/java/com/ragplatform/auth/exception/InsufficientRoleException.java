package com.ragplatform.auth.exception;

/**
 * The principal is authenticated but holds none of the required roles.
 */
public class InsufficientRoleException extends IdentityException {

    public InsufficientRoleException(String message) {
        super(ErrorCode.INSUFFICIENT_ROLE, message);
    }
}

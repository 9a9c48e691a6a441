package com.ragplatform.auth.exception;

/**
 * Why a bearer token was rejected. Logged, never returned to the caller.
 */
public enum TokenFailureReason {

    /** Empty, unparsable, unsigned, bad signature, unexpected algorithm or no expiry. */
    MALFORMED,

    /** Signature is valid but the current instant is at or past {@code exp}. */
    EXPIRED,

    /** Signature and expiry are valid but there is no usable {@code sub} claim. */
    INVALID_SUBJECT
}

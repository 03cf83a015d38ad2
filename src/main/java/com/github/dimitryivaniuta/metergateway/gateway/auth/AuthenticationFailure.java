package com.github.dimitryivaniuta.metergateway.gateway.auth;

import com.github.dimitryivaniuta.metergateway.gateway.error.ErrorCode;

public enum AuthenticationFailure {
    /** No bearer credentials were presented at all. */
    MISSING(ErrorCode.AUTHENTICATION_REQUIRED),
    /** Token cannot be parsed. */
    MALFORMED(ErrorCode.TOKEN_MALFORMED),
    /** Authentication tag mismatch: the token was tampered with or issued under another key. */
    SIGNATURE_INVALID(ErrorCode.TOKEN_SIGNATURE_INVALID),
    /** Authentic token past its expiry; the caller has to log in again. */
    EXPIRED(ErrorCode.TOKEN_EXPIRED);

    private final ErrorCode errorCode;

    AuthenticationFailure(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}

package com.github.dimitryivaniuta.metergateway.gateway.error;

/**
 * Stable error codes written into the {@code error_code} field of the error envelope.
 */
public enum ErrorCode {
    AUTHENTICATION_REQUIRED,
    TOKEN_MALFORMED,
    TOKEN_SIGNATURE_INVALID,
    TOKEN_EXPIRED,
    AUTHENTICATION_FAILED,
    RATE_LIMIT_EXCEEDED,
    PORTAL_UNAVAILABLE,
    VALIDATION_ERROR,
    NOT_FOUND,
    INTERNAL_ERROR
}

package com.github.dimitryivaniuta.metergateway.gateway.error;

import lombok.Getter;

import java.util.Objects;

/**
 * Base type for per-request rejections that the boundary translates into the error envelope.
 */
@Getter
public abstract class GatewayException extends RuntimeException {

    private final ErrorCode errorCode;

    protected GatewayException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    protected GatewayException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }
}

package com.github.dimitryivaniuta.metergateway.gateway.auth;

import com.github.dimitryivaniuta.metergateway.gateway.error.GatewayException;
import lombok.Getter;

@Getter
public class GatewayAuthenticationException extends GatewayException {

    private final AuthenticationFailure reason;

    public GatewayAuthenticationException(AuthenticationFailure reason, String message) {
        super(reason.errorCode(), message);
        this.reason = reason;
    }

    public GatewayAuthenticationException(AuthenticationFailure reason, String message, Throwable cause) {
        super(reason.errorCode(), message, cause);
        this.reason = reason;
    }
}

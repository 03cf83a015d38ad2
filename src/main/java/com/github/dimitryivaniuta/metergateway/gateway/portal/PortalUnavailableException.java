package com.github.dimitryivaniuta.metergateway.gateway.portal;

import com.github.dimitryivaniuta.metergateway.gateway.error.ErrorCode;
import com.github.dimitryivaniuta.metergateway.gateway.error.GatewayException;

public class PortalUnavailableException extends GatewayException {

    public PortalUnavailableException(String message) {
        super(ErrorCode.PORTAL_UNAVAILABLE, message);
    }

    public PortalUnavailableException(String message, Throwable cause) {
        super(ErrorCode.PORTAL_UNAVAILABLE, message, cause);
    }
}

package com.github.dimitryivaniuta.metergateway.gateway.portal;

import com.github.dimitryivaniuta.metergateway.gateway.error.ErrorCode;
import com.github.dimitryivaniuta.metergateway.gateway.error.GatewayException;

public class PortalLoginException extends GatewayException {

    public PortalLoginException(String message) {
        super(ErrorCode.AUTHENTICATION_FAILED, message);
    }
}

package com.github.dimitryivaniuta.metergateway.gateway.error;

/**
 * Fatal misconfiguration detected at startup. Never thrown on the request path.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

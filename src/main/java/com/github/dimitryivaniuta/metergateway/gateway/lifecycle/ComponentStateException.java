package com.github.dimitryivaniuta.metergateway.gateway.lifecycle;

import lombok.Getter;

/**
 * Thrown when a component is used outside its READY state.
 */
@Getter
public class ComponentStateException extends IllegalStateException {

    public enum Reason {
        NOT_INITIALIZED,
        CLOSED
    }

    private final String component;
    private final Reason reason;

    public ComponentStateException(String component, Reason reason) {
        super(component + (reason == Reason.CLOSED ? " is closed" : " is not initialized"));
        this.component = component;
        this.reason = reason;
    }
}

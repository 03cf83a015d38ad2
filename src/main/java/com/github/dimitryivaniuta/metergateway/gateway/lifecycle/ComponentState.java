package com.github.dimitryivaniuta.metergateway.gateway.lifecycle;

/**
 * Lifecycle of a stateful gateway component. Transitions only move forward:
 * UNINITIALIZED -> READY -> CLOSED (or UNINITIALIZED -> CLOSED).
 */
public enum ComponentState {
    UNINITIALIZED,
    READY,
    CLOSED
}

package com.github.dimitryivaniuta.metergateway.gateway.lifecycle;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Small state holder shared by the stateful components (tier cache, rate limiter, scheduler).
 * Every public operation of the owner calls {@link #ensureReady()} first.
 */
public final class LifecycleGuard {

    private final String component;
    private final AtomicReference<ComponentState> state = new AtomicReference<>(ComponentState.UNINITIALIZED);

    public LifecycleGuard(String component) {
        this.component = Objects.requireNonNull(component, "component must not be null");
    }

    /**
     * @return true if this call moved the component to READY; false if it was already READY
     * @throws ComponentStateException if the component is already closed
     */
    public boolean markReady() {
        if (state.compareAndSet(ComponentState.UNINITIALIZED, ComponentState.READY)) {
            return true;
        }
        if (state.get() == ComponentState.CLOSED) {
            throw new ComponentStateException(component, ComponentStateException.Reason.CLOSED);
        }
        return false;
    }

    /**
     * @return true if this call closed the component; false if it was already closed
     */
    public boolean markClosed() {
        return state.getAndSet(ComponentState.CLOSED) != ComponentState.CLOSED;
    }

    public void ensureReady() {
        ComponentState current = state.get();
        if (current == ComponentState.READY) return;
        throw new ComponentStateException(component, current == ComponentState.CLOSED
                ? ComponentStateException.Reason.CLOSED
                : ComponentStateException.Reason.NOT_INITIALIZED);
    }

    public boolean isReady() {
        return state.get() == ComponentState.READY;
    }

    public ComponentState state() {
        return state.get();
    }
}

package com.tracewire.proxy.core.hooks;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Mutable state cell handed to a hook on every invocation. Owned by the proxy,
 * re-initialized on every start and cleared on stop.
 * <p>
 * A hook may be called from several pump threads at once; use
 * {@link #update(UnaryOperator)} for read-modify-write changes.
 * </p>
 */
public final class HookState {

    private final AtomicReference<Object> value = new AtomicReference<>();

    public HookState() {
    }

    public HookState(Object initial) {
        value.set(initial);
    }

    public Object get() {
        return value.get();
    }

    public void set(Object newValue) {
        value.set(newValue);
    }

    /**
     * Atomically replaces the state with the result of {@code updater}.
     *
     * @param updater Function of the current state, may be re-applied under contention.
     * @return The new state.
     */
    public Object update(UnaryOperator<Object> updater) {
        return value.updateAndGet(updater);
    }
}

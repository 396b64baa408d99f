package com.tracewire.proxy.core.hooks;

import com.tracewire.proxy.core.utils.ValueUtils;
import java.util.Map;
import java.util.Objects;

/**
 * A loaded hook together with its configured options, its initial state and
 * the state cell passed to it.
 *
 * @param <T> Hook type.
 */
public final class HookBinding<T> {

    private final String identifier;
    private final T hook;
    private final Map<String, Object> options;
    private final Object initialState;
    private final HookState state = new HookState();

    /**
     * @param identifier   Name the hook was configured with, used in log messages.
     * @param hook         The hook instance.
     * @param options      Options, copied; {@code null} means none.
     * @param initialState State restored on every {@link #resetState()}, copied.
     */
    public HookBinding(String identifier, T hook, Map<String, Object> options, Object initialState) {
        this.identifier = identifier;
        this.hook = Objects.requireNonNull(hook, "hook");
        this.options = ValueUtils.immutableCopy(options);
        this.initialState = ValueUtils.deepCopy(initialState);
    }

    /**
     * Wraps an in-process hook instance, using its class name as identifier.
     *
     * @param hook The hook.
     * @param <T>  Hook type.
     * @return A binding without options or initial state.
     */
    public static <T> HookBinding<T> of(T hook) {
        return new HookBinding<>(hook.getClass().getName(), hook, null, null);
    }

    public String identifier() {
        return identifier;
    }

    public T hook() {
        return hook;
    }

    public Map<String, Object> options() {
        return options;
    }

    public HookState state() {
        return state;
    }

    /**
     * @param sharedState State cell shared by all hooks of the proxy.
     * @param globals     Root globals.
     * @return The context passed to this hook on every call.
     */
    public HookContext context(HookState sharedState, Map<String, Object> globals) {
        return new HookContext(state, sharedState, options, globals);
    }

    /**
     * Restores a fresh copy of the initial state.
     */
    public void resetState() {
        state.set(ValueUtils.deepCopy(initialState));
    }

    public void clearState() {
        state.set(null);
    }
}

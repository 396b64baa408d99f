package com.tracewire.proxy.core.hooks;

import java.util.Map;

/**
 * Everything a hook receives besides the data it works on.
 *
 * @param state       State private to this hook, re-initialized on every start.
 * @param sharedState State shared by every hook of the proxy. Holds a fresh
 *                    concurrent map after every start and {@code null} while
 *                    the proxy is stopped.
 * @param options     Options configured for this hook, never {@code null}.
 * @param globals     Values of the root {@code globals} setting, never
 *                    {@code null}.
 */
public record HookContext(HookState state, HookState sharedState, Map<String, Object> options,
        Map<String, Object> globals) {
}

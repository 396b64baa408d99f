package com.tracewire.proxy.core.exceptions;

/**
 * Thrown when a chunk transform, trace observer or trace writer cannot be
 * resolved or instantiated from its configured identifier.
 */
public class HookException extends ConfigException {
    /**
     * @param message the detail message.
     */
    public HookException(String message) {
        super(message);
    }

    /**
     * @param message the detail message.
     * @param cause   the underlying reflection or service loading failure.
     */
    public HookException(String message, Throwable cause) {
        super(message, cause);
    }
}

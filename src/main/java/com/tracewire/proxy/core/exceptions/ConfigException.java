package com.tracewire.proxy.core.exceptions;

/**
 * Thrown when a proxy entry cannot be turned into a usable proxy definition,
 * e.g. an unparseable port or a malformed target address.
 */
public class ConfigException extends ProxyException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.tracewire.proxy.core.constants;

/**
 * Direction of a chunk relative to the proxy.
 */
public enum ProxyDirection {
    /**
     * Chunk read from the client and forwarded to a target.
     */
    CLIENT_TO_TARGET("=>"),

    /**
     * Chunk read from a target and (possibly) echoed back to the client.
     */
    TARGET_TO_CLIENT("<=");

    private final String arrow;

    ProxyDirection(String arrow) {
        this.arrow = arrow;
    }

    /**
     * @return The arrow used when rendering an entry as a single text line.
     */
    public String getArrow() {
        return arrow;
    }
}

package com.tracewire.proxy.core.proxy;

import com.tracewire.proxy.core.exceptions.ConfigException;
import com.tracewire.proxy.core.utils.ValueUtils;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Host and port of one outbound target.
 *
 * @param host Host name or address.
 * @param port TCP port.
 */
public record TargetAddress(String host, int port) {

    /** Host used when a target is given as a bare port. */
    public static final String LOOPBACK = "127.0.0.1";

    /** Port used when a target names only a host. */
    public static final int DEFAULT_PORT = 8080;

    public TargetAddress {
        if (host == null || host.isBlank()) {
            throw new ConfigException("Target host must not be empty");
        }
        if (port < 1 || port > 65535) {
            throw new ConfigException("Invalid target port " + port + " for host " + host);
        }
    }

    /**
     * Parses the {@code to} value of a proxy entry.
     * 
     * @param raw A single target or a collection of targets.
     * @return Targets in declaration order, never empty.
     * @throws ConfigException if no valid target is given or one is malformed.
     */
    public static List<TargetAddress> parseAll(Object raw) {
        List<TargetAddress> targets = new ArrayList<>();
        if (raw instanceof Collection<?> values) {
            for (Object value : values) {
                if (value != null) {
                    targets.add(parse(value));
                }
            }
        } else if (raw != null) {
            targets.add(parse(raw));
        }
        if (targets.isEmpty()) {
            throw new ConfigException("At least one target is required");
        }
        return List.copyOf(targets);
    }

    /**
     * Parses one target: an integer port on loopback, a digit-only string
     * (same), {@code host:port}, {@code [ipv6]:port}, or a bare host using
     * {@link #DEFAULT_PORT}.
     * 
     * @param raw The configured value.
     * @return The target.
     * @throws ConfigException if the value is malformed.
     */
    public static TargetAddress parse(Object raw) {
        Integer bare = ValueUtils.toInteger(raw);
        if (bare != null) {
            return new TargetAddress(LOOPBACK, bare);
        }
        if (!(raw instanceof String)) {
            throw new ConfigException("Unsupported target value: " + raw);
        }

        String value = ((String) raw).trim();
        if (value.isEmpty()) {
            throw new ConfigException("Target must not be empty");
        }

        String host = value;
        String portPart = null;
        if (value.startsWith("[")) {
            int end = value.indexOf(']');
            if (end < 0) {
                throw new ConfigException("Malformed IPv6 target: " + value);
            }
            host = value.substring(1, end);
            if (end + 1 < value.length()) {
                if (value.charAt(end + 1) != ':') {
                    throw new ConfigException("Malformed target: " + value);
                }
                portPart = value.substring(end + 2);
            }
        } else {
            int colon = value.lastIndexOf(':');
            if (colon >= 0 && value.indexOf(':') == colon) {
                host = value.substring(0, colon).trim();
                portPart = value.substring(colon + 1);
            }
        }

        int port = DEFAULT_PORT;
        if (portPart != null) {
            Integer parsed = ValueUtils.toInteger(portPart);
            if (parsed == null) {
                throw new ConfigException("Invalid port in target: " + value);
            }
            port = parsed;
        }
        if (host.isEmpty()) {
            host = LOOPBACK;
        }
        return new TargetAddress(host, port);
    }

    @Override
    public String toString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
}

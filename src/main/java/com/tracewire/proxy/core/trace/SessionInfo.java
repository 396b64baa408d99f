package com.tracewire.proxy.core.trace;

import java.time.Instant;
import java.util.UUID;

/**
 * Identity of one accepted client connection. Groups the trace entries of a
 * session.
 *
 * @param id   Random UUID.
 * @param time Time the client was accepted.
 */
public record SessionInfo(String id, Instant time) {

    public static SessionInfo newSession() {
        return new SessionInfo(UUID.randomUUID().toString(), Instant.now());
    }
}

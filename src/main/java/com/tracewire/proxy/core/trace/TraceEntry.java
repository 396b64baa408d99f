package com.tracewire.proxy.core.trace;

import com.tracewire.proxy.core.constants.ProxyDirection;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One chunk that passed (or failed to pass) through a proxy session.
 * Immutable: the chunk is copied on construction and on access.
 *
 * @param direction   Whether the chunk came from the client or from a target.
 * @param session     Session the chunk belongs to.
 * @param source      Endpoint the chunk was read from.
 * @param target      Endpoint the chunk was written to.
 * @param sourceIndex 0 for the client, the target's index otherwise.
 * @param targetIndex 0 for the client, the target's index otherwise.
 * @param chunk       Chunk after the transform, {@code null} if it was dropped.
 * @param chunkSend   Whether the chunk was actually written onward.
 * @param error       Message of the write error, if any.
 * @param time        Time the chunk was read.
 */
public record TraceEntry(ProxyDirection direction, SessionInfo session, SocketEndpoint source,
        SocketEndpoint target, int sourceIndex, int targetIndex, byte[] chunk, boolean chunkSend,
        String error, Instant time) {

    public TraceEntry {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(session, "session");
        chunk = chunk == null ? null : chunk.clone();
    }

    @Override
    public byte[] chunk() {
        return chunk == null ? null : chunk.clone();
    }

    /**
     * @return Length of the chunk, 0 when it was dropped.
     */
    public int chunkLength() {
        return chunk == null ? 0 : chunk.length;
    }

    /**
     * Key grouping entries of the same direction, endpoints and session.
     *
     * @return The grouping key.
     */
    public String groupKey() {
        return direction + "\n[" + sourceIndex + "] " + source + "\n[" + targetIndex + "] " + target
                + "\n" + session.id() + "\t" + session.time().toEpochMilli();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TraceEntry that)) {
            return false;
        }
        return sourceIndex == that.sourceIndex &&
               targetIndex == that.targetIndex &&
               chunkSend == that.chunkSend &&
               direction == that.direction &&
               Objects.equals(session, that.session) &&
               Objects.equals(source, that.source) &&
               Objects.equals(target, that.target) &&
               Arrays.equals(chunk, that.chunk) &&
               Objects.equals(error, that.error) &&
               Objects.equals(time, that.time);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(direction, session, source, target, sourceIndex, targetIndex, chunkSend, error, time);
        return 31 * result + Arrays.hashCode(chunk);
    }

    @Override
    public String toString() {
        return "TraceEntry[" + direction + " [" + sourceIndex + "] " + source + " -> [" + targetIndex + "] " + target
                + ", " + chunkLength() + " byte(s), send=" + chunkSend
                + (error != null ? ", error=" + error : "") + ", session=" + session.id() + "]";
    }
}

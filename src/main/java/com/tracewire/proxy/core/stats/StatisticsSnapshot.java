package com.tracewire.proxy.core.stats;

import com.tracewire.proxy.core.trace.TraceEntry;

/**
 * Point-in-time copy of a proxy's traffic statistics.
 *
 * @param bytesSent      Bytes written to targets.
 * @param chunksSent     Chunks written to targets.
 * @param bytesReceived  Bytes written back to clients.
 * @param chunksReceived Chunks written back to clients.
 * @param lastSent       Most recent client-to-target entry, may be {@code null}.
 * @param lastReceived   Most recent target-to-client entry, may be {@code null}.
 */
public record StatisticsSnapshot(long bytesSent, long chunksSent, long bytesReceived, long chunksReceived,
        TraceEntry lastSent, TraceEntry lastReceived) {

    public static StatisticsSnapshot empty() {
        return new StatisticsSnapshot(0, 0, 0, 0, null, null);
    }
}

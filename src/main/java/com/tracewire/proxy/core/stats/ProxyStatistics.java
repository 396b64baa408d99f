package com.tracewire.proxy.core.stats;

import com.tracewire.proxy.core.trace.TraceEntry;
import io.micrometer.core.instrument.Counter;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Traffic counters of one running period of a proxy. A fresh instance is
 * created on every start; the Micrometer counters it mirrors into live as long
 * as the proxy itself.
 */
public class ProxyStatistics {

    private final AtomicLong bytesSent = new AtomicLong();
    private final AtomicLong chunksSent = new AtomicLong();
    private final AtomicLong bytesReceived = new AtomicLong();
    private final AtomicLong chunksReceived = new AtomicLong();
    private final AtomicReference<TraceEntry> lastSent = new AtomicReference<>();
    private final AtomicReference<TraceEntry> lastReceived = new AtomicReference<>();

    private final Counter bytesSentCounter;
    private final Counter chunksSentCounter;
    private final Counter bytesReceivedCounter;
    private final Counter chunksReceivedCounter;

    /**
     * Creates statistics without meter mirroring.
     */
    public ProxyStatistics() {
        this(null, null, null, null);
    }

    /**
     * @param bytesSent      Meter for bytes written to targets, may be {@code null}.
     * @param chunksSent     Meter for chunks written to targets, may be {@code null}.
     * @param bytesReceived  Meter for bytes echoed to clients, may be {@code null}.
     * @param chunksReceived Meter for chunks echoed to clients, may be {@code null}.
     */
    public ProxyStatistics(Counter bytesSent, Counter chunksSent, Counter bytesReceived, Counter chunksReceived) {
        this.bytesSentCounter = bytesSent;
        this.chunksSentCounter = chunksSent;
        this.bytesReceivedCounter = bytesReceived;
        this.chunksReceivedCounter = chunksReceived;
    }

    /**
     * Accounts a client-to-target entry.
     * 
     * @param entry   The entry.
     * @param written Whether the chunk was written to the target.
     */
    public void recordSent(TraceEntry entry, boolean written) {
        lastSent.set(entry);
        if (written) {
            int length = entry.chunkLength();
            bytesSent.addAndGet(length);
            chunksSent.incrementAndGet();
            increment(bytesSentCounter, length);
            increment(chunksSentCounter, 1);
        }
    }

    /**
     * Accounts a target-to-client entry.
     * 
     * @param entry   The entry.
     * @param written Whether the chunk was echoed to the client.
     */
    public void recordReceived(TraceEntry entry, boolean written) {
        lastReceived.set(entry);
        if (written) {
            int length = entry.chunkLength();
            bytesReceived.addAndGet(length);
            chunksReceived.incrementAndGet();
            increment(bytesReceivedCounter, length);
            increment(chunksReceivedCounter, 1);
        }
    }

    public StatisticsSnapshot snapshot() {
        return new StatisticsSnapshot(bytesSent.get(), chunksSent.get(), bytesReceived.get(), chunksReceived.get(),
                lastSent.get(), lastReceived.get());
    }

    private static void increment(Counter counter, double amount) {
        if (counter != null) {
            counter.increment(amount);
        }
    }
}

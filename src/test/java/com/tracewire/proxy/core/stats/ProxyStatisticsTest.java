package com.tracewire.proxy.core.stats;

import com.tracewire.proxy.core.constants.ProxyDirection;
import com.tracewire.proxy.core.trace.SessionInfo;
import com.tracewire.proxy.core.trace.SocketEndpoint;
import com.tracewire.proxy.core.trace.TraceEntry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ProxyStatisticsTest {

    private static TraceEntry entry(ProxyDirection direction, int length) {
        return new TraceEntry(direction, SessionInfo.newSession(), new SocketEndpoint("127.0.0.1", 1),
                new SocketEndpoint("127.0.0.1", 2), 0, 0, length < 0 ? null : new byte[length], true, null,
                Instant.now());
    }

    @Test
    void newStatistics_areEmpty() {
        assertThat(new ProxyStatistics().snapshot()).isEqualTo(StatisticsSnapshot.empty());
    }

    @Test
    void record_countsOnlyWrittenChunksButRemembersLastEntry() {
        ProxyStatistics statistics = new ProxyStatistics();
        TraceEntry sent = entry(ProxyDirection.CLIENT_TO_TARGET, 10);
        TraceEntry notSent = entry(ProxyDirection.CLIENT_TO_TARGET, 4);
        TraceEntry received = entry(ProxyDirection.TARGET_TO_CLIENT, 7);

        statistics.recordSent(sent, true);
        statistics.recordSent(notSent, false);
        statistics.recordReceived(received, true);
        statistics.recordReceived(entry(ProxyDirection.TARGET_TO_CLIENT, -1), false);

        StatisticsSnapshot snapshot = statistics.snapshot();
        assertThat(snapshot.bytesSent()).isEqualTo(10);
        assertThat(snapshot.chunksSent()).isEqualTo(1);
        assertThat(snapshot.bytesReceived()).isEqualTo(7);
        assertThat(snapshot.chunksReceived()).isEqualTo(1);
        assertThat(snapshot.lastSent()).isEqualTo(notSent);
        assertThat(snapshot.lastReceived().chunk()).isNull();
    }

    @Test
    void record_mirrorsIntoMeters() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        Counter bytesSent = registry.counter("bytes.sent");
        Counter chunksSent = registry.counter("chunks.sent");
        Counter bytesReceived = registry.counter("bytes.received");
        Counter chunksReceived = registry.counter("chunks.received");
        ProxyStatistics statistics = new ProxyStatistics(bytesSent, chunksSent, bytesReceived, chunksReceived);

        statistics.recordSent(entry(ProxyDirection.CLIENT_TO_TARGET, 5), true);
        statistics.recordSent(entry(ProxyDirection.CLIENT_TO_TARGET, 5), true);
        statistics.recordReceived(entry(ProxyDirection.TARGET_TO_CLIENT, 3), true);

        assertThat(bytesSent.count()).isEqualTo(10.0);
        assertThat(chunksSent.count()).isEqualTo(2.0);
        assertThat(bytesReceived.count()).isEqualTo(3.0);
        assertThat(chunksReceived.count()).isEqualTo(1.0);
    }
}

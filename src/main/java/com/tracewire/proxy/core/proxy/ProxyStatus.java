package com.tracewire.proxy.core.proxy;

import com.tracewire.proxy.core.stats.StatisticsSnapshot;
import java.util.List;

/**
 * Point-in-time view of one proxy, as reported by the console and the admin
 * endpoint.
 */
public record ProxyStatus(String name, String description, int port, List<String> targets, String echo, boolean running,
        boolean tracing, int traceEntries, int sessions, StatisticsSnapshot statistics) {

    public ProxyStatus {
        targets = List.copyOf(targets);
    }

    /**
     * @param proxy The proxy.
     * @return Its current status.
     */
    public static ProxyStatus of(TcpProxy proxy) {
        List<String> targets = proxy.getDefinition().getTargets().stream().map(TargetAddress::toString).toList();
        var trace = proxy.getTrace();
        return new ProxyStatus(proxy.getName(), proxy.getDefinition().getDescription(), proxy.getPort(), targets,
                proxy.getDefinition().getEchoPolicy().toString(), proxy.isRunning(), trace != null,
                trace != null ? trace.size() : 0, proxy.getActiveSessions(), proxy.getStatistics());
    }

    /**
     * @return One console line.
     */
    public String describe() {
        return String.format("%-20s port=%-5d %-7s trace=%s sessions=%d sent=%d/%d received=%d/%d -> %s",
                "'" + name + "'", port, running ? "running" : "stopped",
                tracing ? "on(" + traceEntries + ")" : "off", sessions, statistics.chunksSent(),
                statistics.bytesSent(), statistics.chunksReceived(), statistics.bytesReceived(), targets);
    }
}

package com.tracewire.proxy.core.trace;

/**
 * Subscriber notified of every trace entry a proxy produces, whether or not a
 * trace is being recorded.
 */
@FunctionalInterface
public interface TraceListener {
    /**
     * @param entry     The new entry.
     * @param recording {@code true} if the entry was appended to an active trace.
     */
    void onTraceEntry(TraceEntry entry, boolean recording);
}

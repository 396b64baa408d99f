package com.tracewire.proxy.spi;

import com.tracewire.proxy.core.hooks.HookContext;
import com.tracewire.proxy.core.trace.TraceEntry;
import java.util.List;

/**
 * Receives every trace entry produced by a proxy, synchronously, right after
 * the entry was recorded.
 */
public interface TraceObserver {
    /**
     * @param entry      The new entry.
     * @param traceSoFar Entries of the active trace including {@code entry}, or
     *                   an empty list when no trace is being recorded. A
     *                   read-only view; copy it to keep it.
     * @param context    State cells, options and globals of this observer.
     */
    void onEntry(TraceEntry entry, List<TraceEntry> traceSoFar, HookContext context);
}

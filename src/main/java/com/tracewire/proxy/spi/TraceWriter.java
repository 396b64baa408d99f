package com.tracewire.proxy.spi;

import com.tracewire.proxy.core.hooks.HookContext;
import com.tracewire.proxy.core.trace.TraceEntry;
import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Persists or forwards a finished trace. Invoked once per trace stop.
 */
public interface TraceWriter {
    /**
     * @param trace   All entries of the stopped trace, unmodifiable.
     * @param context State cells, options and globals of this writer.
     * @return A stage completing once the trace has been written.
     */
    CompletionStage<Void> writeTrace(List<TraceEntry> trace, HookContext context);
}

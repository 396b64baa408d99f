package com.tracewire.proxy.core.hooks;

import com.tracewire.proxy.core.trace.TraceEntry;
import com.tracewire.proxy.core.trace.TraceRenderer;
import com.tracewire.proxy.spi.TraceObserver;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs every trace entry as one line. With the option {@code recordedOnly}
 * set, only entries that were appended to an active trace are logged.
 */
public class LoggingTraceObserver implements TraceObserver {

    private static final Logger log = LoggerFactory.getLogger(LoggingTraceObserver.class);

    @Override
    public void onEntry(TraceEntry entry, List<TraceEntry> traceSoFar, HookContext context) {
        boolean recordedOnly = Boolean.parseBoolean(String.valueOf(context.options().get("recordedOnly")));
        if (recordedOnly && traceSoFar.isEmpty()) {
            return;
        }
        log.info("{} {} byte(s) send={}{} session={}", TraceRenderer.describe(entry), entry.chunkLength(),
                entry.chunkSend(), entry.error() != null ? " error=" + entry.error() : "", entry.session().id());
    }
}

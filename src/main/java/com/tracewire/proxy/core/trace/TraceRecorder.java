package com.tracewire.proxy.core.trace;

import com.tracewire.proxy.core.hooks.HookBinding;
import com.tracewire.proxy.core.hooks.HookContext;
import com.tracewire.proxy.spi.TraceObserver;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates trace entries while a trace is active and fans every entry out
 * to the trace observer hook and to registered listeners.
 */
public class TraceRecorder {

    private static final Logger log = LoggerFactory.getLogger(TraceRecorder.class);

    private final AtomicReference<Trace> active = new AtomicReference<>();
    private final List<TraceListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Starts a new trace.
     *
     * @return The new active trace, or {@code null} if one is already active.
     */
    public Trace start() {
        Trace trace = new Trace();
        return active.compareAndSet(null, trace) ? trace : null;
    }

    /**
     * Detaches and freezes the active trace.
     *
     * @return The frozen trace, or {@code null} if none was active.
     */
    public Trace stop() {
        Trace trace = active.getAndSet(null);
        if (trace != null) {
            trace.freeze();
        }
        return trace;
    }

    public boolean isTracing() {
        return active.get() != null;
    }

    /**
     * @return The active trace, or {@code null}.
     */
    public Trace current() {
        return active.get();
    }

    /**
     * Records one entry. The entry is appended only if a trace is active at call
     * time; an entry racing a stop is dropped.
     *
     * @param entry    The entry.
     * @param observer Observer hook of the running proxy, may be {@code null}.
     * @param context  Context passed to the observer.
     */
    public void record(TraceEntry entry, HookBinding<TraceObserver> observer, HookContext context) {
        Trace trace = active.get();
        boolean recording = trace != null && trace.append(entry);

        if (observer != null) {
            List<TraceEntry> soFar = recording ? trace.view() : List.of();
            try {
                observer.hook().onEntry(entry, soFar, context);
            } catch (Exception e) {
                log.warn("Trace observer {} failed: {}", observer.identifier(), e.getMessage(), e);
            }
        }

        for (TraceListener listener : listeners) {
            try {
                listener.onTraceEntry(entry, recording);
            } catch (Exception e) {
                log.warn("Trace listener failed: {}", e.getMessage(), e);
            }
        }
    }

    public void addListener(TraceListener listener) {
        listeners.add(listener);
    }

    public void removeListener(TraceListener listener) {
        listeners.remove(listener);
    }
}

package com.tracewire.proxy.core.trace;

import java.time.Instant;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.RandomAccess;

/**
 * Ordered, append-only capture of trace entries between a trace start and a
 * trace stop. Once frozen, further appends are rejected.
 */
public final class Trace {

    private final List<TraceEntry> entries = new ArrayList<>();
    private final Instant startedAt;
    private Instant stoppedAt;

    public Trace() {
        this.startedAt = Instant.now();
    }

    /**
     * Appends an entry unless the trace has been frozen.
     *
     * @param entry The entry to append.
     * @return {@code false} if the trace no longer accepts entries.
     */
    public synchronized boolean append(TraceEntry entry) {
        if (stoppedAt != null) {
            return false;
        }
        entries.add(entry);
        return true;
    }

    /**
     * Detaches the trace from further appends. Freezing twice keeps the first
     * stop time.
     */
    synchronized void freeze() {
        if (stoppedAt == null) {
            stoppedAt = Instant.now();
        }
    }

    public synchronized boolean isActive() {
        return stoppedAt == null;
    }

    /**
     * @return An unmodifiable copy of the entries recorded so far.
     */
    public synchronized List<TraceEntry> getEntries() {
        return List.copyOf(entries);
    }

    /**
     * @return A read-only view of the entries recorded so far. The view does
     *         not copy them and keeps its size when more entries arrive.
     */
    public synchronized List<TraceEntry> view() {
        return new View(this, entries.size());
    }

    private synchronized TraceEntry entryAt(int index) {
        return entries.get(index);
    }

    public synchronized int size() {
        return entries.size();
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    /**
     * @return Stop time, {@code null} while the trace is active.
     */
    public synchronized Instant getStoppedAt() {
        return stoppedAt;
    }

    /**
     * Fixed-size window onto the first entries of a trace.
     */
    static final class View extends AbstractList<TraceEntry> implements RandomAccess {

        private final Trace trace;
        private final int size;

        private View(Trace trace, int size) {
            this.trace = trace;
            this.size = size;
        }

        Trace trace() {
            return trace;
        }

        @Override
        public TraceEntry get(int index) {
            if (index < 0 || index >= size) {
                throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + size);
            }
            return trace.entryAt(index);
        }

        @Override
        public int size() {
            return size;
        }
    }
}

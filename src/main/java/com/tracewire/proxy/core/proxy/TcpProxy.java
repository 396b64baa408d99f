package com.tracewire.proxy.core.proxy;

import com.tracewire.proxy.core.exceptions.ProxyException;
import com.tracewire.proxy.core.hooks.HookBinding;
import com.tracewire.proxy.core.hooks.HookContext;
import com.tracewire.proxy.core.hooks.HookState;
import com.tracewire.proxy.core.stats.ProxyStatistics;
import com.tracewire.proxy.core.stats.StatisticsSnapshot;
import com.tracewire.proxy.core.trace.Trace;
import com.tracewire.proxy.core.trace.TraceListener;
import com.tracewire.proxy.core.trace.TraceRecorder;
import com.tracewire.proxy.core.utils.IoUtils;
import com.tracewire.proxy.spi.TraceWriter;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TCP proxy bound to one source port.
 * <p>
 * Owns the listening socket, the sessions it accepted, the traffic statistics
 * and the trace. Each accepted connection becomes a {@link ProxySession} fanned
 * out to every configured target. Stopping the proxy only closes the listening
 * socket; accepted sessions drain on their own. {@link #close()} tears
 * everything down.
 * </p>
 */
public class TcpProxy implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TcpProxy.class);

    /** Maximum time {@link #toggleTrace()} waits for the trace writer. */
    private static final long TRACE_WRITER_TIMEOUT_SECONDS = 30;

    private final ProxyDefinition definition;
    private final MeterRegistry registry;
    private final ExecutorService executor;
    private final TraceRecorder recorder = new TraceRecorder();

    /** State shared by all hooks, reset on start and cleared on stop. */
    private final HookState sharedState = new HookState();
    private final HookContext transformContext;
    private final HookContext observerContext;
    private final HookContext writerContext;

    /** Sessions with at least one open socket. */
    private final Set<ProxySession> sessions = ConcurrentHashMap.newKeySet();

    private final Counter totalSessions;
    private final Counter connectionErrors;
    private final Counter bytesSent;
    private final Counter chunksSent;
    private final Counter bytesReceived;
    private final Counter chunksReceived;
    private final Meter activeGauge;

    private final Object lifecycleLock = new Object();
    private final Object traceLock = new Object();

    /** Present iff the proxy is running. */
    private volatile ServerSocket serverSocket;
    private volatile ProxyStatistics statistics;
    private boolean closed;

    /**
     * Creates a stopped proxy and registers its meters.
     * 
     * @param definition The proxy definition.
     * @param registry   The Micrometer meter registry.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public TcpProxy(ProxyDefinition definition, MeterRegistry registry) {
        this.definition = definition;
        this.registry = registry;
        this.executor = Executors.newCachedThreadPool(sessionThreads(definition.getPort()));
        this.transformContext = contextOf(definition.getChunkTransform());
        this.observerContext = contextOf(definition.getTraceObserver());
        this.writerContext = contextOf(definition.getTraceWriter());

        String port = String.valueOf(definition.getPort());
        String name = definition.getName().replace(" ", "_").toLowerCase();

        this.totalSessions = Counter.builder("proxy.sessions.total")
                .tag("port", port)
                .tag("name", name)
                .description("Total number of accepted client connections")
                .register(registry);

        this.connectionErrors = Counter.builder("proxy.connections.errors")
                .tag("port", port)
                .tag("name", name)
                .description("Total number of accept, connect and read errors")
                .register(registry);

        this.bytesSent = trafficCounter("proxy.bytes.sent", port, name, "Bytes written to targets");
        this.chunksSent = trafficCounter("proxy.chunks.sent", port, name, "Chunks written to targets");
        this.bytesReceived = trafficCounter("proxy.bytes.received", port, name, "Bytes written back to clients");
        this.chunksReceived = trafficCounter("proxy.chunks.received", port, name,
                "Chunks written back to clients");

        this.activeGauge = Gauge.builder("proxy.sessions.active", sessions, Set::size)
                .tag("port", port)
                .tag("name", name)
                .description("Current number of open sessions")
                .register(registry);

        this.statistics = newStatistics();
    }

    private Counter trafficCounter(String meterName, String port, String name, String description) {
        return Counter.builder(meterName)
                .tag("port", port)
                .tag("name", name)
                .description(description)
                .register(registry);
    }

    private HookContext contextOf(HookBinding<?> binding) {
        return binding == null ? null : binding.context(sharedState, definition.getGlobals());
    }

    private static ThreadFactory sessionThreads(int port) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "proxy-" + port + "-session-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Binds the source port and starts accepting clients.
     * <p>
     * On success the statistics are reset and every hook state is
     * re-initialized from its configured initial value.
     * </p>
     * 
     * @return {@code true} if the proxy was started, {@code false} if it was
     *         already running.
     * @throws ProxyException if the port cannot be bound or the proxy is closed.
     */
    public boolean start() {
        synchronized (lifecycleLock) {
            if (closed) {
                throw new ProxyException(getName() + " has been closed");
            }
            if (serverSocket != null) {
                log.info("{} is already running on port {}", getName(), getPort());
                return false;
            }

            ServerSocket socket = bind();
            ProxyStatistics runStatistics = newStatistics();
            statistics = runStatistics;
            resetHookStates();
            serverSocket = socket;

            ProxySession.Context context = new ProxySession.Context(definition, runStatistics, recorder, executor,
                    connectionErrors, transformContext, observerContext);
            Thread acceptor = new Thread(() -> acceptLoop(socket, context), "proxy-" + getPort() + "-acceptor");
            acceptor.setDaemon(true);
            acceptor.start();

            log.info("{} started on {}:{} -> {} (echo: {})", getName(),
                    definition.getBindAddress() != null ? definition.getBindAddress() : "0.0.0.0", getPort(),
                    definition.getTargets(), definition.getEchoPolicy());
            return true;
        }
    }

    private ServerSocket bind() {
        ServerSocket socket = null;
        try {
            socket = new ServerSocket();
            socket.setReuseAddress(true);
            InetSocketAddress bindAddr = definition.getBindAddress() != null
                    ? new InetSocketAddress(definition.getBindAddress(), getPort())
                    : new InetSocketAddress(getPort());
            socket.bind(bindAddr);
            return socket;
        } catch (IOException e) {
            IoUtils.closeQuietly(socket, "server socket");
            throw new ProxyException("Could not bind " + getName() + " to port " + getPort() + ": "
                    + e.getMessage(), e);
        }
    }

    private void acceptLoop(ServerSocket socket, ProxySession.Context context) {
        while (!socket.isClosed()) {
            try {
                Socket client = socket.accept();
                processClient(client, context);
            } catch (SocketException e) {
                if (socket.isClosed()) {
                    break;
                }
                connectionErrors.increment();
                log.error("{} accept error on port {}: {}", getName(), getPort(), e.getMessage());
            } catch (IOException e) {
                connectionErrors.increment();
                log.error("{} I/O error during accept on port {}: {}", getName(), getPort(), e.getMessage());
            }
        }
        log.debug("{} stopped accepting on port {}", getName(), getPort());
    }

    private void processClient(Socket client, ProxySession.Context context) {
        totalSessions.increment();
        try {
            client.setTcpNoDelay(true);
            if (definition.getIdleTimeout() > 0) {
                client.setSoTimeout(definition.getIdleTimeout());
            }
        } catch (SocketException e) {
            log.debug("{} failed to configure client socket: {}", getName(), e.getMessage());
        }

        ProxySession session = new ProxySession(client, context, sessions::remove);
        sessions.add(session);
        try {
            executor.execute(session);
        } catch (RejectedExecutionException e) {
            sessions.remove(session);
            IoUtils.closeQuietly(client, "rejected client socket");
            log.warn("{} rejected client: executor shut down", getName());
        }
    }

    /**
     * Closes the listening socket. Accepted sessions keep running until their
     * sockets close; hook states are cleared.
     * 
     * @return {@code true} if the proxy was stopped, {@code false} if it was
     *         not running.
     */
    public boolean stop() {
        synchronized (lifecycleLock) {
            ServerSocket socket = serverSocket;
            if (socket == null) {
                log.debug("{} is not running", getName());
                return false;
            }

            log.info("Stopping {} on port {}...", getName(), getPort());
            serverSocket = null;
            try {
                socket.close();
            } catch (IOException e) {
                log.error("{} failed to close server socket: {}", getName(), e.getMessage(), e);
            }
            clearHookStates();

            log.info("{} stopped ({} session(s) still draining)", getName(), sessions.size());
            return true;
        }
    }

    /**
     * Starts a trace if none is active, otherwise stops the active one and
     * hands it to the configured trace writer. Works whether or not the proxy
     * is running.
     * 
     * @return The new, active trace; or the stopped, frozen trace.
     */
    public Trace toggleTrace() {
        synchronized (traceLock) {
            if (!recorder.isTracing()) {
                Trace trace = recorder.start();
                log.info("Started tracing {}", getName());
                return trace;
            }

            Trace trace = recorder.stop();
            log.info("Stopped tracing {} ({} entries)", getName(), trace.size());
            writeTrace(trace);
            return trace;
        }
    }

    private void writeTrace(Trace trace) {
        HookBinding<TraceWriter> writer = definition.getTraceWriter();
        if (writer == null) {
            return;
        }
        try {
            CompletionStage<Void> stage = writer.hook().writeTrace(trace.getEntries(), writerContext);
            if (stage != null) {
                stage.toCompletableFuture().get(TRACE_WRITER_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while trace writer {} was running", writer.identifier());
        } catch (ExecutionException e) {
            log.warn("Trace writer {} failed: {}", writer.identifier(), e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            log.warn("Trace writer {} did not finish within {} s", writer.identifier(),
                    TRACE_WRITER_TIMEOUT_SECONDS);
        } catch (Exception e) {
            log.warn("Trace writer {} failed: {}", writer.identifier(), e.getMessage(), e);
        }
    }

    /**
     * Stops the proxy, closes every open session and releases the executor
     * and meters. A closed proxy cannot be started again.
     */
    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            stop();
            closed = true;
        }

        for (ProxySession session : sessions) {
            session.forceClose();
        }
        sessions.clear();

        registry.remove(totalSessions);
        registry.remove(connectionErrors);
        registry.remove(bytesSent);
        registry.remove(chunksSent);
        registry.remove(bytesReceived);
        registry.remove(chunksReceived);
        registry.remove(activeGauge);

        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("{} executor did not terminate cleanly after 5 s", getName());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private ProxyStatistics newStatistics() {
        return new ProxyStatistics(bytesSent, chunksSent, bytesReceived, chunksReceived);
    }

    private void resetHookStates() {
        sharedState.set(new ConcurrentHashMap<String, Object>());
        if (definition.getChunkTransform() != null) {
            definition.getChunkTransform().resetState();
        }
        if (definition.getTraceObserver() != null) {
            definition.getTraceObserver().resetState();
        }
        if (definition.getTraceWriter() != null) {
            definition.getTraceWriter().resetState();
        }
    }

    private void clearHookStates() {
        sharedState.set(null);
        if (definition.getChunkTransform() != null) {
            definition.getChunkTransform().clearState();
        }
        if (definition.getTraceObserver() != null) {
            definition.getTraceObserver().clearState();
        }
        if (definition.getTraceWriter() != null) {
            definition.getTraceWriter().clearState();
        }
    }

    /**
     * @return State cell shared by the hooks of this proxy.
     */
    public HookState getSharedState() {
        return sharedState;
    }

    public void addTraceListener(TraceListener listener) {
        recorder.addListener(listener);
    }

    public void removeTraceListener(TraceListener listener) {
        recorder.removeListener(listener);
    }

    public boolean isRunning() {
        return serverSocket != null;
    }

    public boolean isTracing() {
        return recorder.isTracing();
    }

    /**
     * @return The active trace, or {@code null} when not tracing.
     */
    public Trace getTrace() {
        return recorder.current();
    }

    /**
     * @return Statistics of the current (or last) running period.
     */
    public StatisticsSnapshot getStatistics() {
        return statistics.snapshot();
    }

    /**
     * @return Number of sessions with at least one open socket.
     */
    public int getActiveSessions() {
        return sessions.size();
    }

    List<ProxySession> getSessions() {
        return List.copyOf(sessions);
    }

    /**
     * @return The bound local port while running, otherwise the configured port.
     */
    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket != null ? socket.getLocalPort() : getPort();
    }

    public ProxyDefinition getDefinition() {
        return definition;
    }

    public String getName() {
        return definition.getName();
    }

    public int getPort() {
        return definition.getPort();
    }
}

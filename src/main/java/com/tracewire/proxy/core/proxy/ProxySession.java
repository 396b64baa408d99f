package com.tracewire.proxy.core.proxy;

import com.tracewire.proxy.core.constants.ProxyDirection;
import com.tracewire.proxy.core.hooks.HookBinding;
import com.tracewire.proxy.core.hooks.HookContext;
import com.tracewire.proxy.core.stats.ProxyStatistics;
import com.tracewire.proxy.core.trace.SessionInfo;
import com.tracewire.proxy.core.trace.TraceEntry;
import com.tracewire.proxy.core.trace.TraceRecorder;
import com.tracewire.proxy.core.utils.IoUtils;
import com.tracewire.proxy.spi.ChunkTransform;
import io.micrometer.core.instrument.Counter;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One accepted client connection fanned out to every configured target.
 * <p>
 * The session runs the client pump on its own thread and one pump per
 * connected target on the proxy's executor. Every chunk read is passed through
 * the chunk transform, written onward, and turned into a {@link TraceEntry}
 * handed to the statistics and the trace recorder. Errors stay within the leg
 * they happened on.
 * </p>
 * <p>
 * With an idle timeout configured, a leg whose read times out keeps reading
 * as long as any leg of the session has read data within the timeout.
 * </p>
 */
public class ProxySession implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ProxySession.class);

    /**
     * Per-run collaborators shared by all sessions accepted during one running
     * period of a proxy.
     */
    record Context(ProxyDefinition definition, ProxyStatistics statistics, TraceRecorder recorder,
            ExecutorService executor, Counter connectionErrors, HookContext transformContext,
            HookContext observerContext) {
    }

    private final SessionInfo info;
    private final Context context;
    private final SessionLeg client;
    private final Consumer<ProxySession> onClosed;
    private final AtomicInteger openLegs = new AtomicInteger(1);
    private volatile List<SessionLeg> targets = List.of();

    /** {@link System#nanoTime()} of the last chunk read on any leg. */
    private volatile long lastActivity = System.nanoTime();

    /**
     * @param clientSocket The accepted client socket.
     * @param context      Collaborators of the running proxy.
     * @param onClosed     Invoked once after every leg has closed.
     */
    ProxySession(Socket clientSocket, Context context, Consumer<ProxySession> onClosed) {
        this.info = SessionInfo.newSession();
        this.context = context;
        this.client = SessionLeg.connected(0, "client " + info.id(), clientSocket);
        this.onClosed = onClosed;
    }

    public SessionInfo getInfo() {
        return info;
    }

    /**
     * @return Target legs in declared order, empty until the connects settled.
     */
    List<SessionLeg> getTargets() {
        return targets;
    }

    @Override
    public void run() {
        log.debug("{} session {} opened by {}", context.definition().getName(), info.id(), client.endpoint());
        try {
            targets = connectTargets();
            startTargetPumps();
        } catch (RuntimeException e) {
            context.connectionErrors().increment();
            log.error("{} session {} failed to set up targets: {}", context.definition().getName(), info.id(),
                    e.getMessage(), e);
            client.close();
        }
        pumpClient();
    }

    /**
     * Closes every socket of the session without waiting for the peers.
     */
    void forceClose() {
        client.close();
        for (SessionLeg target : targets) {
            if (target.isConnected()) {
                target.close();
            }
        }
    }

    private List<SessionLeg> connectTargets() {
        List<TargetAddress> addresses = context.definition().getTargets();
        List<CompletableFuture<SessionLeg>> pending = new ArrayList<>(addresses.size());
        for (int i = 0; i < addresses.size(); i++) {
            int index = i;
            TargetAddress address = addresses.get(i);
            pending.add(CompletableFuture.supplyAsync(() -> connect(index, address), context.executor()));
        }

        List<SessionLeg> legs = new ArrayList<>(pending.size());
        for (CompletableFuture<SessionLeg> future : pending) {
            legs.add(future.join());
        }
        return Collections.unmodifiableList(legs);
    }

    private SessionLeg connect(int index, TargetAddress address) {
        String label = "target [" + index + "] " + address;
        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            if (context.definition().getIdleTimeout() > 0) {
                socket.setSoTimeout(context.definition().getIdleTimeout());
            }
            socket.connect(new InetSocketAddress(address.host(), address.port()),
                    context.definition().getConnectTimeout());
            return SessionLeg.connected(index, label, socket);
        } catch (IOException e) {
            IoUtils.closeQuietly(socket, label);
            context.connectionErrors().increment();
            log.error("{} session {} could not connect to {}: {}", context.definition().getName(), info.id(),
                    label, e.getMessage());
            return SessionLeg.inert(index, label, address);
        }
    }

    private void startTargetPumps() {
        for (SessionLeg target : targets) {
            if (!target.isConnected()) {
                continue;
            }
            openLegs.incrementAndGet();
            try {
                context.executor().execute(() -> pumpTarget(target));
            } catch (RejectedExecutionException e) {
                log.warn("{} session {} cannot pump {}: executor shut down", context.definition().getName(),
                        info.id(), target.label());
                target.close();
                legClosed();
            }
        }
    }

    private void pumpClient() {
        byte[] buffer = new byte[IoUtils.DEFAULT_BUFFER_SIZE];
        try {
            InputStream in = client.socket().getInputStream();
            byte[] chunk;
            while ((chunk = readNext(in, buffer, client)) != null) {
                forwardToTargets(chunk);
            }
        } catch (IOException e) {
            if (!client.socket().isClosed()) {
                log.debug("{} session {} client read error: {}", context.definition().getName(), info.id(),
                        e.getMessage());
            }
        } finally {
            client.close();
            legClosed();
        }
    }

    private void pumpTarget(SessionLeg target) {
        byte[] buffer = new byte[IoUtils.DEFAULT_BUFFER_SIZE];
        try {
            InputStream in = target.socket().getInputStream();
            byte[] chunk;
            while ((chunk = readNext(in, buffer, target)) != null) {
                echoToClient(target, chunk);
            }
        } catch (IOException e) {
            if (!target.socket().isClosed()) {
                context.connectionErrors().increment();
                log.debug("{} session {} read error on {}: {}", context.definition().getName(), info.id(),
                        target.label(), e.getMessage());
            }
        } finally {
            target.close();
            legClosed();
        }
    }

    /**
     * Reads the next chunk of a leg. A read timeout ends the leg only once the
     * whole session has been idle for the configured timeout.
     */
    private byte[] readNext(InputStream in, byte[] buffer, SessionLeg leg) throws IOException {
        while (true) {
            try {
                byte[] chunk = IoUtils.readChunk(in, buffer);
                if (chunk != null) {
                    lastActivity = System.nanoTime();
                }
                return chunk;
            } catch (SocketTimeoutException e) {
                long idleMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - lastActivity);
                if (idleMillis >= context.definition().getIdleTimeout()) {
                    log.debug("{} session {} idle for {} ms, ending {}", context.definition().getName(), info.id(),
                            idleMillis, leg.label());
                    return null;
                }
            }
        }
    }

    private void forwardToTargets(byte[] chunk) {
        Instant now = Instant.now();
        byte[] outgoing = transform(chunk);

        for (SessionLeg target : targets) {
            boolean sent = false;
            String error = null;
            if (outgoing != null) {
                try {
                    target.write(outgoing);
                    sent = true;
                } catch (IOException e) {
                    error = IoUtils.describe(e);
                    log.debug("{} session {} write to {} failed: {}", context.definition().getName(), info.id(),
                            target.label(), error);
                }
            }

            TraceEntry entry = new TraceEntry(ProxyDirection.CLIENT_TO_TARGET, info, client.endpoint(),
                    target.endpoint(), 0, target.index(), outgoing, sent, error, now);
            context.statistics().recordSent(entry, sent);
            context.recorder().record(entry, context.definition().getTraceObserver(), context.observerContext());
        }
    }

    private void echoToClient(SessionLeg target, byte[] chunk) {
        Instant now = Instant.now();
        byte[] outgoing = transform(chunk);

        boolean sent = false;
        String error = null;
        if (outgoing != null && context.definition().getEchoPolicy().includes(target.index())) {
            try {
                client.write(outgoing);
                sent = true;
            } catch (IOException e) {
                error = IoUtils.describe(e);
                log.debug("{} session {} echo from {} failed: {}", context.definition().getName(), info.id(),
                        target.label(), error);
            }
        }

        TraceEntry entry = new TraceEntry(ProxyDirection.TARGET_TO_CLIENT, info, target.endpoint(),
                client.endpoint(), target.index(), 0, outgoing, sent, error, now);
        context.statistics().recordReceived(entry, sent);
        context.recorder().record(entry, context.definition().getTraceObserver(), context.observerContext());
    }

    private byte[] transform(byte[] chunk) {
        HookBinding<ChunkTransform> binding = context.definition().getChunkTransform();
        if (binding == null) {
            return chunk;
        }
        try {
            return binding.hook().transform(chunk, context.transformContext());
        } catch (Exception e) {
            log.warn("Chunk transform {} failed, dropping chunk of session {}: {}", binding.identifier(),
                    info.id(), e.getMessage(), e);
            return null;
        }
    }

    private void legClosed() {
        if (openLegs.decrementAndGet() == 0) {
            log.debug("{} session {} closed", context.definition().getName(), info.id());
            onClosed.accept(this);
        }
    }
}

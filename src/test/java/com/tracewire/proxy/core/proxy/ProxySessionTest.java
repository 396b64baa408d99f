package com.tracewire.proxy.core.proxy;

import com.tracewire.proxy.core.constants.ProxyDirection;
import com.tracewire.proxy.core.hooks.HookBinding;
import com.tracewire.proxy.core.trace.Trace;
import com.tracewire.proxy.core.trace.TraceEntry;
import com.tracewire.proxy.spi.ChunkTransform;
import com.tracewire.proxy.spi.TraceObserver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * End-to-end behaviour of proxied sessions over real loopback sockets.
 */
class ProxySessionTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final List<AutoCloseable> resources = new ArrayList<>();

    @AfterEach
    void tearDown() throws Exception {
        for (AutoCloseable resource : resources) {
            resource.close();
        }
    }

    private TestTargetServer target(TestTargetServer server) {
        resources.add(server);
        return server;
    }

    private TcpProxy startProxy(ProxyDefinition.Builder builder) {
        TcpProxy proxy = new TcpProxy(builder.build(), registry);
        resources.add(0, proxy);
        proxy.start();
        return proxy;
    }

    private Socket connect(TcpProxy proxy) throws IOException {
        Socket client = new Socket(InetAddress.getLoopbackAddress(), proxy.getLocalPort());
        client.setSoTimeout(5000);
        resources.add(0, client);
        return client;
    }

    private static void send(Socket client, String text) throws IOException {
        OutputStream out = client.getOutputStream();
        out.write(text.getBytes(StandardCharsets.US_ASCII));
        out.flush();
    }

    private static String read(Socket client, int length) throws IOException {
        return new String(client.getInputStream().readNBytes(length), StandardCharsets.US_ASCII);
    }

    private static void assertNothingMoreArrives(Socket client) throws IOException {
        client.setSoTimeout(300);
        InputStream in = client.getInputStream();
        assertThatThrownBy(in::read).isInstanceOf(SocketTimeoutException.class);
    }

    private static String text(TraceEntry entry) {
        return entry.chunk() == null ? null : new String(entry.chunk(), StandardCharsets.US_ASCII);
    }

    @Test
    void pingIsForwardedAndPongEchoed() throws Exception {
        TestTargetServer server = target(TestTargetServer.start(
                chunk -> "PING".equals(new String(chunk, StandardCharsets.US_ASCII))
                        ? "PONG".getBytes(StandardCharsets.US_ASCII)
                        : null));
        TcpProxy proxy = startProxy(ProxyDefinition.builder(0)
                .target(TargetAddress.parse(server.address())));
        Trace trace = proxy.toggleTrace();

        Socket client = connect(proxy);
        send(client, "PING");

        assertThat(read(client, 4)).isEqualTo("PONG");
        await().atMost(Duration.ofSeconds(5)).until(() -> trace.size() == 2);

        TraceEntry request = trace.getEntries().get(0);
        assertThat(request.direction()).isEqualTo(ProxyDirection.CLIENT_TO_TARGET);
        assertThat(text(request)).isEqualTo("PING");
        assertThat(request.chunkSend()).isTrue();
        assertThat(request.sourceIndex()).isZero();
        assertThat(request.targetIndex()).isZero();
        assertThat(request.target().port()).isEqualTo(server.port());

        TraceEntry response = trace.getEntries().get(1);
        assertThat(response.direction()).isEqualTo(ProxyDirection.TARGET_TO_CLIENT);
        assertThat(text(response)).isEqualTo("PONG");
        assertThat(response.chunkSend()).isTrue();
        assertThat(response.source().port()).isEqualTo(server.port());
        assertThat(response.session()).isEqualTo(request.session());
    }

    @Test
    void twoTargetsWithoutEcho_bothReceiveAndClientGetsNothing() throws Exception {
        TestTargetServer first = target(TestTargetServer.echo());
        TestTargetServer second = target(TestTargetServer.echo());
        TcpProxy proxy = startProxy(ProxyDefinition.builder(0)
                .target(TargetAddress.parse(first.address()))
                .target(TargetAddress.parse(second.address()))
                .echoPolicy(EchoPolicy.none()));
        Trace trace = proxy.toggleTrace();

        Socket client = connect(proxy);
        send(client, "DATA");

        await().atMost(Duration.ofSeconds(5)).until(() -> "DATA".equals(first.received())
                && "DATA".equals(second.received()));
        await().atMost(Duration.ofSeconds(5)).until(() -> trace.size() == 4);
        assertNothingMoreArrives(client);

        List<TraceEntry> entries = trace.getEntries();
        assertThat(entries).filteredOn(e -> e.direction() == ProxyDirection.CLIENT_TO_TARGET)
                .extracting(TraceEntry::targetIndex).containsExactly(0, 1);
        assertThat(entries).filteredOn(e -> e.direction() == ProxyDirection.TARGET_TO_CLIENT)
                .hasSize(2)
                .allSatisfy(e -> assertThat(e.chunkSend()).isFalse());
        assertThat(proxy.getStatistics().chunksReceived()).isZero();
        assertThat(proxy.getStatistics().chunksSent()).isEqualTo(2);
    }

    @Test
    void chunkStartingWithZeroByte_isDropped() throws Exception {
        TestTargetServer server = target(TestTargetServer.silent());
        ChunkTransform dropZero = (chunk, context) -> chunk.length > 0 && chunk[0] == 0 ? null : chunk;
        TcpProxy proxy = startProxy(ProxyDefinition.builder(0)
                .target(TargetAddress.parse(server.address()))
                .chunkTransform(HookBinding.of(dropZero)));
        Trace trace = proxy.toggleTrace();

        Socket client = connect(proxy);
        client.getOutputStream().write(new byte[] { 0x00, 'X' });
        await().atMost(Duration.ofSeconds(5)).until(() -> trace.size() == 1);
        send(client, "OK");
        await().atMost(Duration.ofSeconds(5)).until(() -> trace.size() == 2);

        await().atMost(Duration.ofSeconds(5)).until(() -> "OK".equals(server.received()));
        TraceEntry dropped = trace.getEntries().get(0);
        assertThat(dropped.chunk()).isNull();
        assertThat(dropped.chunkSend()).isFalse();
        assertThat(trace.getEntries().get(1).chunkSend()).isTrue();
        assertThat(proxy.getStatistics().bytesSent()).isEqualTo(2);
    }

    @Test
    void defaultEcho_onlyFirstTargetAnswersClient() throws Exception {
        TestTargetServer first = target(TestTargetServer.start(chunk -> "A".getBytes(StandardCharsets.US_ASCII)));
        TestTargetServer second = target(TestTargetServer.start(chunk -> "B".getBytes(StandardCharsets.US_ASCII)));
        TcpProxy proxy = startProxy(ProxyDefinition.builder(0)
                .target(TargetAddress.parse(first.address()))
                .target(TargetAddress.parse(second.address())));
        Trace trace = proxy.toggleTrace();

        Socket client = connect(proxy);
        send(client, "x");

        assertThat(read(client, 1)).isEqualTo("A");
        await().atMost(Duration.ofSeconds(5)).until(() -> trace.size() == 4);
        assertNothingMoreArrives(client);

        assertThat(trace.getEntries()).filteredOn(e -> e.direction() == ProxyDirection.TARGET_TO_CLIENT)
                .allSatisfy(e -> assertThat(e.chunkSend()).isEqualTo(e.sourceIndex() == 0));
    }

    @Test
    void entryCount_equalsForwardAttemptsPlusTargetChunks() throws Exception {
        TestTargetServer first = target(TestTargetServer.echo());
        TestTargetServer second = target(TestTargetServer.echo());
        TcpProxy proxy = startProxy(ProxyDefinition.builder(0)
                .target(TargetAddress.parse(first.address()))
                .target(TargetAddress.parse(second.address())));
        Trace trace = proxy.toggleTrace();

        Socket client = connect(proxy);
        int sent = 0;
        for (String chunk : List.of("one", "two", "six")) {
            send(client, chunk);
            assertThat(read(client, 3)).isEqualTo(chunk);
            // 2 forwards plus 2 answers per chunk
            int expected = 4 * ++sent;
            await().atMost(Duration.ofSeconds(5)).until(() -> trace.size() == expected);
        }

        assertThat(trace.size()).isEqualTo(12);
        assertThat(proxy.getStatistics().chunksSent()).isEqualTo(6);
        assertThat(proxy.getStatistics().chunksReceived()).isEqualTo(3);
        assertThat(proxy.getStatistics().bytesReceived()).isEqualTo(9);
    }

    @Test
    void unreachableTarget_staysInertAndOthersKeepWorking() throws Exception {
        int closedPort;
        try (ServerSocket s = new ServerSocket(0)) {
            closedPort = s.getLocalPort();
        }
        TestTargetServer live = target(TestTargetServer.echo());
        TcpProxy proxy = startProxy(ProxyDefinition.builder(0)
                .target(TargetAddress.parse(live.address()))
                .target(new TargetAddress("127.0.0.1", closedPort))
                .connectTimeout(2000));
        Trace trace = proxy.toggleTrace();

        Socket client = connect(proxy);
        send(client, "hi");

        assertThat(read(client, 2)).isEqualTo("hi");
        await().atMost(Duration.ofSeconds(5)).until(() -> trace.size() == 3);
        assertThat(registry.get("proxy.connections.errors").counter().count()).isGreaterThanOrEqualTo(1.0);

        TraceEntry toDead = trace.getEntries().stream()
                .filter(e -> e.direction() == ProxyDirection.CLIENT_TO_TARGET && e.targetIndex() == 1)
                .findFirst().orElseThrow();
        assertThat(toDead.chunkSend()).isFalse();
        assertThat(toDead.error()).isNotBlank();
        assertThat(toDead.target().port()).isEqualTo(closedPort);
    }

    @Test
    void failingTransform_dropsChunkButKeepsSession() throws Exception {
        TestTargetServer server = target(TestTargetServer.silent());
        ChunkTransform explodeOnBoom = (chunk, context) -> {
            if (new String(chunk, StandardCharsets.US_ASCII).contains("boom")) {
                throw new IllegalStateException("boom");
            }
            return chunk;
        };
        TcpProxy proxy = startProxy(ProxyDefinition.builder(0)
                .target(TargetAddress.parse(server.address()))
                .chunkTransform(HookBinding.of(explodeOnBoom)));
        Trace trace = proxy.toggleTrace();

        Socket client = connect(proxy);
        send(client, "boom");
        await().atMost(Duration.ofSeconds(5)).until(() -> trace.size() == 1);
        send(client, "fine");

        await().atMost(Duration.ofSeconds(5)).until(() -> "fine".equals(server.received()));
        assertThat(trace.getEntries().get(0).chunk()).isNull();
    }

    @Test
    void observer_seesEntriesEvenWhenNotTracing() throws Exception {
        TestTargetServer server = target(TestTargetServer.silent());
        List<Integer> traceSizes = new CopyOnWriteArrayList<>();
        TraceObserver observer = (entry, traceSoFar, context) -> traceSizes.add(traceSoFar.size());
        TcpProxy proxy = startProxy(ProxyDefinition.builder(0)
                .target(TargetAddress.parse(server.address()))
                .traceObserver(HookBinding.of(observer)));

        Socket client = connect(proxy);
        send(client, "a");
        await().atMost(Duration.ofSeconds(5)).until(() -> traceSizes.size() == 1);

        proxy.toggleTrace();
        send(client, "b");
        await().atMost(Duration.ofSeconds(5)).until(() -> traceSizes.size() == 2);

        assertThat(traceSizes).containsExactly(0, 1);
    }

    @Test
    void idleTimeout_keepsReceivingClientOpenWhileTargetStreams() throws Exception {
        ServerSocket streaming = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        resources.add(streaming);
        Thread streamer = new Thread(() -> {
            try (Socket socket = streaming.accept()) {
                OutputStream out = socket.getOutputStream();
                for (int i = 0; i < 15; i++) {
                    out.write('a' + i);
                    out.flush();
                    Thread.sleep(100);
                }
            } catch (IOException e) {
                // proxy closed the connection
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "streaming-target");
        streamer.setDaemon(true);
        streamer.start();

        TcpProxy proxy = startProxy(ProxyDefinition.builder(0)
                .target(TargetAddress.parse("127.0.0.1:" + streaming.getLocalPort()))
                .idleTimeout(400));

        Socket client = connect(proxy);

        assertThat(read(client, 15)).isEqualTo("abcdefghijklmno");
    }

    @Test
    void idleTimeout_endsSessionWithoutTraffic() throws Exception {
        TestTargetServer server = target(TestTargetServer.silent());
        TcpProxy proxy = startProxy(ProxyDefinition.builder(0)
                .target(TargetAddress.parse(server.address()))
                .idleTimeout(200));

        Socket client = connect(proxy);

        assertThat(client.getInputStream().read()).isEqualTo(-1);
        await().atMost(Duration.ofSeconds(5)).until(() -> proxy.getActiveSessions() == 0);
    }

    @Test
    void clientClose_keepsTargetsUntilTheyClose() throws Exception {
        TestTargetServer server = target(TestTargetServer.silent());
        TcpProxy proxy = startProxy(ProxyDefinition.builder(0)
                .target(TargetAddress.parse(server.address())));

        Socket client = connect(proxy);
        send(client, "bye");
        await().atMost(Duration.ofSeconds(5)).until(() -> "bye".equals(server.received()));
        client.close();

        await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(2))
                .until(() -> proxy.getActiveSessions() == 1);
        ProxySession session = proxy.getSessions().get(0);
        assertThat(session.getInfo().id()).isNotBlank();
        assertThat(session.getTargets()).extracting(SessionLeg::isConnected).containsExactly(true);

        server.close();
        await().atMost(Duration.ofSeconds(5)).until(() -> proxy.getActiveSessions() == 0);
    }
}

package com.tracewire.proxy.core.proxy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * Loopback TCP server standing in for a proxy target. Records every byte it
 * receives and answers each chunk with whatever the responder returns.
 */
final class TestTargetServer implements AutoCloseable {

    private final ServerSocket server;
    private final UnaryOperator<byte[]> responder;
    private final ByteArrayOutputStream received = new ByteArrayOutputStream();
    private final List<Socket> connections = new CopyOnWriteArrayList<>();

    private TestTargetServer(UnaryOperator<byte[]> responder) throws IOException {
        this.server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        this.responder = responder;
        Thread acceptor = new Thread(this::acceptLoop, "test-target-" + server.getLocalPort());
        acceptor.setDaemon(true);
        acceptor.start();
    }

    /**
     * @param responder Maps a received chunk to the reply, {@code null} for none.
     */
    static TestTargetServer start(UnaryOperator<byte[]> responder) throws IOException {
        return new TestTargetServer(responder);
    }

    static TestTargetServer silent() throws IOException {
        return new TestTargetServer(chunk -> null);
    }

    static TestTargetServer echo() throws IOException {
        return new TestTargetServer(chunk -> chunk);
    }

    int port() {
        return server.getLocalPort();
    }

    String address() {
        return "127.0.0.1:" + port();
    }

    int connectionCount() {
        return connections.size();
    }

    String received() {
        synchronized (received) {
            return received.toString(StandardCharsets.US_ASCII);
        }
    }

    private void acceptLoop() {
        while (!server.isClosed()) {
            try {
                Socket socket = server.accept();
                connections.add(socket);
                Thread reader = new Thread(() -> serve(socket), "test-target-conn");
                reader.setDaemon(true);
                reader.start();
            } catch (IOException e) {
                return;
            }
        }
    }

    private void serve(Socket socket) {
        byte[] buffer = new byte[8192];
        try (socket) {
            InputStream in = socket.getInputStream();
            OutputStream out = socket.getOutputStream();
            int n;
            while ((n = in.read(buffer)) != -1) {
                byte[] chunk = Arrays.copyOf(buffer, n);
                synchronized (received) {
                    received.writeBytes(chunk);
                }
                byte[] reply = responder.apply(chunk);
                if (reply != null) {
                    out.write(reply);
                    out.flush();
                }
            }
        } catch (IOException e) {
            // connection reset by the proxy
        }
    }

    @Override
    public void close() throws IOException {
        server.close();
        for (Socket socket : connections) {
            socket.close();
        }
    }
}

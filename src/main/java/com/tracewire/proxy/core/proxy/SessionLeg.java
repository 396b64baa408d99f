package com.tracewire.proxy.core.proxy;

import com.tracewire.proxy.core.trace.SocketEndpoint;
import com.tracewire.proxy.core.utils.IoUtils;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;

/**
 * One socket of a session: the client (index 0) or a target (its declared
 * index). Writes are serialized so several pumps may write to the same leg.
 */
final class SessionLeg {

    private final int index;
    private final String label;
    private final Socket socket;
    private final SocketEndpoint endpoint;
    private final Object writeLock = new Object();

    /**
     * @param index    Trace index of the leg.
     * @param label    Name used in log messages.
     * @param socket   Connected socket, {@code null} for an inert target.
     * @param endpoint Endpoint reported in trace entries.
     */
    SessionLeg(int index, String label, Socket socket, SocketEndpoint endpoint) {
        this.index = index;
        this.label = label;
        this.socket = socket;
        this.endpoint = endpoint;
    }

    static SessionLeg connected(int index, String label, Socket socket) {
        return new SessionLeg(index, label, socket, SocketEndpoint.remoteOf(socket));
    }

    static SessionLeg inert(int index, String label, TargetAddress target) {
        return new SessionLeg(index, label, null, new SocketEndpoint(target.host(), target.port()));
    }

    int index() {
        return index;
    }

    String label() {
        return label;
    }

    Socket socket() {
        return socket;
    }

    SocketEndpoint endpoint() {
        return endpoint;
    }

    boolean isConnected() {
        return socket != null;
    }

    /**
     * Writes one chunk and flushes it.
     * 
     * @param chunk The chunk.
     * @throws IOException If the leg is inert, closed or the write fails.
     */
    void write(byte[] chunk) throws IOException {
        if (socket == null) {
            throw new IOException(label + " is not connected");
        }
        synchronized (writeLock) {
            OutputStream out = socket.getOutputStream();
            out.write(chunk);
            out.flush();
        }
    }

    /**
     * Signals end-of-stream to the peer and releases the socket.
     */
    void close() {
        IoUtils.shutdownOutputQuietly(socket, label);
        IoUtils.closeQuietly(socket, label);
    }
}

package com.tracewire.proxy.core.trace;

import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * Address and port of one side of a proxied chunk.
 *
 * @param address Host address, {@code null} when the socket never connected.
 * @param port    Port, 0 when unknown.
 */
public record SocketEndpoint(String address, int port) {

    /**
     * Captures the remote end of a socket.
     *
     * @param socket A socket, possibly unconnected.
     * @return The remote endpoint.
     */
    public static SocketEndpoint remoteOf(Socket socket) {
        if (socket != null && socket.getRemoteSocketAddress() instanceof InetSocketAddress remote) {
            String host = remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString();
            return new SocketEndpoint(host, remote.getPort());
        }
        return new SocketEndpoint(null, 0);
    }

    @Override
    public String toString() {
        return address + ":" + port;
    }
}

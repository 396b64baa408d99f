package com.tracewire.proxy.core.utils;

import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common socket and stream helpers used by the session pumps.
 */
public class IoUtils {

    private IoUtils() {
        // Utility class
    }

    private static final Logger log = LoggerFactory.getLogger(IoUtils.class);

    /** Buffer size of one pump read, and so the maximum chunk size. */
    public static final int DEFAULT_BUFFER_SIZE = 8192;

    /**
     * Reads the next chunk from a stream.
     * 
     * @param in     The stream.
     * @param buffer Read buffer.
     * @return A copy of the bytes read, or {@code null} at end of stream.
     * @throws SocketTimeoutException If a socket read timeout expired.
     * @throws IOException            If the read fails.
     */
    public static byte[] readChunk(InputStream in, byte[] buffer) throws IOException {
        int read = in.read(buffer);
        if (read < 0) {
            return null;
        }
        byte[] chunk = new byte[read];
        System.arraycopy(buffer, 0, chunk, 0, read);
        return chunk;
    }

    /**
     * Half-closes the output side of a socket, ignoring failures.
     * 
     * @param socket The socket.
     * @param name   Name of the socket for logging.
     */
    public static void shutdownOutputQuietly(Socket socket, String name) {
        if (socket != null && !socket.isClosed() && !socket.isOutputShutdown()) {
            try {
                socket.shutdownOutput();
            } catch (IOException e) {
                log.debug("Error half-closing {}: {}", name, e.getMessage());
            }
        }
    }

    /**
     * Safely closes a resource, logging any exceptions.
     * 
     * @param closeable The resource to close.
     * @param name      Name of the resource for logging.
     */
    public static void closeQuietly(AutoCloseable closeable, String name) {
        if (closeable != null) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.debug("Error closing {}: {}", name, e.getMessage());
            }
        }
    }

    /**
     * Describes an exception for trace entries and log lines.
     * 
     * @param e The exception.
     * @return Simple class name and message.
     */
    public static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + message;
    }
}

package com.tracewire.proxy.spi;

import com.tracewire.proxy.core.hooks.HookContext;

/**
 * Gives external code read/write access to every chunk before it is
 * forwarded, in both directions.
 * <p>
 * Implementations are invoked synchronously on the pump thread of the socket
 * the chunk was read from, so calls for different sockets of the same proxy may
 * run concurrently. They must not block. Register implementations in
 * {@code META-INF/services/com.tracewire.proxy.spi.ChunkTransform} or reference
 * them by fully qualified class name.
 * </p>
 */
public interface ChunkTransform {
    /**
     * Transforms one chunk.
     * 
     * @param chunk   The chunk as read from the socket.
     * @param context State cells, options and globals of this transform.
     * @return The chunk to forward (the same array or a replacement), or
     *         {@code null} to drop it.
     */
    byte[] transform(byte[] chunk, HookContext context);
}

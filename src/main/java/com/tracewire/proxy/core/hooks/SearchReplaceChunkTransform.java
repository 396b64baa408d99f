package com.tracewire.proxy.core.hooks;

import com.tracewire.proxy.core.utils.ValueUtils;
import com.tracewire.proxy.spi.ChunkTransform;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;

/**
 * Replaces every occurrence of a literal byte sequence within a chunk.
 * <p>
 * Options: {@code search} (required) and {@code replace} (default empty),
 * both encoded as UTF-8. Matches spanning two chunks are not found. The number
 * of replacements made is kept in the hook state as a {@link Long}, and is
 * also added to the {@code replacements} counter of the shared state.
 * </p>
 */
public class SearchReplaceChunkTransform implements ChunkTransform {

    /** Key of the replacement counter in the shared state. */
    public static final String SHARED_COUNTER = "replacements";

    @Override
    public byte[] transform(byte[] chunk, HookContext context) {
        Map<String, Object> options = context.options();
        String search = ValueUtils.optionString(options, "search", "");
        if (search.isEmpty()) {
            return chunk;
        }
        byte[] needle = search.getBytes(StandardCharsets.UTF_8);
        byte[] replacement = ValueUtils.optionString(options, "replace", "").getBytes(StandardCharsets.UTF_8);

        ByteArrayOutputStream out = new ByteArrayOutputStream(chunk.length);
        long replaced = 0;
        int pos = 0;
        while (pos < chunk.length) {
            if (matchesAt(chunk, needle, pos)) {
                out.writeBytes(replacement);
                pos += needle.length;
                replaced++;
            } else {
                out.write(chunk[pos++]);
            }
        }

        if (replaced == 0) {
            return chunk;
        }
        long count = replaced;
        context.state().update(current -> current instanceof Number n ? n.longValue() + count : count);
        if (context.sharedState().get() instanceof ConcurrentMap<?, ?> shared) {
            @SuppressWarnings("unchecked")
            ConcurrentMap<String, Object> counters = (ConcurrentMap<String, Object>) shared;
            counters.merge(SHARED_COUNTER, count, (a, b) -> ((Number) a).longValue() + ((Number) b).longValue());
        }
        return out.toByteArray();
    }

    private static boolean matchesAt(byte[] data, byte[] needle, int offset) {
        if (offset + needle.length > data.length) {
            return false;
        }
        for (int i = 0; i < needle.length; i++) {
            if (data[offset + i] != needle[i]) {
                return false;
            }
        }
        return true;
    }
}

package com.tracewire.proxy.core.proxy;

import com.tracewire.proxy.core.utils.ValueUtils;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Decides which targets' responses are written back to the client.
 */
public final class EchoPolicy {

    /**
     * Kind of policy.
     */
    public enum Mode {
        /** Nothing is written back to the client. */
        NONE,
        /** Responses of every target are written back. */
        ALL,
        /** Responses of the listed target indexes are written back. */
        INDICES
    }

    private static final EchoPolicy NONE = new EchoPolicy(Mode.NONE, Set.of());
    private static final EchoPolicy ALL = new EchoPolicy(Mode.ALL, Set.of());
    private static final EchoPolicy FIRST = new EchoPolicy(Mode.INDICES, Set.of(0));

    private final Mode mode;
    private final Set<Integer> indices;

    private EchoPolicy(Mode mode, Set<Integer> indices) {
        this.mode = mode;
        this.indices = indices;
    }

    public static EchoPolicy none() {
        return NONE;
    }

    public static EchoPolicy all() {
        return ALL;
    }

    /**
     * @return The default policy: only the first target answers the client.
     */
    public static EchoPolicy firstTarget() {
        return FIRST;
    }

    /**
     * @param indices Target indexes, duplicates are ignored.
     * @return A policy echoing exactly those targets.
     */
    public static EchoPolicy indices(Collection<Integer> indices) {
        return new EchoPolicy(Mode.INDICES, Collections.unmodifiableSet(new LinkedHashSet<>(indices)));
    }

    /**
     * Resolves the {@code receiveChunksFrom} value of a proxy entry: absent
     * means the first target, {@code false} none, {@code true} all, an integer
     * or a list of integers those indexes. Items that are not integers are
     * skipped.
     * 
     * @param raw Configured value, may be {@code null}.
     * @return The policy.
     */
    public static EchoPolicy resolve(Object raw) {
        if (raw == null) {
            return FIRST;
        }
        if (raw instanceof Boolean flag) {
            return flag ? ALL : NONE;
        }
        if (raw instanceof String s) {
            String normalized = s.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized)) {
                return ALL;
            }
            if ("false".equals(normalized)) {
                return NONE;
            }
        }

        Set<Integer> parsed = new LinkedHashSet<>();
        if (raw instanceof Collection<?> values) {
            for (Object value : values) {
                Integer index = ValueUtils.toInteger(value);
                if (index != null) {
                    parsed.add(index);
                }
            }
        } else {
            Integer index = ValueUtils.toInteger(raw);
            if (index != null) {
                parsed.add(index);
            }
        }
        return indices(parsed);
    }

    /**
     * @param targetIndex Declared index of a target.
     * @return Whether chunks from that target are written back to the client.
     */
    public boolean includes(int targetIndex) {
        return switch (mode) {
            case NONE -> false;
            case ALL -> true;
            case INDICES -> indices.contains(targetIndex);
        };
    }

    public Mode getMode() {
        return mode;
    }

    public Set<Integer> getIndices() {
        return indices;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EchoPolicy that)) {
            return false;
        }
        return mode == that.mode && indices.equals(that.indices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, indices);
    }

    @Override
    public String toString() {
        return mode == Mode.INDICES ? "INDICES" + indices : mode.name();
    }
}

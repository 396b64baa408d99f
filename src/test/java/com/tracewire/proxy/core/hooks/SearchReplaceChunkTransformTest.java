package com.tracewire.proxy.core.hooks;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;

class SearchReplaceChunkTransformTest {

    private final SearchReplaceChunkTransform transform = new SearchReplaceChunkTransform();

    private static HookContext context(HookState state, Map<String, Object> options) {
        return new HookContext(state, new HookState(), options, Map.of());
    }

    private String apply(String input, HookState state, Map<String, Object> options) {
        byte[] out = transform.transform(input.getBytes(StandardCharsets.UTF_8), context(state, options));
        return new String(out, StandardCharsets.UTF_8);
    }

    @Test
    void transform_replacesEveryOccurrenceAndCountsThem() {
        HookState state = new HookState();
        Map<String, Object> options = Map.of("search", "localhost:9000", "replace", "backend:80");

        String out = apply("GET / HTTP/1.1\r\nHost: localhost:9000\r\nOrigin: localhost:9000\r\n", state, options);

        assertThat(out).isEqualTo("GET / HTTP/1.1\r\nHost: backend:80\r\nOrigin: backend:80\r\n");
        assertThat(state.get()).isEqualTo(2L);

        apply("localhost:9000", state, options);
        assertThat(state.get()).isEqualTo(3L);
    }

    @Test
    void transform_missingReplace_removesMatches() {
        assertThat(apply("a-b-c", new HookState(), Map.of("search", "-"))).isEqualTo("abc");
    }

    @Test
    void transform_noMatch_returnsSameChunk() {
        byte[] chunk = "nothing here".getBytes(StandardCharsets.UTF_8);
        HookState state = new HookState();

        assertThat(transform.transform(chunk, context(state, Map.of("search", "xyz")))).isSameAs(chunk);
        assertThat(state.get()).isNull();
    }

    @Test
    void transform_withoutSearch_passesThrough() {
        byte[] chunk = { 1, 2, 3 };

        assertThat(transform.transform(chunk, context(new HookState(), Map.of()))).isSameAs(chunk);
    }

    @Test
    void transform_overlappingCandidates_matchLeftToRight() {
        assertThat(apply("aaaa", new HookState(), Map.of("search", "aa", "replace", "b"))).isEqualTo("bb");
        assertThat(apply("aaa", new HookState(), Map.of("search", "aa", "replace", "b"))).isEqualTo("ba");
    }

    @Test
    void transform_nonNumericState_isReplacedByCount() {
        HookState state = new HookState("configured");

        apply("x", state, Map.of("search", "x", "replace", "y"));

        assertThat(state.get()).isEqualTo(1L);
    }

    @Test
    void transform_addsReplacementsToSharedCounter() {
        HookState shared = new HookState(new ConcurrentHashMap<String, Object>());
        Map<String, Object> options = Map.of("search", "a", "replace", "b");

        transform.transform("aa".getBytes(StandardCharsets.UTF_8),
                new HookContext(new HookState(), shared, options, Map.of()));
        transform.transform("a".getBytes(StandardCharsets.UTF_8),
                new HookContext(new HookState(), shared, options, Map.of()));

        assertThat((Map<String, Object>) shared.get()).containsEntry(SearchReplaceChunkTransform.SHARED_COUNTER, 3L);
    }

    @Test
    void transform_stoppedProxySharedState_isLeftAlone() {
        HookState shared = new HookState();

        transform.transform("a".getBytes(StandardCharsets.UTF_8),
                new HookContext(new HookState(), shared, Map.of("search", "a"), Map.of()));

        assertThat(shared.get()).isNull();
    }
}

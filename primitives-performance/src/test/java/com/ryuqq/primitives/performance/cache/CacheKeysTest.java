package com.ryuqq.primitives.performance.cache;

import com.ryuqq.primitives.core.context.Context;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CacheKeys 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("CacheKeys 테스트")
class CacheKeysTest {

    record Query(String text, int topK, List<String> tags) {
    }

    @Test
    @DisplayName("Map 순서가 달라도 같은 내용이면 같은 키를 만든다")
    void Map_순서_무관() {
        // given
        CacheKeyFunction<Map<String, Object>> keys = CacheKeys.serializedInputHash();
        Map<String, Object> linked = new LinkedHashMap<>();
        linked.put("b", 2);
        linked.put("a", 1);
        Map<String, Object> sorted = new TreeMap<>(linked);
        Map<String, Object> hashed = new HashMap<>(linked);
        Context context = Context.create();

        // when
        String first = keys.keyFor(linked, context);
        String second = keys.keyFor(sorted, context);
        String third = keys.keyFor(hashed, context);

        // then
        assertThat(first).isEqualTo(second).isEqualTo(third);
        assertThat(first).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    @DisplayName("record 입력은 내용이 다르면 다른 키를 만든다")
    void record_입력() {
        // given
        CacheKeyFunction<Query> keys = CacheKeys.serializedInputHash();
        Context context = Context.create();

        // when
        String a = keys.keyFor(new Query("cache", 3, List.of("x")), context);
        String same = keys.keyFor(new Query("cache", 3, List.of("x")), context);
        String other = keys.keyFor(new Query("cache", 4, List.of("x")), context);

        // then
        assertThat(a).isEqualTo(same);
        assertThat(a).isNotEqualTo(other);
    }

    @Test
    @DisplayName("세션 범위 키는 sessionId가 다르면 달라진다")
    void 세션_범위() {
        // given
        CacheKeyFunction<String> keys = CacheKeys.scopedBySession(CacheKeys.toStringKey());
        Context alice = Context.builder().sessionId("s-1").build();
        Context bob = Context.builder().sessionId("s-2").build();

        // when & then
        assertThat(keys.keyFor("q", alice)).isEqualTo("s-1:q");
        assertThat(keys.keyFor("q", bob)).isEqualTo("s-2:q");
        assertThat(keys.keyFor("q", Context.create())).isEqualTo("-:q");
    }
}

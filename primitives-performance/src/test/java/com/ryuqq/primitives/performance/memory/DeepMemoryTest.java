package com.ryuqq.primitives.performance.memory;

import com.ryuqq.primitives.adapter.inmemory.store.InMemoryRemoteStore;
import com.ryuqq.primitives.testkit.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DeepMemory 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("DeepMemory 테스트")
class DeepMemoryTest {

    private final MutableClock clock = MutableClock.startingAtEpochOf2024();

    @Test
    @DisplayName("검색 결과는 관련도, 중요도, 최신순으로 정렬된다")
    void 순위() {
        // given
        DeepMemory memory = new DeepMemory(100, clock);
        memory.remember("a", "redis cache ttl", Set.of(), 0.5);
        clock.advance(Duration.ofSeconds(1));
        memory.remember("b", "cache only", Set.of(), 0.9);
        clock.advance(Duration.ofSeconds(1));
        memory.remember("c", "redis cache cluster", Set.of(), 0.5);
        memory.remember("d", "nothing relevant", Set.of(), 1.0);

        // when
        List<DeepMemoryEntry> found = memory.search(MemoryQuery.text("redis cache"));

        // then
        assertThat(found).extracting(DeepMemoryEntry::key).containsExactly("c", "a", "b");
    }

    @Test
    @DisplayName("태그 일치도 관련도에 반영되고 limit을 지킨다")
    void 태그_검색() {
        // given
        DeepMemory memory = new DeepMemory(100, clock);
        memory.remember("adr-1", "use postgres", Set.of("db", "adr"), 0.7);
        memory.remember("adr-2", "use kafka", Set.of("messaging", "adr"), 0.6);
        memory.remember("note", "lunch", Set.of("misc"), 0.1);

        // when
        List<DeepMemoryEntry> found = memory.search(MemoryQuery.text(null).withTags(Set.of("adr", "db")).withLimit(1));

        // then
        assertThat(found).extracting(DeepMemoryEntry::key).containsExactly("adr-1");
    }

    @Test
    @DisplayName("최대 항목 수를 넘으면 가장 오래 사용하지 않은 항목이 제거된다")
    void 최대_항목() {
        // given
        DeepMemory memory = new DeepMemory(2, clock);
        memory.remember("a", "one", Set.of(), 0.5);
        memory.remember("b", "two", Set.of(), 0.5);
        memory.get("a");

        // when
        memory.remember("c", "three", Set.of(), 0.5);

        // then
        assertThat(memory.size()).isEqualTo(2);
        assertThat(memory.get("b")).isEmpty();
        assertThat(memory.get("a")).isPresent();
    }

    @Test
    @DisplayName("원격 저장소에만 있는 항목도 검색과 조회에 포함된다")
    void 원격_항목_포함() {
        // given
        InMemoryRemoteStore<DeepMemoryEntry> remote = new InMemoryRemoteStore<>(clock);
        DeepMemory memory = new DeepMemory(100, clock, KeywordRelevance.INSTANCE, remote);
        memory.remember("local", "kafka consumer lag", Set.of(), 0.5);
        DeepMemoryEntry shared = new DeepMemoryEntry("shared", "kafka partition plan", Set.of(), 0.8, clock.instant());
        remote.put(DeepMemory.REMOTE_KEY_PREFIX + "shared", shared, null);

        // when
        List<DeepMemoryEntry> found = memory.search(MemoryQuery.text("kafka"));

        // then
        assertThat(memory.isRemoteBacked()).isTrue();
        assertThat(found).extracting(DeepMemoryEntry::key).containsExactly("shared", "local");
        assertThat(memory.get("shared")).contains(shared);
    }

    @Test
    @DisplayName("로컬에서 밀려난 항목도 원격 저장소에서 태그로 다시 찾는다")
    void 밀려난_항목_태그_검색() {
        // given
        InMemoryRemoteStore<DeepMemoryEntry> remote = new InMemoryRemoteStore<>(
            clock, entry -> entry.content() + " " + String.join(" ", entry.tags()), entry -> Map.of()
        );
        DeepMemory memory = new DeepMemory(1, clock, KeywordRelevance.INSTANCE, remote);
        memory.remember("deploy-1", "rolled out api", Set.of("ops"), 0.5);
        memory.remember("deploy-2", "rolled out worker", Set.of("ops"), 0.5);
        memory.remember("invoice", "monthly run", Set.of("billing"), 0.9);
        memory.remember("deploy-3", "rolled out batch", Set.of("ops"), 0.5);

        // when
        List<DeepMemoryEntry> found = memory.search(MemoryQuery.text(null).withTags(Set.of("billing")).withLimit(1));

        // then
        assertThat(memory.size()).isEqualTo(1);
        assertThat(found).extracting(DeepMemoryEntry::key).containsExactly("invoice");
    }

    @Test
    @DisplayName("원격 저장소 장애 시 로컬 저장소만으로 동작한다")
    void 원격_장애_로컬_동작() {
        // given
        InMemoryRemoteStore<DeepMemoryEntry> remote = new InMemoryRemoteStore<>(clock);
        DeepMemory memory = new DeepMemory(100, clock, KeywordRelevance.INSTANCE, remote);
        remote.simulateOutage(true);

        // when
        memory.remember("k", "outage tolerant entry", Set.of("ops"), 0.5);
        List<DeepMemoryEntry> found = memory.search(MemoryQuery.text("outage"));

        // then
        assertThat(found).extracting(DeepMemoryEntry::key).containsExactly("k");
        assertThat(memory.get("k")).isPresent();
        assertThat(memory.forget("k")).isTrue();
        assertThat(remote.size()).isZero();
    }

    @Test
    @DisplayName("기본 validate는 저장된 항목과 equals로 비교하고 예외를 던지지 않는다")
    void 기본_검증() {
        // given
        DeepMemory memory = new DeepMemory(10, clock);
        DeepMemoryEntry entry = memory.remember("k", "v", Set.of(), 0.5);

        // when
        FactValidation same = memory.validate("k", entry);
        FactValidation missing = memory.validate("unknown", entry);

        // then
        assertThat(same.valid()).isTrue();
        assertThat(missing.valid()).isFalse();
        assertThat(missing.severity()).isEqualTo(Severity.WARNING);
    }

    @Test
    @DisplayName("중요도는 0.0 이상 1.0 이하의 숫자여야 한다")
    void 중요도_범위() {
        // given
        DeepMemory memory = new DeepMemory(10, clock);

        // when & then
        assertThatThrownBy(() -> memory.remember("nan", "v", Set.of(), Double.NaN))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("importance");
        assertThatThrownBy(() -> memory.remember("high", "v", Set.of(), 1.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(memory.size()).isZero();
    }
}

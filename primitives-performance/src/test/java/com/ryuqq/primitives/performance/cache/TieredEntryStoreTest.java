package com.ryuqq.primitives.performance.cache;

import com.ryuqq.primitives.adapter.inmemory.store.InMemoryRemoteStore;
import com.ryuqq.primitives.testkit.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TieredEntryStore 테스트")
class TieredEntryStoreTest {

    private final MutableClock clock = MutableClock.startingAtEpochOf2024();
    private InMemoryRemoteStore<String> remote;
    private LruEntryStore<String> local;
    private TieredEntryStore<String> store;

    @BeforeEach
    void setUp() {
        remote = new InMemoryRemoteStore<>(clock);
        local = new LruEntryStore<>(10, Duration.ofMinutes(1), clock);
        store = new TieredEntryStore<>(local, remote, Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("L1에 없고 L2에 있으면 L2 값을 반환하고 L1을 채운다")
    void L2_조회_후_L1_채움() {
        // given
        remote.put("cache:k", "v", null);

        // when
        boolean found = store.get("k").isPresent();

        // then
        assertThat(found).isTrue();
        assertThat(local.get("k")).contains("v");
    }

    @Test
    @DisplayName("L2 장애 중에도 저장은 L1에 되고 조회는 L1에서 된다")
    void L2_장애_허용() {
        // given
        remote.simulateOutage(true);

        // when
        store.put("k", "v");

        // then
        assertThat(store.get("k")).contains("v");
        assertThat(store.get("missing")).isEmpty();
        assertThat(store.invalidate("k")).isTrue();
    }

    @Test
    @DisplayName("clear는 L2 장애와 관계없이 L1을 비운다")
    void clear_L1_보장() {
        // given
        store.put("k", "v");
        remote.simulateOutage(true);

        // when
        store.clear();

        // then
        assertThat(local.size()).isZero();
    }

    @Test
    @DisplayName("저장하면 L1과 L2 모두에 들어간다")
    void 양쪽_저장() {
        // when
        store.put("k", "v");

        // then
        assertThat(local.get("k")).contains("v");
        assertThat(remote.get("cache:k")).contains("v");
    }
}

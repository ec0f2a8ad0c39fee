package com.ryuqq.primitives.adapter.inmemory.store;

import com.ryuqq.primitives.core.error.StoreUnavailableException;
import com.ryuqq.primitives.core.spi.RemoteStore;
import com.ryuqq.primitives.testkit.MutableClock;
import com.ryuqq.primitives.testkit.contract.AbstractRemoteStoreContractTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Tests for InMemoryRemoteStore implementation.
 *
 * <p>Inherits the RemoteStore contract scenarios and adds adapter-specific checks
 * for ranking, attribute filters and outage simulation.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryRemoteStoreContractTest extends AbstractRemoteStoreContractTest {

    @Override
    protected RemoteStore<String> createStore(MutableClock clock) {
        return new InMemoryRemoteStore<>(clock);
    }

    @Test
    @DisplayName("검색어를 더 많이 포함한 값이 먼저 나온다")
    void search_관련도_순서() {
        // given
        store.put("a", "retry only", null);
        store.put("b", "retry with circuit breaker", null);

        // when
        List<String> results = store.search("retry circuit", 10, Map.of());

        // then
        assertThat(results).containsExactly("retry with circuit breaker", "retry only");
    }

    @Test
    @DisplayName("검색은 대소문자를 구분하지 않는다")
    void search_대소문자_무시() {
        store.put("a", "Circuit Breaker", null);

        assertThat(store.search("CIRCUIT", 10, Map.of())).containsExactly("Circuit Breaker");
    }

    @Test
    @DisplayName("속성 필터는 모든 항목이 일치하는 값만 반환한다")
    void search_속성_필터() {
        // given
        InMemoryRemoteStore<String> tagged = new InMemoryRemoteStore<>(
            clock,
            value -> value,
            value -> Map.of("layer", value.startsWith("fact") ? "fact" : "deep")
        );
        tagged.put("1", "fact: retry budget", null);
        tagged.put("2", "deep: retry history", null);

        // when
        List<String> results = tagged.search("retry", 10, Map.of("layer", "fact"));

        // then
        assertThat(results).containsExactly("fact: retry budget");
    }

    @Test
    @DisplayName("장애 시뮬레이션 중에는 모든 연산이 StoreUnavailableException을 던진다")
    void 장애_시뮬레이션() {
        // given
        InMemoryRemoteStore<String> remote = new InMemoryRemoteStore<>(clock);
        remote.put("k", "v", Duration.ofMinutes(1));

        // when
        remote.simulateOutage(true);

        // then
        assertThatThrownBy(() -> remote.get("k")).isInstanceOf(StoreUnavailableException.class);
        assertThatThrownBy(() -> remote.put("k", "v2", null)).isInstanceOf(StoreUnavailableException.class);
        assertThatThrownBy(() -> remote.search("v", 1, Map.of())).isInstanceOf(StoreUnavailableException.class);

        // when
        remote.simulateOutage(false);

        // then
        assertThat(remote.get("k")).contains("v");
    }

    @Test
    @DisplayName("0 이하의 TTL은 IllegalArgumentException")
    void TTL_검증() {
        assertThatThrownBy(() -> store.put("k", "v", Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }
}

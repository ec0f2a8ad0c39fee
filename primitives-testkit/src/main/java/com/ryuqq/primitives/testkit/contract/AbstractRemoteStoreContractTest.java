package com.ryuqq.primitives.testkit.contract;

import com.ryuqq.primitives.core.spi.RemoteStore;
import com.ryuqq.primitives.testkit.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for {@link RemoteStore} Contract Tests.
 *
 * <p>Every {@link RemoteStore} adapter should pass these scenarios. Subclasses provide
 * the store under test through {@link #createStore(MutableClock)} and inherit the tests.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>put/get round trip, overwrite keeps the latest value</li>
 *   <li>entries disappear after their TTL, entries without TTL never expire</li>
 *   <li>delete reports whether a value existed</li>
 *   <li>search returns only matching values and honors the limit</li>
 *   <li>deleteByPrefix removes only keys under the prefix</li>
 *   <li>clear removes everything</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyRemoteStoreContractTest extends AbstractRemoteStoreContractTest {
 *     {@literal @}Override
 *     protected RemoteStore&lt;String&gt; createStore(MutableClock clock) {
 *         return new MyRemoteStore(clock);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractRemoteStoreContractTest {

    protected MutableClock clock;
    protected RemoteStore<String> store;

    /**
     * Creates the store under test. Text values must be searchable by the words they contain.
     *
     * @param clock clock the store must use for TTL decisions
     * @return a fresh, empty store
     */
    protected abstract RemoteStore<String> createStore(MutableClock clock);

    /**
     * Sets up test fixtures before each test.
     */
    @BeforeEach
    void setUpStore() {
        clock = MutableClock.startingAtEpochOf2024();
        store = createStore(clock);
    }

    /**
     * Clears the store after each test to prevent test interference.
     */
    @AfterEach
    void tearDownStore() {
        if (store != null) {
            store.clear();
        }
    }

    @Test
    @DisplayName("put 후 get 하면 같은 값을 반환한다")
    void put_후_get_같은_값() {
        // when
        store.put("user:1", "alice", null);

        // then
        assertEquals(Optional.of("alice"), store.get("user:1"));
    }

    @Test
    @DisplayName("없는 키는 empty를 반환한다")
    void 없는_키는_empty() {
        assertEquals(Optional.empty(), store.get("missing"));
    }

    @Test
    @DisplayName("같은 키로 다시 put 하면 최신 값으로 덮어쓴다")
    void 덮어쓰기() {
        // given
        store.put("k", "v1", null);

        // when
        store.put("k", "v2", null);

        // then
        assertEquals(Optional.of("v2"), store.get("k"));
    }

    @Test
    @DisplayName("TTL이 지나면 값이 사라진다")
    void TTL_만료() {
        // given
        store.put("session", "token", Duration.ofSeconds(10));

        // when
        clock.advance(Duration.ofSeconds(9));
        Optional<String> beforeExpiry = store.get("session");
        clock.advance(Duration.ofSeconds(2));
        Optional<String> afterExpiry = store.get("session");

        // then
        assertEquals(Optional.of("token"), beforeExpiry);
        assertEquals(Optional.empty(), afterExpiry);
    }

    @Test
    @DisplayName("TTL 없이 저장한 값은 만료되지 않는다")
    void TTL_없음() {
        // given
        store.put("forever", "value", null);

        // when
        clock.advance(Duration.ofDays(365));

        // then
        assertEquals(Optional.of("value"), store.get("forever"));
    }

    @Test
    @DisplayName("delete는 값이 있었는지 여부를 반환한다")
    void delete_결과() {
        // given
        store.put("k", "v", null);

        // when & then
        assertTrue(store.delete("k"));
        assertFalse(store.delete("k"));
        assertEquals(Optional.empty(), store.get("k"));
    }

    @Test
    @DisplayName("search는 검색어를 포함한 값만 limit 개수 이하로 반환한다")
    void search_매칭과_limit() {
        // given
        store.put("a", "circuit breaker opens after failures", null);
        store.put("b", "retry with exponential backoff", null);
        store.put("c", "circuit breaker half open trial", null);
        store.put("d", "cache eviction policy", null);

        // when
        List<String> all = store.search("circuit", 10, Map.of());
        List<String> limited = store.search("circuit", 1, Map.of());

        // then
        assertEquals(2, all.size());
        assertTrue(all.stream().allMatch(value -> value.contains("circuit")));
        assertEquals(1, limited.size());
    }

    @Test
    @DisplayName("만료된 값은 search 결과에 포함되지 않는다")
    void search_만료_제외() {
        // given
        store.put("short", "retry policy", Duration.ofSeconds(1));
        store.put("long", "retry budget", null);

        // when
        clock.advance(Duration.ofSeconds(5));
        List<String> results = store.search("retry", 10, Map.of());

        // then
        assertEquals(List.of("retry budget"), results);
    }

    @Test
    @DisplayName("deleteByPrefix는 접두어로 시작하는 키만 삭제한다")
    void deleteByPrefix_접두어만_삭제() {
        // given
        store.put("cache:a", "1", null);
        store.put("cache:b", "2", null);
        store.put("deep:a", "3", null);

        // when
        int removed = store.deleteByPrefix("cache:");

        // then
        assertEquals(2, removed);
        assertEquals(Optional.empty(), store.get("cache:a"));
        assertEquals(Optional.empty(), store.get("cache:b"));
        assertEquals(Optional.of("3"), store.get("deep:a"));
    }

    @Test
    @DisplayName("clear 후에는 모든 값이 사라진다")
    void clear_전체_삭제() {
        // given
        store.put("a", "1", null);
        store.put("b", "2", null);

        // when
        store.clear();

        // then
        assertEquals(Optional.empty(), store.get("a"));
        assertEquals(Optional.empty(), store.get("b"));
    }
}

package com.ryuqq.primitives.performance.cache;

import com.ryuqq.primitives.core.error.StoreUnavailableException;
import com.ryuqq.primitives.core.spi.RemoteStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * 로컬 LRU(L1) + 원격 저장소(L2) 2단 {@link EntryStore}.
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>조회: L1 → L2 순서, L2 hit은 L1에 backfill</li>
 *   <li>저장: L1은 항상, L2는 best-effort</li>
 *   <li>삭제: L2 장애를 허용하고 L1은 항상 삭제</li>
 * </ul>
 *
 * <p>L2 장애는 경고 로그만 남기고 L1만으로 계속 동작하므로 이 저장소는
 * {@link StoreUnavailableException}을 던지지 않습니다.</p>
 *
 * @param <V> 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TieredEntryStore<V> implements EntryStore<V> {

    private static final Logger log = LoggerFactory.getLogger(TieredEntryStore.class);

    private final LruEntryStore<V> local;
    private final RemoteEntryStore<V> remote;

    /**
     * 생성자.
     *
     * @param local L1 저장소
     * @param remote L2 원격 저장소
     * @param ttl L2 항목 유효 시간 (null이면 만료 없음)
     */
    public TieredEntryStore(LruEntryStore<V> local, RemoteStore<V> remote, Duration ttl) {
        if (local == null) {
            throw new IllegalArgumentException("local cannot be null");
        }
        this.local = local;
        this.remote = new RemoteEntryStore<>(remote, ttl);
    }

    @Override
    public Optional<V> get(String key) {
        Optional<V> l1 = local.get(key);
        if (l1.isPresent()) {
            return l1;
        }
        try {
            Optional<V> l2 = remote.get(key);
            l2.ifPresent(value -> local.put(key, value));
            return l2;
        } catch (StoreUnavailableException e) {
            log.warn("L2 get failed, serving from L1 only: key={}, cause={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, V value) {
        local.put(key, value);
        try {
            remote.put(key, value);
        } catch (StoreUnavailableException e) {
            log.warn("L2 put failed, value kept in L1 only: key={}, cause={}", key, e.getMessage());
        }
    }

    @Override
    public boolean invalidate(String key) {
        boolean l2Removed = false;
        try {
            l2Removed = remote.invalidate(key);
        } catch (StoreUnavailableException e) {
            log.warn("L2 invalidate failed, proceeding with L1: key={}, cause={}", key, e.getMessage());
        }
        boolean l1Removed = local.invalidate(key);
        return l1Removed || l2Removed;
    }

    @Override
    public void clear() {
        try {
            remote.clear();
        } catch (StoreUnavailableException e) {
            log.warn("L2 clear failed, proceeding with L1: cause={}", e.getMessage());
        }
        local.clear();
    }

    @Override
    public int size() {
        return local.size();
    }

    @Override
    public long evictionCount() {
        return local.evictionCount();
    }
}

package com.ryuqq.primitives.performance.cache;

import com.ryuqq.primitives.core.spi.RemoteStore;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link RemoteStore}를 {@link EntryStore}로 쓰기 위한 어댑터.
 *
 * <p>TTL은 원격 저장소에 위임합니다. 원격 장애는
 * {@link com.ryuqq.primitives.core.error.StoreUnavailableException} 그대로 전파되며,
 * {@link CachePrimitive}는 이를 받으면 감싼 Primitive를 직접 실행합니다.</p>
 *
 * @param <V> 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RemoteEntryStore<V> implements EntryStore<V> {

    private final RemoteStore<V> remote;
    private final Duration ttl;
    private final String keyPrefix;

    /**
     * 생성자.
     *
     * @param remote 원격 저장소
     * @param ttl 항목 유효 시간 (null이면 만료 없음)
     * @param keyPrefix 원격 키 접두어 (다른 사용처와 키 공간 분리용, 빈 문자열 가능)
     * @throws IllegalArgumentException remote 또는 keyPrefix가 null인 경우
     */
    public RemoteEntryStore(RemoteStore<V> remote, Duration ttl, String keyPrefix) {
        if (remote == null) {
            throw new IllegalArgumentException("remote cannot be null");
        }
        if (keyPrefix == null) {
            throw new IllegalArgumentException("keyPrefix cannot be null");
        }
        this.remote = remote;
        this.ttl = ttl;
        this.keyPrefix = keyPrefix;
    }

    public RemoteEntryStore(RemoteStore<V> remote, Duration ttl) {
        this(remote, ttl, "cache:");
    }

    @Override
    public Optional<V> get(String key) {
        return remote.get(keyPrefix + key);
    }

    @Override
    public void put(String key, V value) {
        remote.put(keyPrefix + key, value, ttl);
    }

    @Override
    public boolean invalidate(String key) {
        return remote.delete(keyPrefix + key);
    }

    /**
     * 이 저장소의 키 접두어 아래 항목만 삭제합니다. 같은 원격 저장소의 다른 키 공간은 그대로 둡니다.
     */
    @Override
    public void clear() {
        remote.deleteByPrefix(keyPrefix);
    }

    /**
     * 원격 저장소는 항목 수를 알려주지 않으므로 항상 -1.
     */
    @Override
    public int size() {
        return -1;
    }
}

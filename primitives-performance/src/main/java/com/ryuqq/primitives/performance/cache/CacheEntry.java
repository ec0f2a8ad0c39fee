package com.ryuqq.primitives.performance.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * 캐시 항목.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param key 키
 * @param value 값
 * @param insertedAt 저장 시각
 * @param lastAccessedAt 마지막 조회 시각
 * @param ttl 유효 시간 (null이면 만료 없음)
 */
public record CacheEntry<V>(
    String key,
    V value,
    Instant insertedAt,
    Instant lastAccessedAt,
    Duration ttl
) {

    /**
     * 만료 여부. insertedAt + ttl 시각부터 만료입니다.
     */
    public boolean isExpired(Instant now) {
        return ttl != null && !now.isBefore(insertedAt.plus(ttl));
    }

    CacheEntry<V> touchedAt(Instant now) {
        return new CacheEntry<>(key, value, insertedAt, now, ttl);
    }
}

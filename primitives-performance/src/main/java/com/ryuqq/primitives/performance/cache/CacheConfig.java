package com.ryuqq.primitives.performance.cache;

import java.time.Duration;

/**
 * CachePrimitive 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>ttl: 항목 유효 시간, 경과 후 읽으면 없는 것으로 취급 (기본 5분)</li>
 *   <li>maxSize: 최대 항목 수, 초과 시 LRU 제거 (기본 1000)</li>
 *   <li>singleFlight: 같은 키의 동시 miss를 한 번의 실행으로 합칠지 여부 (기본 true)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param ttl 항목 유효 시간 (양수여야 함)
 * @param maxSize 최대 항목 수 (1 이상이어야 함)
 * @param singleFlight 동시 miss 병합 여부
 */
public record CacheConfig(
    Duration ttl,
    int maxSize,
    boolean singleFlight
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: ttl=5m, maxSize=1000, singleFlight=true</p>
     */
    public CacheConfig() {
        this(Duration.ofMinutes(5), 1000, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CacheConfig {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive (current: " + maxSize + ")");
        }
    }

    /**
     * ttl만 변경한 새 인스턴스 생성.
     */
    public CacheConfig withTtl(Duration ttl) {
        return new CacheConfig(ttl, maxSize, singleFlight);
    }

    /**
     * maxSize만 변경한 새 인스턴스 생성.
     */
    public CacheConfig withMaxSize(int maxSize) {
        return new CacheConfig(ttl, maxSize, singleFlight);
    }

    /**
     * singleFlight만 변경한 새 인스턴스 생성.
     */
    public CacheConfig withSingleFlight(boolean singleFlight) {
        return new CacheConfig(ttl, maxSize, singleFlight);
    }
}

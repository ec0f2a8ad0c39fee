package com.ryuqq.primitives.performance.cache;

/**
 * 캐시 통계 스냅샷.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param hits 캐시 hit 수 (single-flight로 다른 실행의 결과를 공유한 경우 포함)
 * @param misses 캐시 miss 수 (감싼 Primitive를 실행한 횟수)
 * @param evictions 용량 초과로 제거된 항목 수
 * @param size 현재 항목 수 (알 수 없으면 -1)
 */
public record CacheStats(
    long hits,
    long misses,
    long evictions,
    int size
) {

    /**
     * hit 비율 (조회가 없으면 0.0).
     */
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}

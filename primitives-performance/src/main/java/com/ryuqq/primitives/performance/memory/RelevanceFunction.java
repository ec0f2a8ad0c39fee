package com.ryuqq.primitives.performance.memory;

/**
 * Deep Memory 검색 관련도 함수.
 *
 * <p>0 이하를 반환한 항목은 결과에서 제외됩니다. 유사도 기반 구현으로 교체해도 {@link DeepMemory#search}의
 * 호출 방식은 바뀌지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see KeywordRelevance
 */
@FunctionalInterface
public interface RelevanceFunction {

    /**
     * 관련도 점수.
     *
     * @param query 질의
     * @param entry 후보 항목
     * @return 점수 (클수록 관련 높음, 0 이하는 불일치)
     */
    double score(MemoryQuery query, DeepMemoryEntry entry);
}

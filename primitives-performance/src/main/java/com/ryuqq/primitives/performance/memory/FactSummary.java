package com.ryuqq.primitives.performance.memory;

import java.util.Map;

/**
 * Fact 레지스트리 요약.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param total 전체 수
 * @param active ACTIVE 수
 * @param deprecated DEPRECATED 수
 * @param activeByCategory 카테고리별 ACTIVE 수
 */
public record FactSummary(
    int total,
    int active,
    int deprecated,
    Map<String, Integer> activeByCategory
) {

    public FactSummary {
        activeByCategory = Map.copyOf(activeByCategory);
    }
}

package com.ryuqq.primitives.performance.memory;

import java.util.Locale;

/**
 * 작업 흐름 단계.
 *
 * <p>단계마다 필요한 메모리 계층이 다르며, {@link StageLoadPlan}이 단계와 {@link WorkflowMode}에 따라
 * 어떤 계층을 얼마나 불러올지 정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WorkflowStage {

    /** 요구사항 파악. 가장 넓게 불러옵니다. */
    UNDERSTAND,

    /** 작업 분해. */
    DECOMPOSE,

    /** 계획 수립. */
    PLAN,

    /** 구현. 세션과 최근 구간 위주로 불러옵니다. */
    IMPLEMENT,

    /** 검증. 사실(Fact) 위주로 불러옵니다. */
    VALIDATE,

    /** 회고. RIGOROUS 모드에서만 불러옵니다. */
    REFLECT;

    /**
     * 소문자 이름으로 단계 조회 (예: "understand").
     *
     * @param value 단계 이름 (대소문자 무시)
     * @return 단계
     * @throws IllegalArgumentException null이거나 알 수 없는 이름인 경우
     */
    public static WorkflowStage of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("stage cannot be null or blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown workflow stage: " + value, e);
        }
    }
}

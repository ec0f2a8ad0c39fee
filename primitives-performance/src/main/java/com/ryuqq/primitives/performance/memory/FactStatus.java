package com.ryuqq.primitives.performance.memory;

/**
 * Architectural Fact 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FactStatus {

    /** 검증에 사용되는 사실. */
    ACTIVE,

    /** 기록으로만 남은 사실. 검증하면 위반(WARNING)으로 보고됩니다. */
    DEPRECATED
}

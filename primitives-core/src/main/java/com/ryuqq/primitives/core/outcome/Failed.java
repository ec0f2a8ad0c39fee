package com.ryuqq.primitives.core.outcome;

/**
 * 실패한 분기.
 *
 * @param index 분기 위치
 * @param error 분기가 던진 예외 (원래 타입 그대로)
 * @param <O> 분기 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Failed<O>(int index, Throwable error) implements BranchOutcome<O> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException index가 음수이거나 error가 null인 경우
     */
    public Failed {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative (current: " + index + ")");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }
}

package com.ryuqq.primitives.core.outcome;

/**
 * 성공한 분기.
 *
 * @param index 분기 위치
 * @param value 분기 출력 (null 가능)
 * @param <O> 분기 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Succeeded<O>(int index, O value) implements BranchOutcome<O> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException index가 음수인 경우
     */
    public Succeeded {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative (current: " + index + ")");
        }
    }
}

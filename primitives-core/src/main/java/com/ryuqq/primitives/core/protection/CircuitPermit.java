package com.ryuqq.primitives.core.protection;

/**
 * {@link CircuitBreaker#tryAcquire()}가 발급하는 통과 허가.
 *
 * <p>허가를 받은 시점의 상태 세대(generation)와 HALF_OPEN 시험 호출 여부를 담습니다.
 * 결과를 기록할 때 이 허가를 함께 넘기면, breaker는 이미 지나간 세대에서 들어온 결과를 무시합니다.</p>
 *
 * @param generation 발급 시점의 상태 세대
 * @param trial HALF_OPEN 시험 호출 여부
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CircuitPermit(long generation, boolean trial) {

    public CircuitPermit {
        if (generation < 0) {
            throw new IllegalArgumentException("generation must not be negative (current: " + generation + ")");
        }
    }
}

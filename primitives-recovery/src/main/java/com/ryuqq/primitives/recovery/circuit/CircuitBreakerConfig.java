package com.ryuqq.primitives.recovery.circuit;

import java.time.Duration;

/**
 * 연속 실패 기반 Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureThreshold: OPEN으로 전이하는 연속 실패 수 (기본 5)</li>
 *   <li>coolDown: OPEN 유지 시간, 경과 후 HALF_OPEN (기본 30초)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param failureThreshold 연속 실패 임계값 (1 이상이어야 함)
 * @param coolDown OPEN 유지 시간 (양수여야 함)
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    Duration coolDown
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=5, coolDown=30s</p>
     */
    public CircuitBreakerConfig() {
        this(5, Duration.ofSeconds(30));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (coolDown == null || coolDown.isZero() || coolDown.isNegative()) {
            throw new IllegalArgumentException("coolDown must be positive (current: " + coolDown + ")");
        }
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, coolDown);
    }

    /**
     * coolDown만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withCoolDown(Duration coolDown) {
        return new CircuitBreakerConfig(failureThreshold, coolDown);
    }
}

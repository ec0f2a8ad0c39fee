package com.ryuqq.primitives.recovery.timeout;

import java.time.Duration;

/**
 * TimeoutPrimitive 설정 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param timeout 최대 실행 시간 (양수여야 함)
 * @param interruptOnTimeout 시간 초과 시 실행 스레드를 인터럽트할지 여부
 */
public record TimeoutConfig(
    Duration timeout,
    boolean interruptOnTimeout
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: timeout=30s, interruptOnTimeout=true</p>
     */
    public TimeoutConfig() {
        this(Duration.ofSeconds(30), true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TimeoutConfig {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
    }

    public static TimeoutConfig of(Duration timeout) {
        return new TimeoutConfig(timeout, true);
    }

    /**
     * timeout만 변경한 새 인스턴스 생성.
     */
    public TimeoutConfig withTimeout(Duration timeout) {
        return new TimeoutConfig(timeout, interruptOnTimeout);
    }

    /**
     * interruptOnTimeout만 변경한 새 인스턴스 생성.
     */
    public TimeoutConfig withInterruptOnTimeout(boolean interruptOnTimeout) {
        return new TimeoutConfig(timeout, interruptOnTimeout);
    }
}

package com.ryuqq.primitives.recovery.retry.backoff;

import java.time.Duration;

/**
 * 재시도 간격 계산 전략.
 *
 * <p><strong>기본 제공 전략:</strong></p>
 * <ul>
 *   <li>{@link #exponential(Duration, Duration, double)}: initialDelay * 2^(retry-1), maxDelay로 상한, 대칭 jitter (기본값)</li>
 *   <li>{@link #exponential(Duration, double, Duration, double)}: 배수를 직접 지정</li>
 *   <li>{@link #fixed(Duration)}: 항상 같은 간격</li>
 *   <li>{@link #linear(Duration, Duration)}: step * retry, maxDelay로 상한</li>
 *   <li>{@link #none()}: 대기 없음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BackoffStrategy {

    /**
     * 재시도 전 대기 시간 계산.
     *
     * @param retry 재시도 순번 (1부터 시작)
     * @return 대기 시간
     * @throws IllegalArgumentException retry가 양수가 아닌 경우
     */
    Duration delayBefore(int retry);

    static BackoffStrategy exponential(Duration initialDelay, Duration maxDelay, double jitterFactor) {
        return new ExponentialBackoff(initialDelay, 2.0, maxDelay, jitterFactor);
    }

    static BackoffStrategy exponential(Duration initialDelay, double multiplier, Duration maxDelay, double jitterFactor) {
        return new ExponentialBackoff(initialDelay, multiplier, maxDelay, jitterFactor);
    }

    static BackoffStrategy fixed(Duration delay) {
        return new FixedBackoff(delay);
    }

    static BackoffStrategy linear(Duration step, Duration maxDelay) {
        return new LinearBackoff(step, maxDelay);
    }

    static BackoffStrategy none() {
        return retry -> Duration.ZERO;
    }
}

package com.ryuqq.primitives.recovery.retry;

import com.ryuqq.primitives.recovery.retry.backoff.BackoffStrategy;
import com.ryuqq.primitives.recovery.retry.backoff.ExponentialBackoff;

/**
 * RetryPrimitive 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxRetries: 첫 시도 이후 추가 시도 횟수 (기본 3, 총 시도는 maxRetries + 1)</li>
 *   <li>backoff: 재시도 간격 전략 (기본 exponential 100ms ~ 10s, jitter 0.1)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxRetries 최대 재시도 횟수 (0 이상이어야 함)
 * @param backoff 재시도 간격 전략
 */
public record RetryConfig(
    int maxRetries,
    BackoffStrategy backoff
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxRetries=3, backoff=exponential(100ms, x2, 10s, jitter 0.1)</p>
     */
    public RetryConfig() {
        this(3, new ExponentialBackoff());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries must not be negative (current: " + maxRetries + ")"
            );
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
    }

    /**
     * maxRetries만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withMaxRetries(int maxRetries) {
        return new RetryConfig(maxRetries, backoff);
    }

    /**
     * backoff만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withBackoff(BackoffStrategy backoff) {
        return new RetryConfig(maxRetries, backoff);
    }

    /**
     * 총 시도 횟수 (첫 시도 포함).
     */
    public int maxAttempts() {
        return maxRetries + 1;
    }
}

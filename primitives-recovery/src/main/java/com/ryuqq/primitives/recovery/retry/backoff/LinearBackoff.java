package com.ryuqq.primitives.recovery.retry.backoff;

import java.time.Duration;

/**
 * 선형 증가 backoff: step * retry, maxDelay로 상한.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LinearBackoff implements BackoffStrategy {

    private final Duration step;
    private final Duration maxDelay;

    /**
     * @param step 증가 폭 (양수)
     * @param maxDelay 최대 지연 (step 이상)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LinearBackoff(Duration step, Duration maxDelay) {
        if (step == null || step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("step must be positive (current: " + step + ")");
        }
        if (maxDelay == null || maxDelay.compareTo(step) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= step (step: " + step + ", max: " + maxDelay + ")"
            );
        }
        this.step = step;
        this.maxDelay = maxDelay;
    }

    @Override
    public Duration delayBefore(int retry) {
        if (retry <= 0) {
            throw new IllegalArgumentException("retry must be positive (current: " + retry + ")");
        }
        Duration delay = step.multipliedBy(retry);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}

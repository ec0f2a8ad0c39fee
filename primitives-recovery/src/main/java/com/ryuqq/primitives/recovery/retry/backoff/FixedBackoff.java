package com.ryuqq.primitives.recovery.retry.backoff;

import java.time.Duration;

/**
 * 고정 간격 backoff.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FixedBackoff implements BackoffStrategy {

    private final Duration delay;

    /**
     * @param delay 재시도 간격 (0 이상)
     * @throws IllegalArgumentException delay가 null이거나 음수인 경우
     */
    public FixedBackoff(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be null or negative (current: " + delay + ")");
        }
        this.delay = delay;
    }

    @Override
    public Duration delayBefore(int retry) {
        if (retry <= 0) {
            throw new IllegalArgumentException("retry must be positive (current: " + retry + ")");
        }
        return delay;
    }
}

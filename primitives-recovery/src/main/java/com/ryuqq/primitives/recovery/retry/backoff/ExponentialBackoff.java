package com.ryuqq.primitives.recovery.retry.backoff;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 지수 증가 backoff. 여러 호출자의 재시도 시점이 겹치지 않도록 대칭 jitter를 섞습니다.
 *
 * <pre>
 * nominal = min(initialDelay * multiplier^(retry-1), maxDelay)
 * delay   = clamp(nominal + nominal * jitterFactor * (2r - 1), 0, maxDelay)   r ∈ [0, 1)
 * </pre>
 *
 * <p>jitterFactor가 0이면 결정적입니다. 예: initialDelay=100ms, multiplier=2, maxDelay=1s이면
 * 100ms, 200ms, 400ms, 800ms, 1s, 1s ...</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExponentialBackoff implements BackoffStrategy {

    private static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(100);
    private static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);
    private static final double DEFAULT_MULTIPLIER = 2.0;
    private static final double DEFAULT_JITTER_FACTOR = 0.1;

    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본값: initialDelay=100ms, multiplier=2.0, maxDelay=10s, jitterFactor=0.1
     */
    public ExponentialBackoff() {
        this(DEFAULT_INITIAL_DELAY, DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY, DEFAULT_JITTER_FACTOR);
    }

    public ExponentialBackoff(Duration initialDelay, double multiplier, Duration maxDelay, double jitterFactor) {
        this(initialDelay, multiplier, maxDelay, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 생성자.
     *
     * @param initialDelay 첫 재시도 전 지연 (양수)
     * @param multiplier 재시도마다 곱하는 배수 (1.0 이상)
     * @param maxDelay 지연 상한 (initialDelay 이상)
     * @param jitterFactor nominal 대비 jitter 폭 (0.0 ~ 1.0)
     * @param random [0, 1) 범위의 난수 공급원
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExponentialBackoff(
        Duration initialDelay,
        double multiplier,
        Duration maxDelay,
        double jitterFactor,
        DoubleSupplier random
    ) {
        if (initialDelay == null || initialDelay.isZero() || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be positive (current: " + initialDelay + ")");
        }
        if (Double.isNaN(multiplier) || multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0 (current: " + multiplier + ")");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= initialDelay (initial: " + initialDelay + ", max: " + maxDelay + ")"
            );
        }
        if (Double.isNaN(jitterFactor) || jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    @Override
    public Duration delayBefore(int retry) {
        if (retry <= 0) {
            throw new IllegalArgumentException("retry must be positive (current: " + retry + ")");
        }
        double capMillis = maxDelay.toMillis();
        // pow가 Infinity가 되어도 min에서 상한으로 잘린다
        double nominal = Math.min(initialDelay.toMillis() * Math.pow(multiplier, retry - 1), capMillis);
        if (jitterFactor == 0.0) {
            return Duration.ofMillis(Math.round(nominal));
        }
        double spread = nominal * jitterFactor * (2 * random.getAsDouble() - 1);
        double jittered = Math.max(0.0, Math.min(nominal + spread, capMillis));
        return Duration.ofMillis(Math.round(jittered));
    }

    public Duration initialDelay() {
        return initialDelay;
    }

    public double multiplier() {
        return multiplier;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    public double jitterFactor() {
        return jitterFactor;
    }
}

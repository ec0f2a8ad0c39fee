package com.ryuqq.primitives.core.support;

import java.time.Duration;

/**
 * 대기 추상화.
 *
 * <p>재시도 backoff처럼 시간을 기다리는 코드가 실제 시간을 쓰지 않고 테스트될 수 있도록 주입합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 실제 스레드 대기를 사용하는 기본 구현.
     */
    Sleeper SYSTEM = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    /**
     * 지정 시간만큼 대기.
     *
     * @param duration 대기 시간
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    void sleep(Duration duration) throws InterruptedException;
}

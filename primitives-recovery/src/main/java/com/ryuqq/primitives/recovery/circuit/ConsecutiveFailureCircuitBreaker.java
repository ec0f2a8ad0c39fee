package com.ryuqq.primitives.recovery.circuit;

import com.ryuqq.primitives.core.protection.CircuitBreaker;
import com.ryuqq.primitives.core.protection.CircuitBreakerState;
import com.ryuqq.primitives.core.protection.CircuitPermit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 연속 실패 수 기반 Circuit Breaker.
 *
 * <p><strong>상태 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN: 연속 실패가 failureThreshold에 도달</li>
 *   <li>OPEN → HALF_OPEN: coolDown 경과 후 첫 tryAcquire()</li>
 *   <li>HALF_OPEN: 시험 호출 정확히 1건만 허용, 나머지는 거부</li>
 *   <li>HALF_OPEN → CLOSED: 시험 호출 성공</li>
 *   <li>HALF_OPEN → OPEN: 시험 호출 실패 (coolDown 다시 시작)</li>
 * </ul>
 *
 * <p>상태가 바뀔 때마다 세대(generation)가 증가하고, {@link CircuitPermit}은 발급 시점의 세대를 담습니다.
 * 지난 세대의 허가로 보고된 결과와 HALF_OPEN 중 시험 호출이 아닌 허가의 결과는 무시됩니다.</p>
 *
 * <p>모든 상태 변경은 하나의 {@link ReentrantLock} 안에서 일어나며, 시간은 주입된 {@link Clock}을 따릅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConsecutiveFailureCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ConsecutiveFailureCircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private Instant openedAt;
    private long generation;

    public ConsecutiveFailureCircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param name 로깅용 이름
     * @param config 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ConsecutiveFailureCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public Optional<CircuitPermit> tryAcquire() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return Optional.of(new CircuitPermit(generation, false));
                case OPEN:
                    if (clock.instant().isBefore(openedAt.plus(config.coolDown()))) {
                        return Optional.empty();
                    }
                    transitionTo(CircuitBreakerState.HALF_OPEN);
                    return Optional.of(new CircuitPermit(generation, true));
                case HALF_OPEN:
                    // 시험 호출은 세대마다 하나이며, 결과가 기록되면 상태가 바뀐다
                    return Optional.empty();
                default:
                    throw new IllegalStateException("Unknown state: " + state);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordSuccess(CircuitPermit permit) {
        requirePermit(permit);
        lock.lock();
        try {
            if (isStale(permit)) {
                log.debug("Circuit {} ignored stale success (permit generation {}, current {})",
                    name, permit.generation(), generation);
                return;
            }
            consecutiveFailures = 0;
            if (state == CircuitBreakerState.HALF_OPEN) {
                transitionTo(CircuitBreakerState.CLOSED);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordFailure(CircuitPermit permit, Throwable throwable) {
        requirePermit(permit);
        lock.lock();
        try {
            if (isStale(permit)) {
                log.debug("Circuit {} ignored stale failure (permit generation {}, current {})",
                    name, permit.generation(), generation);
                return;
            }
            if (state == CircuitBreakerState.HALF_OPEN) {
                open();
                return;
            }
            consecutiveFailures++;
            if (consecutiveFailures >= config.failureThreshold()) {
                open();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            consecutiveFailures = 0;
            openedAt = null;
            transitionTo(CircuitBreakerState.CLOSED);
            generation++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 연속 실패 수.
     */
    public int consecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 상태 세대. 상태가 바뀌거나 reset될 때마다 증가합니다.
     */
    public long generation() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }

    private boolean isStale(CircuitPermit permit) {
        if (permit.generation() != generation || state == CircuitBreakerState.OPEN) {
            return true;
        }
        return state == CircuitBreakerState.HALF_OPEN && !permit.trial();
    }

    private static void requirePermit(CircuitPermit permit) {
        if (permit == null) {
            throw new IllegalArgumentException("permit cannot be null");
        }
    }

    private void open() {
        openedAt = clock.instant();
        consecutiveFailures = 0;
        transitionTo(CircuitBreakerState.OPEN);
    }

    private void transitionTo(CircuitBreakerState next) {
        if (state != next) {
            log.info("Circuit {} transition {} → {}", name, state, next);
            state = next;
            generation++;
        }
    }
}

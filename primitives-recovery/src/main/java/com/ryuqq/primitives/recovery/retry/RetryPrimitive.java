package com.ryuqq.primitives.recovery.retry;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.error.RetryExhaustedException;
import com.ryuqq.primitives.core.instrumentation.InstrumentationSink;
import com.ryuqq.primitives.core.instrumentation.SafeInstrumentationSink;
import com.ryuqq.primitives.core.instrumentation.noop.NoOpInstrumentationSink;
import com.ryuqq.primitives.core.support.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.function.Predicate;

/**
 * 재시도 데코레이터.
 *
 * <p>감싼 Primitive가 예외를 던지면 backoff만큼 기다린 뒤 같은 입력과 Context로 다시 실행합니다.</p>
 *
 * <p><strong>종료 조건:</strong></p>
 * <ul>
 *   <li>성공: 그 결과를 반환</li>
 *   <li>재시도 불가 예외 (retryOn이 false): 즉시 다시 던짐</li>
 *   <li>maxRetries 소진: 마지막 예외를 다시 던짐</li>
 * </ul>
 *
 * <p>다시 던지는 예외는 원래 타입 그대로이며, 시도 횟수를 담은
 * {@link RetryExhaustedException}이 suppressed로 붙습니다.
 * 총 시도 횟수는 항상 {@code maxRetries + 1} 이하입니다.</p>
 *
 * <p><strong>계측 이벤트:</strong> {@code retry.attempt}, {@code retry.exhausted}, {@code retry.aborted}</p>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RetryPrimitive<I, O> implements Primitive<I, O> {

    private static final Logger log = LoggerFactory.getLogger(RetryPrimitive.class);

    private final Primitive<I, O> delegate;
    private final RetryConfig config;
    private final Predicate<Throwable> retryOn;
    private final Sleeper sleeper;
    private final InstrumentationSink sink;

    /**
     * 기본 설정으로 생성 (3회 재시도, exponential backoff).
     */
    public RetryPrimitive(Primitive<I, O> delegate) {
        this(delegate, new RetryConfig());
    }

    public RetryPrimitive(Primitive<I, O> delegate, RetryConfig config) {
        this(delegate, config, RetryPredicates.defaultPolicy(), Sleeper.SYSTEM, NoOpInstrumentationSink.INSTANCE);
    }

    /**
     * 생성자.
     *
     * @param delegate 감쌀 Primitive
     * @param config 재시도 설정
     * @param retryOn 재시도 여부 판단 조건
     * @param sleeper backoff 대기 구현
     * @param sink 계측 sink
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RetryPrimitive(
        Primitive<I, O> delegate,
        RetryConfig config,
        Predicate<Throwable> retryOn,
        Sleeper sleeper,
        InstrumentationSink sink
    ) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (retryOn == null) {
            throw new IllegalArgumentException("retryOn cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.delegate = delegate;
        this.config = config;
        this.retryOn = retryOn;
        this.sleeper = sleeper;
        this.sink = SafeInstrumentationSink.wrap(sink);
    }

    @Override
    public O execute(I input, Context context) throws Exception {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return delegate.execute(input, context);
            } catch (Exception e) {
                if (!retryOn.test(e)) {
                    log.debug("{} failed with non-retryable {} on attempt {}", name(), e.getClass().getSimpleName(), attempt);
                    sink.event(name(), "retry.aborted", context, attributes(attempt, e));
                    throw exhausted(e, attempt);
                }
                if (attempt > config.maxRetries()) {
                    log.warn("{} exhausted {} attempt(s): {}", name(), attempt, e.toString());
                    sink.event(name(), "retry.exhausted", context, attributes(attempt, e));
                    throw exhausted(e, attempt);
                }

                Duration delay = config.backoff().delayBefore(attempt);
                log.debug("{} attempt {} failed, retrying in {}ms", name(), attempt, delay.toMillis());
                sink.event(name(), "retry.attempt", context, Map.of(
                    "attempt", String.valueOf(attempt),
                    "delayMs", String.valueOf(delay.toMillis()),
                    "error", e.getClass().getSimpleName()
                ));
                backoff(delay, e);
            }
        }
    }

    private void backoff(Duration delay, Exception lastFailure) throws InterruptedException {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            e.addSuppressed(lastFailure);
            throw e;
        }
    }

    private Exception exhausted(Exception failure, int attempts) {
        failure.addSuppressed(new RetryExhaustedException(delegate.name(), attempts));
        return failure;
    }

    private static Map<String, String> attributes(int attempt, Exception error) {
        return Map.of(
            "attempt", String.valueOf(attempt),
            "error", error.getClass().getSimpleName()
        );
    }

    @Override
    public String name() {
        return "retry(" + delegate.name() + ")";
    }

    public RetryConfig config() {
        return config;
    }
}

package com.ryuqq.primitives.recovery.circuit;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.error.CircuitOpenException;
import com.ryuqq.primitives.core.instrumentation.InstrumentationSink;
import com.ryuqq.primitives.core.instrumentation.SafeInstrumentationSink;
import com.ryuqq.primitives.core.instrumentation.noop.NoOpInstrumentationSink;
import com.ryuqq.primitives.core.protection.CircuitBreaker;
import com.ryuqq.primitives.core.protection.CircuitBreakerState;
import com.ryuqq.primitives.core.protection.CircuitPermit;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Circuit Breaker 데코레이터.
 *
 * <p>{@link CircuitBreaker#tryAcquire()}가 허가를 내주지 않으면 감싼 Primitive를 호출하지 않고
 * {@link CircuitOpenException}을 던집니다. 허가를 받으면 실행 결과를 그 허가와 함께 breaker에 기록합니다.</p>
 *
 * <p><strong>계측 이벤트:</strong></p>
 * <ul>
 *   <li>{@code circuit.rejected}: 호출 거부</li>
 *   <li>{@code circuit.closed} / {@code circuit.open} / {@code circuit.half_open}: 상태 변경</li>
 * </ul>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CircuitBreakerPrimitive<I, O> implements Primitive<I, O> {

    private final Primitive<I, O> delegate;
    private final CircuitBreaker breaker;
    private final InstrumentationSink sink;

    /**
     * 연속 실패 기반 breaker로 생성.
     */
    public CircuitBreakerPrimitive(Primitive<I, O> delegate, CircuitBreakerConfig config) {
        this(delegate, new ConsecutiveFailureCircuitBreaker(requireName(delegate), config), NoOpInstrumentationSink.INSTANCE);
    }

    /**
     * 생성자.
     *
     * @param delegate 감쌀 Primitive
     * @param breaker Circuit Breaker 구현
     * @param sink 계측 sink
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CircuitBreakerPrimitive(Primitive<I, O> delegate, CircuitBreaker breaker, InstrumentationSink sink) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (breaker == null) {
            throw new IllegalArgumentException("breaker cannot be null");
        }
        this.delegate = delegate;
        this.breaker = breaker;
        this.sink = SafeInstrumentationSink.wrap(sink);
    }

    @Override
    public O execute(I input, Context context) throws Exception {
        CircuitBreakerState before = breaker.getState();
        Optional<CircuitPermit> acquired = breaker.tryAcquire();
        before = reportTransition(before, context);
        if (acquired.isEmpty()) {
            sink.event(name(), "circuit.rejected", context, Map.of("state", before.name()));
            throw new CircuitOpenException(delegate.name());
        }

        CircuitPermit permit = acquired.get();
        try {
            O result = delegate.execute(input, context);
            breaker.recordSuccess(permit);
            return result;
        } catch (Exception | Error e) {
            breaker.recordFailure(permit, e);
            throw e;
        } finally {
            reportTransition(before, context);
        }
    }

    private CircuitBreakerState reportTransition(CircuitBreakerState before, Context context) {
        CircuitBreakerState after = breaker.getState();
        if (after != before) {
            sink.event(name(), "circuit." + after.name().toLowerCase(Locale.ROOT), context, Map.of(
                "from", before.name(),
                "to", after.name()
            ));
        }
        return after;
    }

    private static String requireName(Primitive<?, ?> delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        return delegate.name();
    }

    @Override
    public String name() {
        return "circuitBreaker(" + delegate.name() + ")";
    }

    public CircuitBreakerState state() {
        return breaker.getState();
    }

    public CircuitBreaker breaker() {
        return breaker;
    }
}

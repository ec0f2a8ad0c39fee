package com.ryuqq.primitives.core.instrumentation;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.context.Context;

import java.time.Duration;

/**
 * 계측 hook 데코레이터.
 *
 * <p>감싼 Primitive의 실행 전후로 sink에 구간 시작/종료를 알리고,
 * Context에 {@code <name>.start} / {@code <name>.end} 체크포인트를 남깁니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>결과와 예외는 그대로 통과 (예외 타입 변경 없음)</li>
 *   <li>종료 상태는 {@link ExecutionStatus#of(Throwable)}로 결정</li>
 *   <li>sink 예외는 {@link SafeInstrumentationSink}가 격리</li>
 * </ul>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InstrumentedPrimitive<I, O> implements Primitive<I, O> {

    private final Primitive<I, O> delegate;
    private final InstrumentationSink sink;

    /**
     * 생성자.
     *
     * @param delegate 감쌀 Primitive
     * @param sink 계측 sink
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public InstrumentedPrimitive(Primitive<I, O> delegate, InstrumentationSink sink) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.delegate = delegate;
        this.sink = SafeInstrumentationSink.wrap(sink);
    }

    @Override
    public O execute(I input, Context context) throws Exception {
        String name = delegate.name();
        SpanRecord span = SpanRecord.start(name, context);
        context.checkpoint(name + ".start");
        sink.spanStarted(span);

        Throwable failure = null;
        try {
            return delegate.execute(input, context);
        } catch (Exception | Error e) {
            failure = e;
            throw e;
        } finally {
            Duration duration = Duration.between(span.startedAt(), context.clock().instant());
            context.checkpoint(name + ".end");
            sink.spanEnded(span, ExecutionStatus.of(failure), duration, failure);
        }
    }

    @Override
    public String name() {
        return delegate.name();
    }

    public Primitive<I, O> delegate() {
        return delegate;
    }
}

package com.ryuqq.primitives.core.instrumentation;

import com.ryuqq.primitives.core.context.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * sink 실패를 격리하는 래퍼.
 *
 * <p>감싼 sink가 던진 {@link RuntimeException}은 WARN 로그로 남기고 호출자에게 전파하지 않습니다.
 * 계측 실패로 작업 결과가 바뀌지 않도록 모든 데코레이터는 sink를 이 래퍼로 감쌉니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SafeInstrumentationSink implements InstrumentationSink {

    private static final Logger log = LoggerFactory.getLogger(SafeInstrumentationSink.class);

    private final InstrumentationSink delegate;

    private SafeInstrumentationSink(InstrumentationSink delegate) {
        this.delegate = delegate;
    }

    /**
     * sink를 감쌈 (이미 감싼 sink는 그대로 반환).
     *
     * @param sink 감쌀 sink
     * @return 예외가 격리된 sink
     * @throws IllegalArgumentException sink가 null인 경우
     */
    public static InstrumentationSink wrap(InstrumentationSink sink) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        if (sink instanceof SafeInstrumentationSink) {
            return sink;
        }
        return new SafeInstrumentationSink(sink);
    }

    @Override
    public void spanStarted(SpanRecord span) {
        try {
            delegate.spanStarted(span);
        } catch (RuntimeException e) {
            log.warn("Instrumentation sink failed on spanStarted for {}", span.primitiveName(), e);
        }
    }

    @Override
    public void spanEnded(SpanRecord span, ExecutionStatus status, Duration duration, Throwable error) {
        try {
            delegate.spanEnded(span, status, duration, error);
        } catch (RuntimeException e) {
            log.warn("Instrumentation sink failed on spanEnded for {}", span.primitiveName(), e);
        }
    }

    @Override
    public void event(String primitiveName, String event, Context context, Map<String, String> attributes) {
        try {
            delegate.event(primitiveName, event, context, attributes);
        } catch (RuntimeException e) {
            log.warn("Instrumentation sink failed on event {} for {}", event, primitiveName, e);
        }
    }
}

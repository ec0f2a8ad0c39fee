package com.ryuqq.primitives.core.instrumentation;

import com.ryuqq.primitives.core.context.Context;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 여러 sink로 같은 신호를 전달하는 sink.
 *
 * <p>각 sink는 {@link SafeInstrumentationSink}로 감싸지므로 하나의 실패가 나머지 sink 호출을 막지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CompositeInstrumentationSink implements InstrumentationSink {

    private final List<InstrumentationSink> sinks;

    /**
     * 생성자.
     *
     * @param sinks 대상 sink 목록 (등록 순서대로 호출)
     * @throws IllegalArgumentException sinks가 null이거나 null 원소를 포함한 경우
     */
    public CompositeInstrumentationSink(List<? extends InstrumentationSink> sinks) {
        if (sinks == null) {
            throw new IllegalArgumentException("sinks cannot be null");
        }
        this.sinks = sinks.stream()
            .map(SafeInstrumentationSink::wrap)
            .collect(Collectors.toUnmodifiableList());
    }

    public static CompositeInstrumentationSink of(InstrumentationSink... sinks) {
        return new CompositeInstrumentationSink(List.of(sinks));
    }

    @Override
    public void spanStarted(SpanRecord span) {
        for (InstrumentationSink sink : sinks) {
            sink.spanStarted(span);
        }
    }

    @Override
    public void spanEnded(SpanRecord span, ExecutionStatus status, Duration duration, Throwable error) {
        for (InstrumentationSink sink : sinks) {
            sink.spanEnded(span, status, duration, error);
        }
    }

    @Override
    public void event(String primitiveName, String event, Context context, Map<String, String> attributes) {
        for (InstrumentationSink sink : sinks) {
            sink.event(primitiveName, event, context, attributes);
        }
    }

    public int size() {
        return sinks.size();
    }
}

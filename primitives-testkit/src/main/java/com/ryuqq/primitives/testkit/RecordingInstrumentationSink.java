package com.ryuqq.primitives.testkit;

import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.instrumentation.ExecutionStatus;
import com.ryuqq.primitives.core.instrumentation.InstrumentationSink;
import com.ryuqq.primitives.core.instrumentation.SpanRecord;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 받은 계측 신호를 모두 기록하는 테스트용 sink.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RecordingInstrumentationSink implements InstrumentationSink {

    /**
     * 종료된 구간.
     */
    public record EndedSpan(SpanRecord span, ExecutionStatus status, Duration duration, Throwable error) {
    }

    /**
     * 데코레이터 이벤트.
     */
    public record RecordedEvent(String primitiveName, String event, Map<String, String> attributes) {
    }

    private final List<SpanRecord> started = new CopyOnWriteArrayList<>();
    private final List<EndedSpan> ended = new CopyOnWriteArrayList<>();
    private final List<RecordedEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void spanStarted(SpanRecord span) {
        started.add(span);
    }

    @Override
    public void spanEnded(SpanRecord span, ExecutionStatus status, Duration duration, Throwable error) {
        ended.add(new EndedSpan(span, status, duration, error));
    }

    @Override
    public void event(String primitiveName, String event, Context context, Map<String, String> attributes) {
        events.add(new RecordedEvent(primitiveName, event, Map.copyOf(attributes)));
    }

    public List<SpanRecord> started() {
        return List.copyOf(started);
    }

    public List<EndedSpan> ended() {
        return List.copyOf(ended);
    }

    public List<RecordedEvent> events() {
        return List.copyOf(events);
    }

    /**
     * 이름으로 이벤트 필터링.
     */
    public List<RecordedEvent> events(String event) {
        return events.stream().filter(e -> e.event().equals(event)).collect(Collectors.toUnmodifiableList());
    }

    public void clear() {
        started.clear();
        ended.clear();
        events.clear();
    }
}

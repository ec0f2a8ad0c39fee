package com.ryuqq.primitives.core.instrumentation.noop;

import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.instrumentation.ExecutionStatus;
import com.ryuqq.primitives.core.instrumentation.InstrumentationSink;
import com.ryuqq.primitives.core.instrumentation.SpanRecord;

import java.time.Duration;
import java.util.Map;

/**
 * InstrumentationSink NoOp 구현.
 *
 * <p>모든 신호를 무시합니다. sink를 지정하지 않은 Primitive의 기본값입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpInstrumentationSink implements InstrumentationSink {

    /**
     * 공유 인스턴스 (상태 없음).
     */
    public static final NoOpInstrumentationSink INSTANCE = new NoOpInstrumentationSink();

    @Override
    public void spanStarted(SpanRecord span) {
        // NoOp
    }

    @Override
    public void spanEnded(SpanRecord span, ExecutionStatus status, Duration duration, Throwable error) {
        // NoOp
    }

    @Override
    public void event(String primitiveName, String event, Context context, Map<String, String> attributes) {
        // NoOp
    }
}

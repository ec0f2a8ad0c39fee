package com.ryuqq.primitives.core.instrumentation;

import com.ryuqq.primitives.core.context.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * SLF4J 로그로 계측 신호를 남기는 sink.
 *
 * <p><strong>로그 레벨:</strong></p>
 * <ul>
 *   <li>spanStarted: DEBUG</li>
 *   <li>spanEnded SUCCESS: DEBUG, 그 외: WARN (예외 포함)</li>
 *   <li>event: INFO</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Slf4jInstrumentationSink implements InstrumentationSink {

    private static final Logger log = LoggerFactory.getLogger(Slf4jInstrumentationSink.class);

    @Override
    public void spanStarted(SpanRecord span) {
        log.debug("Primitive {} started (correlationId={}, spanId={})",
            span.primitiveName(), span.correlationId(), span.spanId());
    }

    @Override
    public void spanEnded(SpanRecord span, ExecutionStatus status, Duration duration, Throwable error) {
        if (status == ExecutionStatus.SUCCESS) {
            log.debug("Primitive {} completed in {}ms (correlationId={})",
                span.primitiveName(), duration.toMillis(), span.correlationId());
            return;
        }
        log.warn("Primitive {} ended with {} after {}ms (correlationId={})",
            span.primitiveName(), status, duration.toMillis(), span.correlationId(), error);
    }

    @Override
    public void event(String primitiveName, String event, Context context, Map<String, String> attributes) {
        log.info("Primitive {} event {} {} (correlationId={})",
            primitiveName, event, attributes, context.correlationId());
    }
}

package com.ryuqq.primitives.adapter.micrometer;

import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.instrumentation.ExecutionStatus;
import com.ryuqq.primitives.core.instrumentation.InstrumentationSink;
import com.ryuqq.primitives.core.instrumentation.SpanRecord;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer 기반 {@link InstrumentationSink} 구현체.
 *
 * <p><strong>메트릭:</strong></p>
 * <ul>
 *   <li><b>primitive.executions (Counter)</b>: 실행 횟수 (tag: primitive, status)</li>
 *   <li><b>primitive.duration (Timer)</b>: 실행 시간 (tag: primitive, status)</li>
 *   <li><b>primitive.active (Gauge)</b>: 현재 실행 중인 수 (tag: primitive)</li>
 *   <li><b>primitive.events (Counter)</b>: 데코레이터 이벤트 수 (tag: primitive, event)</li>
 * </ul>
 *
 * <p>status 태그 값은 {@link ExecutionStatus#tagValue()}를 따릅니다
 * (success, failure, timeout, rejected).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * InstrumentationSink sink = new MicrometerInstrumentationSink(registry);
 * Primitive<Order, Receipt> instrumented = Primitives.instrument(checkout, sink);
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MicrometerInstrumentationSink implements InstrumentationSink {

    private static final Logger log = LoggerFactory.getLogger(MicrometerInstrumentationSink.class);

    public static final String EXECUTIONS = "primitive.executions";
    public static final String DURATION = "primitive.duration";
    public static final String ACTIVE = "primitive.active";
    public static final String EVENTS = "primitive.events";

    private final MeterRegistry registry;

    // Gauge backing fields (primitive 이름별 1회 등록)
    private final Map<String, AtomicInteger> active = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param registry 메트릭을 등록할 MeterRegistry
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public MicrometerInstrumentationSink(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    @Override
    public void spanStarted(SpanRecord span) {
        activeFor(span.primitiveName()).incrementAndGet();
    }

    @Override
    public void spanEnded(SpanRecord span, ExecutionStatus status, Duration duration, Throwable error) {
        String primitive = span.primitiveName();
        activeFor(primitive).decrementAndGet();

        Counter.builder(EXECUTIONS)
            .description("Primitive executions by outcome")
            .tag("primitive", primitive)
            .tag("status", status.tagValue())
            .register(registry)
            .increment();

        Timer.builder(DURATION)
            .description("Primitive execution time")
            .tag("primitive", primitive)
            .tag("status", status.tagValue())
            .register(registry)
            .record(duration);
    }

    @Override
    public void event(String primitiveName, String event, Context context, Map<String, String> attributes) {
        Counter.builder(EVENTS)
            .description("Decorator events (retry, timeout, circuit, cache, ...)")
            .tag("primitive", primitiveName)
            .tag("event", event)
            .register(registry)
            .increment();
    }

    private AtomicInteger activeFor(String primitive) {
        return active.computeIfAbsent(primitive, name -> {
            AtomicInteger gauge = new AtomicInteger();
            Gauge.builder(ACTIVE, gauge, AtomicInteger::get)
                .description("Currently running primitive executions")
                .tag("primitive", name)
                .register(registry);
            log.debug("Registered {} gauge for primitive {}", ACTIVE, name);
            return gauge;
        });
    }
}

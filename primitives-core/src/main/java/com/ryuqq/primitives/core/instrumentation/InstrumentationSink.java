package com.ryuqq.primitives.core.instrumentation;

import com.ryuqq.primitives.core.context.Context;

import java.time.Duration;
import java.util.Map;

/**
 * 계측 hook SPI.
 *
 * <p>Primitive 실행의 시작/종료와 데코레이터 이벤트(재시도, 캐시 적중, Circuit 상태 변경 등)를
 * 받아 로그, 메트릭, 추적 백엔드로 전달합니다.</p>
 *
 * <p><strong>구현 규약:</strong></p>
 * <ul>
 *   <li>가능한 한 빠르게 반환해야 합니다 (실행 경로에서 동기 호출됨)</li>
 *   <li>sink 실패가 작업 결과를 바꾸어서는 안 됩니다.
 *       {@link SafeInstrumentationSink}로 감싸면 예외가 격리됩니다.</li>
 * </ul>
 *
 * <p>sink를 지정하지 않은 Primitive는
 * {@link com.ryuqq.primitives.core.instrumentation.noop.NoOpInstrumentationSink}를 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface InstrumentationSink {

    /**
     * 실행 시작.
     *
     * @param span 시작한 구간
     */
    void spanStarted(SpanRecord span);

    /**
     * 실행 종료.
     *
     * @param span 종료한 구간
     * @param status 종료 상태
     * @param duration 실행 시간
     * @param error 실패 원인 (성공 시 null)
     */
    void spanEnded(SpanRecord span, ExecutionStatus status, Duration duration, Throwable error);

    /**
     * 데코레이터 이벤트.
     *
     * @param primitiveName 이벤트를 발생시킨 Primitive 이름
     * @param event 이벤트 이름 (예: retry.attempt, cache.hit, circuit.opened)
     * @param context 실행 컨텍스트
     * @param attributes 추가 속성
     */
    void event(String primitiveName, String event, Context context, Map<String, String> attributes);
}

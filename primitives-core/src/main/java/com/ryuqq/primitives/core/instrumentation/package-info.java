/**
 * 계측 hook 패키지.
 *
 * <p>Primitive 실행의 진입/종료/예외를 관찰하는 SPI와 기본 구현을 제공합니다.</p>
 *
 * <p><strong>주요 구성요소:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.primitives.core.instrumentation.InstrumentationSink}: 계측 SPI</li>
 *   <li>{@link com.ryuqq.primitives.core.instrumentation.InstrumentedPrimitive}: 임의 Primitive를 감싸는 hook 데코레이터</li>
 *   <li>{@link com.ryuqq.primitives.core.instrumentation.SafeInstrumentationSink}: sink 예외 격리</li>
 *   <li>{@link com.ryuqq.primitives.core.instrumentation.CompositeInstrumentationSink}: 다중 sink</li>
 *   <li>{@link com.ryuqq.primitives.core.instrumentation.Slf4jInstrumentationSink}: 로그 sink</li>
 * </ul>
 *
 * <p>Micrometer 메트릭 sink는 {@code primitives-adapter-micrometer} 모듈에 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.core.instrumentation;

/**
 * 테스트 지원 패키지.
 *
 * <p>Primitive와 데코레이터를 테스트할 때 재사용하는 test double을 제공합니다.</p>
 *
 * <p><strong>주요 구성요소:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.primitives.testkit.CountingPrimitive}: 호출 횟수/동시 실행 수 기록</li>
 *   <li>{@link com.ryuqq.primitives.testkit.FailingPrimitive}: N번 실패 후 성공</li>
 *   <li>{@link com.ryuqq.primitives.testkit.SleepingPrimitive}: 지연 후 반환, 인터럽트 감지</li>
 *   <li>{@link com.ryuqq.primitives.testkit.RecordingInstrumentationSink}: 계측 신호 기록</li>
 *   <li>{@link com.ryuqq.primitives.testkit.MutableClock}: 수동 진행 Clock</li>
 *   <li>{@link com.ryuqq.primitives.testkit.RecordingSleeper}: 대기 없이 backoff 기록</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.testkit;

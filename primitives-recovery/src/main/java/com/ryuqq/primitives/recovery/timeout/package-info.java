/**
 * 실행 시간 제한 데코레이터 패키지.
 *
 * <p>{@link com.ryuqq.primitives.recovery.timeout.TimeoutPrimitive}는 인터럽트 기반의 soft timeout입니다.
 * 인터럽트에 반응하지 않는 작업은 시간 초과 이후에도 백그라운드에서 끝까지 실행될 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.recovery.timeout;

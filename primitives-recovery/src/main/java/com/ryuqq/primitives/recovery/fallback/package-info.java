/**
 * 대체 경로 데코레이터 패키지.
 *
 * <p>{@link com.ryuqq.primitives.recovery.fallback.FallbackPrimitive}는 예외가 발생했을 때만 동작합니다.
 * 특정 반환 값을 실패로 취급하려면 primary에서 예외로 바꾸어 던져야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.recovery.fallback;

/**
 * 병렬 분기 결과 모델 패키지.
 *
 * <p>{@link com.ryuqq.primitives.core.combinator.SettledParallelPrimitive}가 반환하는
 * 분기별 결과를 sealed 계층으로 표현합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.core.outcome;

/**
 * 조합기 패키지.
 *
 * <p>자식 Primitive를 순서 있게 소유하는 조합기를 제공합니다.</p>
 *
 * <p><strong>주요 구성요소:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.primitives.core.combinator.SequentialPrimitive}: 출력→입력 파이프, Context 공유</li>
 *   <li>{@link com.ryuqq.primitives.core.combinator.ParallelPrimitive}: fail-fast 병렬, 입력 순서 결과</li>
 *   <li>{@link com.ryuqq.primitives.core.combinator.SettledParallelPrimitive}: 모든 분기 결과 수집</li>
 *   <li>{@link com.ryuqq.primitives.core.combinator.RouterPrimitive}: 이름 기반 분기 + default route</li>
 * </ul>
 *
 * <p><strong>Context 전파:</strong></p>
 * <ul>
 *   <li>Sequential / Router: 같은 Context 전달</li>
 *   <li>Parallel: 분기마다 createChild()</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.core.combinator;

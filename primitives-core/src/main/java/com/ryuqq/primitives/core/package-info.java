/**
 * Primitive 실행 규약 패키지.
 *
 * <p>모든 작업 단위가 구현하는 {@link com.ryuqq.primitives.core.Primitive} 인터페이스와
 * 생성 팩토리를 제공합니다.</p>
 *
 * <p><strong>주요 구성요소:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.primitives.core.Primitive}: execute(input, context) 규약</li>
 *   <li>{@link com.ryuqq.primitives.core.LambdaPrimitive}: 이름 있는 람다 leaf</li>
 *   <li>{@link com.ryuqq.primitives.core.Primitives}: 조합기 생성 팩토리</li>
 * </ul>
 *
 * <p><strong>Primitive 종류:</strong></p>
 * <ul>
 *   <li>Leaf: 사용자 작업 (LambdaPrimitive, 사용자 클래스)</li>
 *   <li>Combinator: 순서 있는 자식 목록을 소유 (Sequential, Parallel, Router)</li>
 *   <li>Decorator: 정확히 하나의 Primitive를 감쌈 (Retry, Timeout, Cache 등)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.core;

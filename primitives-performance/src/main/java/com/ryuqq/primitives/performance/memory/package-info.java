/**
 * 4계층 메모리.
 *
 * <ul>
 *   <li>Layer 1 {@link com.ryuqq.primitives.performance.memory.SessionMemory}: 세션별 대화 기록</li>
 *   <li>Layer 2 {@link com.ryuqq.primitives.performance.memory.WindowMemory}: 최근 구간 조회</li>
 *   <li>Layer 3 {@link com.ryuqq.primitives.performance.memory.DeepMemory}: 키워드/태그 검색 장기 기억</li>
 *   <li>Layer 4 {@link com.ryuqq.primitives.performance.memory.FactMemory}: Permanent Architectural Facts</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.primitives.performance.memory.MemoryPrimitive}가 네 계층을 하나의 Primitive로 묶습니다.
 * 작업 흐름 단계별 로딩은 {@link com.ryuqq.primitives.performance.memory.StageLoadPlan}을 따릅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.performance.memory;

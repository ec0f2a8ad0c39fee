/**
 * 결과 캐시 데코레이터와 저장소.
 *
 * <p>{@link com.ryuqq.primitives.performance.cache.CachePrimitive}는
 * {@link com.ryuqq.primitives.performance.cache.EntryStore} 위에서 동작하며
 * 로컬 LRU, 원격, 2계층(L1 로컬 + L2 원격) 저장소를 선택할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.performance.cache;

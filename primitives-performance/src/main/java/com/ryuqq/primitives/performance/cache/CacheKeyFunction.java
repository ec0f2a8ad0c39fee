package com.ryuqq.primitives.performance.cache;

import com.ryuqq.primitives.core.context.Context;

/**
 * 입력과 Context로부터 캐시 키를 만드는 결정적 함수.
 *
 * <p>같은 입력에 대해 항상 같은 키를 반환해야 합니다.</p>
 *
 * @param <I> 입력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 * @see CacheKeys
 */
@FunctionalInterface
public interface CacheKeyFunction<I> {

    /**
     * 캐시 키 계산.
     *
     * @param input 입력
     * @param context 실행 컨텍스트
     * @return 캐시 키 (null 불가)
     */
    String keyFor(I input, Context context);
}

package com.ryuqq.primitives.core.combinator;

import com.ryuqq.primitives.core.context.Context;

/**
 * Router의 route 선택 함수.
 *
 * <p>selector가 던진 예외는 default route로 대체되지 않고 그대로 전파됩니다.</p>
 *
 * @param <I> 입력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RouteSelector<I> {

    /**
     * route 이름 선택.
     *
     * @param input 입력 값
     * @param context 실행 컨텍스트
     * @return route 이름 (등록되지 않은 이름이면 default route 사용)
     * @throws Exception 선택 실패 시
     */
    String select(I input, Context context) throws Exception;
}

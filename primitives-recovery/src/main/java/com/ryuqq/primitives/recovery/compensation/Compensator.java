package com.ryuqq.primitives.recovery.compensation;

import com.ryuqq.primitives.core.context.Context;

/**
 * 완료된 단계를 되돌리는 보상 작업.
 *
 * @param <I> 단계 입력 타입
 * @param <O> 단계 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Compensator<I, O> {

    /**
     * 보상 실행.
     *
     * @param input 단계가 받았던 입력
     * @param output 단계가 반환했던 출력
     * @param context 실행 컨텍스트
     * @throws Exception 보상 실패 시 (기록만 되고 전파되지 않음)
     */
    void compensate(I input, O output, Context context) throws Exception;

    /**
     * 아무것도 하지 않는 보상 (되돌릴 것이 없는 단계용).
     */
    static <I, O> Compensator<I, O> none() {
        return (input, output, context) -> {
        };
    }
}

package com.ryuqq.primitives.core;

import com.ryuqq.primitives.core.combinator.SequentialPrimitive;
import com.ryuqq.primitives.core.context.Context;

/**
 * 합성 가능한 작업 단위(Primitive).
 *
 * <p>모든 조합기(Sequential, Parallel, Router)와 데코레이터(Retry, Timeout, Cache 등)는
 * 이 인터페이스를 구현하며, 호출자는 트리의 루트에서 {@link #execute(Object, Context)}를 한 번 호출합니다.</p>
 *
 * <p><strong>실행 규약:</strong></p>
 * <ul>
 *   <li>입력과 {@link Context}를 받아 출력 하나를 반환하거나 예외를 던집니다.</li>
 *   <li>암묵적인 재시도나 타임아웃은 없습니다. 필요한 경우 데코레이터로 감쌉니다.</li>
 *   <li>leaf 실패는 원래 예외 타입 그대로 전파됩니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Primitive<String, Integer> parse = Primitives.lambda("parse", (s, ctx) -> Integer.parseInt(s));
 * Primitive<Integer, Integer> twice = Primitives.lambda("twice", (n, ctx) -> n * 2);
 *
 * Integer result = parse.then(twice).execute("21", Context.create());   // 42
 * }</pre>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Primitive<I, O> {

    /**
     * Primitive 실행.
     *
     * @param input 입력 값
     * @param context 호출 단위로 전파되는 컨텍스트
     * @return 실행 결과
     * @throws Exception 작업 실패 시 (원래 예외 그대로)
     */
    O execute(I input, Context context) throws Exception;

    /**
     * Primitive 이름 (로깅, 계측, 체크포인트에 사용).
     *
     * @return 기본값은 구현 클래스의 simple name
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * 이 Primitive의 출력을 다음 Primitive의 입력으로 연결합니다.
     *
     * <p>{@link SequentialPrimitive}를 생성하며, 이미 Sequential인 쪽은 중첩하지 않고 평탄화합니다.
     * 따라서 {@code (a.then(b)).then(c)}와 {@code a.then(b.then(c))}는 같은 단계 목록을 가집니다.</p>
     *
     * @param next 다음 단계
     * @param <R> 최종 출력 타입
     * @return 두 단계를 순차 실행하는 Primitive
     * @throws IllegalArgumentException next가 null인 경우
     */
    default <R> Primitive<I, R> then(Primitive<? super O, ? extends R> next) {
        return SequentialPrimitive.<I, O, R>of(this, next);
    }
}

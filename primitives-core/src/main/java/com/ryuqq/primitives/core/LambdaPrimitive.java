package com.ryuqq.primitives.core;

import com.ryuqq.primitives.core.context.Context;

/**
 * 이름이 붙은 함수형 leaf Primitive.
 *
 * <p>람다로 작성한 본문에 사람이 읽을 수 있는 이름을 부여합니다.
 * 람다 클래스의 simple name은 로그와 메트릭 태그로 쓰기 어렵기 때문입니다.</p>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LambdaPrimitive<I, O> implements Primitive<I, O> {

    private final String name;
    private final Primitive<I, O> body;

    /**
     * 생성자.
     *
     * @param name Primitive 이름
     * @param body 실제 작업
     * @throws IllegalArgumentException name이 비어 있거나 body가 null인 경우
     */
    public LambdaPrimitive(String name, Primitive<I, O> body) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        this.name = name;
        this.body = body;
    }

    @Override
    public O execute(I input, Context context) throws Exception {
        return body.execute(input, context);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "LambdaPrimitive[" + name + "]";
    }
}

package com.ryuqq.primitives.core.combinator;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 순차 실행 조합기.
 *
 * <p>단계를 왼쪽에서 오른쪽으로 실행하며, 각 단계의 출력이 다음 단계의 입력이 됩니다.</p>
 *
 * <p><strong>실행 규칙:</strong></p>
 * <ul>
 *   <li>모든 단계가 같은 {@link Context} 인스턴스를 공유</li>
 *   <li>단계 i가 끝날 때마다 {@code sequential.step.<i>} 체크포인트 기록</li>
 *   <li>첫 번째 실패에서 중단하고 예외를 그대로 전파 (이후 단계는 실행되지 않음)</li>
 * </ul>
 *
 * <p><strong>평탄화:</strong></p>
 * <pre>
 * (a.then(b)).then(c)  →  Sequential[a, b, c]
 * a.then(b.then(c))    →  Sequential[a, b, c]
 * </pre>
 *
 * @param <I> 첫 단계 입력 타입
 * @param <O> 마지막 단계 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SequentialPrimitive<I, O> implements Primitive<I, O> {

    private static final Logger log = LoggerFactory.getLogger(SequentialPrimitive.class);

    /**
     * 단계 완료 체크포인트 접두사.
     */
    public static final String CHECKPOINT_PREFIX = "sequential.step.";

    private final List<Primitive<?, ?>> steps;

    /**
     * 생성자.
     *
     * <p>단계 중 SequentialPrimitive가 있으면 그 단계들을 펼쳐서 포함합니다.</p>
     *
     * @param steps 실행 단계 (순서대로)
     * @throws IllegalArgumentException steps가 null이거나 null 원소를 포함한 경우
     * @throws ConfigurationException steps가 비어 있는 경우
     */
    public SequentialPrimitive(List<? extends Primitive<?, ?>> steps) {
        if (steps == null) {
            throw new IllegalArgumentException("steps cannot be null");
        }
        if (steps.isEmpty()) {
            throw new ConfigurationException("SequentialPrimitive requires at least one step");
        }
        List<Primitive<?, ?>> flattened = new ArrayList<>();
        for (Primitive<?, ?> step : steps) {
            if (step == null) {
                throw new IllegalArgumentException("steps cannot contain null");
            }
            if (step instanceof SequentialPrimitive<?, ?> nested) {
                flattened.addAll(nested.steps);
            } else {
                flattened.add(step);
            }
        }
        this.steps = List.copyOf(flattened);
    }

    /**
     * 두 Primitive를 연결.
     *
     * @param first 첫 단계
     * @param second 두 번째 단계 (첫 단계 출력을 입력으로 받음)
     * @return 순차 실행 Primitive
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <I, M, O> SequentialPrimitive<I, O> of(
        Primitive<I, ? extends M> first,
        Primitive<? super M, ? extends O> second
    ) {
        if (first == null) {
            throw new IllegalArgumentException("first cannot be null");
        }
        if (second == null) {
            throw new IllegalArgumentException("second cannot be null");
        }
        return new SequentialPrimitive<>(List.<Primitive<?, ?>>of(first, second));
    }

    @Override
    @SuppressWarnings("unchecked")
    public O execute(I input, Context context) throws Exception {
        Object current = input;
        for (int i = 0; i < steps.size(); i++) {
            Primitive<Object, Object> step = (Primitive<Object, Object>) steps.get(i);
            log.debug("Sequential step {} ({}) started", i, step.name());
            current = step.execute(current, context);
            context.checkpoint(CHECKPOINT_PREFIX + i);
        }
        return (O) current;
    }

    /**
     * 평탄화된 단계 목록 (읽기 전용).
     */
    public List<Primitive<?, ?>> steps() {
        return steps;
    }

    @Override
    public String toString() {
        return "SequentialPrimitive" + steps.stream().map(Primitive::name).collect(Collectors.toList());
    }
}

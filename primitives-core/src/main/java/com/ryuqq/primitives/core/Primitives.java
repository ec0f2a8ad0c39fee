package com.ryuqq.primitives.core;

import com.ryuqq.primitives.core.combinator.ParallelPrimitive;
import com.ryuqq.primitives.core.combinator.RouteSelector;
import com.ryuqq.primitives.core.combinator.RouterPrimitive;
import com.ryuqq.primitives.core.combinator.SequentialPrimitive;
import com.ryuqq.primitives.core.combinator.SettledParallelPrimitive;
import com.ryuqq.primitives.core.instrumentation.InstrumentationSink;
import com.ryuqq.primitives.core.instrumentation.InstrumentedPrimitive;

import java.util.List;
import java.util.function.Function;

/**
 * Primitive 생성 팩토리.
 *
 * <p>조합기를 명시적으로 생성하는 진입점입니다.
 * {@link Primitive#then(Primitive)}은 {@link #sequenceOf(List)}의 축약형입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Primitives {

    private Primitives() {
    }

    /**
     * 컨텍스트를 사용하는 람다로 leaf Primitive 생성.
     */
    public static <I, O> Primitive<I, O> lambda(String name, Primitive<I, O> body) {
        return new LambdaPrimitive<>(name, body);
    }

    /**
     * 컨텍스트를 사용하지 않는 함수로 leaf Primitive 생성.
     */
    public static <I, O> Primitive<I, O> function(String name, Function<? super I, ? extends O> function) {
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        return new LambdaPrimitive<I, O>(name, (input, context) -> function.apply(input));
    }

    /**
     * 입력과 무관하게 항상 같은 값을 반환하는 Primitive 생성.
     */
    public static <I, O> Primitive<I, O> constant(O value) {
        return new LambdaPrimitive<>("constant", (input, context) -> value);
    }

    /**
     * 순차 실행 Primitive 생성.
     *
     * @throws com.ryuqq.primitives.core.error.ConfigurationException steps가 비어 있는 경우
     */
    public static <I, O> SequentialPrimitive<I, O> sequenceOf(List<? extends Primitive<?, ?>> steps) {
        return new SequentialPrimitive<>(steps);
    }

    /**
     * fail-fast 병렬 실행 Primitive 생성.
     */
    public static <I, O> ParallelPrimitive<I, O> parallelOf(List<? extends Primitive<? super I, ? extends O>> branches) {
        return new ParallelPrimitive<>(branches);
    }

    /**
     * 모든 분기 결과를 수집하는 병렬 실행 Primitive 생성.
     */
    public static <I, O> SettledParallelPrimitive<I, O> settledParallelOf(
        List<? extends Primitive<? super I, ? extends O>> branches
    ) {
        return new SettledParallelPrimitive<>(branches);
    }

    /**
     * Router 빌더 생성.
     */
    public static <I, O> RouterPrimitive.Builder<I, O> router(RouteSelector<? super I> selector) {
        return RouterPrimitive.builder(selector);
    }

    /**
     * 계측 hook으로 감싼 Primitive 생성.
     */
    public static <I, O> InstrumentedPrimitive<I, O> instrument(Primitive<I, O> delegate, InstrumentationSink sink) {
        return new InstrumentedPrimitive<>(delegate, sink);
    }
}

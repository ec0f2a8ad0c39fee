package com.ryuqq.primitives.testkit;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.context.Context;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 호출 횟수와 입력을 기록하는 테스트용 Primitive.
 *
 * <p>본문 실행 전에 카운트를 올리므로, 본문이 실패해도 호출은 기록됩니다.</p>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CountingPrimitive<I, O> implements Primitive<I, O> {

    private final String name;
    private final Primitive<I, O> body;
    private final AtomicInteger invocations = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final List<I> inputs = new CopyOnWriteArrayList<>();

    public CountingPrimitive(String name, Primitive<I, O> body) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        this.name = name;
        this.body = body;
    }

    /**
     * 입력을 그대로 반환하는 CountingPrimitive.
     */
    public static <T> CountingPrimitive<T, T> identity(String name) {
        return new CountingPrimitive<>(name, (input, context) -> input);
    }

    @Override
    public O execute(I input, Context context) throws Exception {
        invocations.incrementAndGet();
        if (input != null) {
            inputs.add(input);
        }
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            return body.execute(input, context);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public String name() {
        return name;
    }

    public int invocations() {
        return invocations.get();
    }

    /**
     * 동시에 실행 중이었던 최대 호출 수.
     */
    public int maxInFlight() {
        return maxInFlight.get();
    }

    public List<I> inputs() {
        return List.copyOf(inputs);
    }

    public void reset() {
        invocations.set(0);
        maxInFlight.set(0);
        inputs.clear();
    }
}

package com.ryuqq.primitives.testkit;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.context.Context;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 처음 N번 실패한 뒤 성공하는 테스트용 Primitive.
 *
 * <pre>{@code
 * FailingPrimitive<String, String> flaky = FailingPrimitive.failingTimes(2, () -> new IOException("boom"), "ok");
 * flaky.execute("x", ctx);  // IOException
 * flaky.execute("x", ctx);  // IOException
 * flaky.execute("x", ctx);  // "ok"
 * }</pre>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FailingPrimitive<I, O> implements Primitive<I, O> {

    private final String name;
    private final int failures;
    private final Supplier<? extends Exception> errorSupplier;
    private final O result;
    private final AtomicInteger attempts = new AtomicInteger();

    public FailingPrimitive(String name, int failures, Supplier<? extends Exception> errorSupplier, O result) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (failures < 0) {
            throw new IllegalArgumentException("failures must not be negative (current: " + failures + ")");
        }
        if (errorSupplier == null) {
            throw new IllegalArgumentException("errorSupplier cannot be null");
        }
        this.name = name;
        this.failures = failures;
        this.errorSupplier = errorSupplier;
        this.result = result;
    }

    public static <I, O> FailingPrimitive<I, O> failingTimes(int failures, Supplier<? extends Exception> errorSupplier, O result) {
        return new FailingPrimitive<>("failing", failures, errorSupplier, result);
    }

    /**
     * 항상 실패하는 Primitive.
     */
    public static <I, O> FailingPrimitive<I, O> alwaysFailing(String name, Supplier<? extends Exception> errorSupplier) {
        return new FailingPrimitive<>(name, Integer.MAX_VALUE, errorSupplier, null);
    }

    @Override
    public O execute(I input, Context context) throws Exception {
        int attempt = attempts.incrementAndGet();
        if (attempt <= failures) {
            throw errorSupplier.get();
        }
        return result;
    }

    @Override
    public String name() {
        return name;
    }

    public int attempts() {
        return attempts.get();
    }
}

package com.ryuqq.primitives.recovery.retry;

import com.ryuqq.primitives.core.error.NonRetryable;

import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/**
 * 재시도 여부 판단 조건 모음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RetryPredicates {

    private RetryPredicates() {
    }

    /**
     * 기본 정책: {@link NonRetryable}과 {@link InterruptedException}을 제외한 모든 예외를 재시도.
     */
    public static Predicate<Throwable> defaultPolicy() {
        return error -> !(error instanceof NonRetryable) && !(error instanceof InterruptedException);
    }

    /**
     * 지정한 타입(하위 타입 포함)만 재시도. {@link NonRetryable}은 여전히 제외됩니다.
     */
    @SafeVarargs
    public static Predicate<Throwable> onlyOn(Class<? extends Throwable>... types) {
        List<Class<? extends Throwable>> retryable = Arrays.asList(types);
        return error -> !(error instanceof NonRetryable)
            && retryable.stream().anyMatch(type -> type.isInstance(error));
    }

    /**
     * 지정한 타입(하위 타입 포함)을 기본 정책에서 추가로 제외.
     */
    @SafeVarargs
    public static Predicate<Throwable> allExcept(Class<? extends Throwable>... types) {
        List<Class<? extends Throwable>> excluded = Arrays.asList(types);
        return defaultPolicy().and(error -> excluded.stream().noneMatch(type -> type.isInstance(error)));
    }
}

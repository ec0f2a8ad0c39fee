package com.ryuqq.primitives.core.error;

import java.util.OptionalInt;

/**
 * 재시도 종료 표시.
 *
 * <p>Retry 데코레이터는 마지막 예외를 원래 타입 그대로 다시 던지고,
 * 이 예외를 suppressed로 붙여 시도 횟수를 전달합니다. 단독으로 던져지지 않습니다.</p>
 *
 * <pre>{@code
 * try {
 *     retry.execute(input, context);
 * } catch (IOException e) {
 *     int attempts = RetryExhaustedException.attemptsOf(e).orElse(1);
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RetryExhaustedException extends PrimitiveException {

    private final String primitiveName;
    private final int attempts;

    public RetryExhaustedException(String primitiveName, int attempts) {
        super("Primitive '" + primitiveName + "' failed after " + attempts + " attempt(s)");
        this.primitiveName = primitiveName;
        this.attempts = attempts;
    }

    /**
     * 예외에 붙은 시도 횟수 조회.
     *
     * @param failure Retry 데코레이터가 다시 던진 예외
     * @return 시도 횟수 (Retry를 거치지 않은 예외면 empty)
     */
    public static OptionalInt attemptsOf(Throwable failure) {
        if (failure == null) {
            return OptionalInt.empty();
        }
        for (Throwable suppressed : failure.getSuppressed()) {
            if (suppressed instanceof RetryExhaustedException exhausted) {
                return OptionalInt.of(exhausted.attempts);
            }
        }
        return OptionalInt.empty();
    }

    public String getPrimitiveName() {
        return primitiveName;
    }

    public int getAttempts() {
        return attempts;
    }
}

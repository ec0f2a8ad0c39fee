package com.ryuqq.primitives.core.instrumentation;

import com.ryuqq.primitives.core.error.CircuitOpenException;
import com.ryuqq.primitives.core.error.ExecutionTimeoutException;

import java.util.Locale;

/**
 * Primitive 실행 종료 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ExecutionStatus {

    /** 정상 반환. */
    SUCCESS,

    /** 예외로 종료. */
    FAILURE,

    /** 시간 초과 ({@link ExecutionTimeoutException}). */
    TIMEOUT,

    /** 호출 거부 ({@link CircuitOpenException}). */
    REJECTED;

    /**
     * 예외로부터 종료 상태 결정.
     *
     * @param error 실행 중 발생한 예외 (null이면 SUCCESS)
     * @return 종료 상태
     */
    public static ExecutionStatus of(Throwable error) {
        if (error == null) {
            return SUCCESS;
        }
        if (error instanceof ExecutionTimeoutException) {
            return TIMEOUT;
        }
        if (error instanceof CircuitOpenException) {
            return REJECTED;
        }
        return FAILURE;
    }

    /**
     * 메트릭 태그용 소문자 이름.
     */
    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

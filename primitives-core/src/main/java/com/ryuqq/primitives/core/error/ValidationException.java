package com.ryuqq.primitives.core.error;

/**
 * 입력 검증 실패 (재시도 불가).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ValidationException extends PrimitiveException implements NonRetryable {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

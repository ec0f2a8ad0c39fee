package com.ryuqq.primitives.core.error;

/**
 * 작업 자체의 실패.
 *
 * <p>leaf 작업이 별도의 예외 타입 없이 실패를 알리고자 할 때 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OperationException extends PrimitiveException {

    public OperationException(String message) {
        super(message);
    }

    public OperationException(String message, Throwable cause) {
        super(message, cause);
    }
}

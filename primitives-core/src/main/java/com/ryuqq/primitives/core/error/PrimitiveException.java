package com.ryuqq.primitives.core.error;

/**
 * Primitive 런타임 예외 계층의 루트.
 *
 * <p>조합기와 데코레이터가 스스로 만들어내는 실패는 모두 이 타입의 하위 클래스입니다.
 * leaf 작업이 던진 예외는 이 계층으로 감싸지 않고 원래 타입 그대로 전파됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PrimitiveException extends RuntimeException {

    public PrimitiveException(String message) {
        super(message);
    }

    public PrimitiveException(String message, Throwable cause) {
        super(message, cause);
    }
}

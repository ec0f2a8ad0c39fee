package com.ryuqq.primitives.core.error;

/**
 * Circuit Breaker가 OPEN 상태라 호출이 거부됨.
 *
 * <p>감싼 Primitive는 호출되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CircuitOpenException extends PrimitiveException {

    private final String primitiveName;

    public CircuitOpenException(String primitiveName) {
        super("Circuit is OPEN for primitive '" + primitiveName + "'");
        this.primitiveName = primitiveName;
    }

    public String getPrimitiveName() {
        return primitiveName;
    }
}

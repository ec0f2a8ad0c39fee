package com.ryuqq.primitives.core.error;

import java.time.Duration;

/**
 * 실행 시간 초과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ExecutionTimeoutException extends PrimitiveException {

    private final String primitiveName;
    private final Duration timeout;

    /**
     * 생성자.
     *
     * @param primitiveName 시간을 초과한 Primitive 이름
     * @param timeout 설정된 제한 시간
     */
    public ExecutionTimeoutException(String primitiveName, Duration timeout) {
        super("Primitive '" + primitiveName + "' timed out after " + timeout.toMillis() + "ms");
        this.primitiveName = primitiveName;
        this.timeout = timeout;
    }

    public String getPrimitiveName() {
        return primitiveName;
    }

    public Duration getTimeout() {
        return timeout;
    }
}

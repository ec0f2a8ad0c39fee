package com.ryuqq.primitives.core.error;

/**
 * 잘못된 Primitive 구성.
 *
 * <p>빈 Sequential/Parallel, 빈 route 맵, route에 없는 default route,
 * 빈 fallback 목록처럼 조합 자체가 성립하지 않을 때 생성 시점에 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConfigurationException extends PrimitiveException implements NonRetryable {

    public ConfigurationException(String message) {
        super(message);
    }
}

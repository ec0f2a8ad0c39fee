/**
 * Circuit Breaker 구현 패키지.
 *
 * <p>core의 {@link com.ryuqq.primitives.core.protection.CircuitBreaker} SPI에 대한
 * 연속 실패 기반 구현과 Primitive 데코레이터를 제공합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreakerConfig config = new CircuitBreakerConfig()
 *     .withFailureThreshold(3)
 *     .withCoolDown(Duration.ofSeconds(10));
 *
 * Primitive<Request, Response> guarded = new CircuitBreakerPrimitive<>(callApi, config);
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.recovery.circuit;

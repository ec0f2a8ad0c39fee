/**
 * 재시도 데코레이터 패키지.
 *
 * <p><strong>주요 구성요소:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.primitives.recovery.retry.RetryPrimitive}: 재시도 데코레이터</li>
 *   <li>{@link com.ryuqq.primitives.recovery.retry.RetryConfig}: maxRetries + backoff 설정</li>
 *   <li>{@link com.ryuqq.primitives.recovery.retry.RetryPredicates}: 재시도 여부 판단 조건</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RetryConfig config = new RetryConfig()
 *     .withMaxRetries(5)
 *     .withBackoff(BackoffStrategy.exponential(Duration.ofMillis(200), Duration.ofSeconds(5), 0.2));
 *
 * Primitive<Request, Response> resilient = new RetryPrimitive<>(callApi, config);
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.recovery.retry;

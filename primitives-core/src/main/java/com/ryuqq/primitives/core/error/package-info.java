/**
 * 오류 분류 패키지.
 *
 * <p>모든 예외는 unchecked이며 {@link com.ryuqq.primitives.core.error.PrimitiveException}을 루트로 합니다.</p>
 *
 * <p><strong>예외 계층:</strong></p>
 * <pre>
 * PrimitiveException
 *   ├─ OperationException          작업 실패
 *   ├─ ExecutionTimeoutException   Timeout 데코레이터의 시간 초과
 *   ├─ RoutingException            route 없음 + default 없음
 *   ├─ ConfigurationException      잘못된 조합 (NonRetryable)
 *   ├─ StoreUnavailableException   저장소 장애 (성능 저하 모드 전환)
 *   ├─ ValidationException         입력 검증 실패 (NonRetryable)
 *   ├─ CircuitOpenException        Circuit Breaker 차단
 *   └─ RetryExhaustedException     재시도 종료 표시 (suppressed 전용)
 * </pre>
 *
 * <p><strong>전파 규칙:</strong></p>
 * <ul>
 *   <li>leaf 예외는 원래 타입 그대로 전파</li>
 *   <li>조합기는 첫 번째 미복구 예외를 그대로 다시 던짐</li>
 *   <li>Compensation과 Fact 검증은 예외를 던지지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.core.error;

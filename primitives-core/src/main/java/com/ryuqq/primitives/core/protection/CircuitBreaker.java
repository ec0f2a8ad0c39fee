package com.ryuqq.primitives.core.protection;

import java.util.Optional;

/**
 * Circuit Breaker SPI.
 *
 * <p>감싼 Primitive의 실패를 추적하고, 임계값에 도달하면 빠르게 실패(Fail-Fast)하여
 * 장애가 호출 트리 전체로 전파되는 것을 방지합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitPermit permit = breaker.tryAcquire()
 *     .orElseThrow(() -> new CircuitOpenException(name));
 * try {
 *     O result = delegate.execute(input, context);
 *     breaker.recordSuccess(permit);
 *     return result;
 * } catch (Exception e) {
 *     breaker.recordFailure(permit, e);
 *     throw e;
 * }
 * }</pre>
 *
 * <p>결과는 항상 해당 호출이 받은 {@link CircuitPermit}과 함께 기록합니다.
 * 이전 상태에서 허가받은 호출이 늦게 결과를 보고해도 현재 상태를 바꾸지 못합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 호출 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: coolDown 경과 전에는 false, 경과 후에는 HALF_OPEN으로 전이하며 시험 호출 1건 허용</li>
     *   <li>HALF_OPEN: 시험 호출이 진행 중이면 false</li>
     * </ul>
     *
     * @return 통과 허가, 차단이면 빈 Optional
     */
    Optional<CircuitPermit> tryAcquire();

    /**
     * 실행 성공 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 카운터 초기화</li>
     *   <li>HALF_OPEN: 시험 호출의 허가일 때만 CLOSED로 전이</li>
     * </ul>
     *
     * <p>허가의 세대가 현재 세대와 다르면 무시합니다.</p>
     *
     * @param permit tryAcquire()로 받은 허가
     */
    void recordSuccess(CircuitPermit permit);

    /**
     * 실행 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 카운터 증가, 임계값 도달 시 OPEN으로 전이</li>
     *   <li>HALF_OPEN: 시험 호출의 허가일 때만 OPEN으로 전이</li>
     * </ul>
     *
     * <p>허가의 세대가 현재 세대와 다르면 무시합니다.</p>
     *
     * @param permit tryAcquire()로 받은 허가
     * @param throwable 발생한 예외
     */
    void recordFailure(CircuitPermit permit, Throwable throwable);

    /**
     * 현재 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();
}

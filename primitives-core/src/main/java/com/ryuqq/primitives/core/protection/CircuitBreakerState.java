package com.ryuqq.primitives.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 임계값 도달)
 * OPEN (차단)
 *   │
 *   ▼ (coolDown 경과)
 * HALF_OPEN (시험 호출 1건)
 *   │
 *   ├─► 성공 → CLOSED
 *   └─► 실패 → OPEN
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태. 모든 호출을 통과시키며 연속 실패를 셉니다.
     */
    CLOSED,

    /**
     * 차단 상태. coolDown 동안 모든 호출을 즉시 거부합니다.
     */
    OPEN,

    /**
     * 반개방 상태. 시험 호출 하나만 통과시킵니다.
     */
    HALF_OPEN
}

/**
 * 보상(Saga) 패키지.
 *
 * <p>여러 단계로 이루어진 작업이 중간에 실패했을 때, 이미 끝난 단계를 역순으로 되돌립니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * step1 ✓ → step2 ✓ → step3 ✗
 *                       │
 *                       ▼
 *           compensate(step2) → compensate(step1)
 *                       │
 *                       ▼
 *           step3의 예외를 그대로 다시 던짐
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.recovery.compensation;

/**
 * 재시도 backoff 전략 패키지.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.recovery.retry.backoff;

/**
 * 계측 SPI의 NoOp 구현 패키지.
 *
 * <p>계측이 필요 없는 환경에서 사용하는 기본 구현을 제공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.core.instrumentation.noop;

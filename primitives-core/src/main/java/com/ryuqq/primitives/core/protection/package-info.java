/**
 * 보호 장치 SPI 패키지.
 *
 * <p>Circuit Breaker의 상태 모델과 SPI를 정의합니다.
 * 연속 실패 기반 구현과 Primitive 데코레이터는 {@code primitives-recovery} 모듈에 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.core.protection;

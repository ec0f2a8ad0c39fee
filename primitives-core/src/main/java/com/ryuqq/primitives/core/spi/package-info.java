/**
 * 외부 저장소 SPI 패키지.
 *
 * <p>원격 메모리/캐시 백엔드를 위한 {@link com.ryuqq.primitives.core.spi.RemoteStore}를 정의합니다.
 * 참조 구현은 {@code primitives-adapter-inmemory} 모듈의 {@code InMemoryRemoteStore}입니다.</p>
 *
 * <p><strong>Fallback-first 원칙:</strong></p>
 * <ul>
 *   <li>원격 저장소는 선택적 향상 기능입니다.</li>
 *   <li>원격 장애 시 로컬 저장소만으로 정상 동작해야 합니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.core.spi;

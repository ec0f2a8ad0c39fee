/**
 * SPI Contract Test 패키지.
 *
 * <p>어댑터 모듈이 상속하여 SPI 규약 준수를 검증하는 추상 테스트를 제공합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.primitives.testkit.contract.AbstractRemoteStoreContractTest}:
 *       {@link com.ryuqq.primitives.core.spi.RemoteStore} 규약</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.testkit.contract;

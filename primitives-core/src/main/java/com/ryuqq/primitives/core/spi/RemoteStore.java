package com.ryuqq.primitives.core.spi;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 원격 키-값 저장소 SPI.
 *
 * <p>Cache와 Deep Memory가 선택적으로 사용하는 원격 백엔드 추상화입니다.
 * 특정 wire protocol(Redis, HTTP 등)에 의존하지 않습니다.</p>
 *
 * <p><strong>구현 규약:</strong></p>
 * <ul>
 *   <li>백엔드 장애(연결 실패, 타임아웃 등)는
 *       {@link com.ryuqq.primitives.core.error.StoreUnavailableException}으로 알립니다.</li>
 *   <li>호출자는 이 예외를 받으면 로컬 경로로 성능 저하 모드 동작을 합니다.</li>
 *   <li>모든 메서드는 스레드 안전해야 합니다.</li>
 * </ul>
 *
 * @param <V> 저장 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RemoteStore<V> {

    /**
     * 값 저장 (기존 값 덮어쓰기).
     *
     * @param key 키
     * @param value 값
     * @param ttl 만료 시간 (null이면 만료 없음)
     * @throws com.ryuqq.primitives.core.error.StoreUnavailableException 백엔드 장애 시
     */
    void put(String key, V value, Duration ttl);

    /**
     * 값 조회.
     *
     * @param key 키
     * @return 값 (없거나 만료되었으면 empty)
     * @throws com.ryuqq.primitives.core.error.StoreUnavailableException 백엔드 장애 시
     */
    Optional<V> get(String key);

    /**
     * 질의 검색.
     *
     * <p>관련도 계산은 구현체가 정의합니다. 결과는 관련도 내림차순입니다.</p>
     *
     * @param query 검색어
     * @param limit 최대 결과 수 (양수)
     * @param filters 속성 필터 (모두 일치해야 함, 빈 맵이면 필터 없음)
     * @return 검색 결과
     * @throws com.ryuqq.primitives.core.error.StoreUnavailableException 백엔드 장애 시
     */
    List<V> search(String query, int limit, Map<String, String> filters);

    /**
     * 값 삭제.
     *
     * @param key 키
     * @return 삭제된 값이 있었는지 여부
     * @throws com.ryuqq.primitives.core.error.StoreUnavailableException 백엔드 장애 시
     */
    boolean delete(String key);

    /**
     * 접두어로 시작하는 키의 값만 삭제.
     *
     * <p>하나의 백엔드를 여러 사용처(Cache, Deep Memory 등)가 키 접두어로 나눠 쓸 때,
     * 자기 키 공간만 비우는 데 사용합니다. 빈 접두어는 모든 키와 일치합니다.</p>
     *
     * @param prefix 키 접두어
     * @return 삭제된 항목 수
     * @throws com.ryuqq.primitives.core.error.StoreUnavailableException 백엔드 장애 시
     */
    int deleteByPrefix(String prefix);

    /**
     * 모든 값 삭제.
     *
     * @throws com.ryuqq.primitives.core.error.StoreUnavailableException 백엔드 장애 시
     */
    void clear();
}

package com.ryuqq.primitives.performance.cache;

import java.util.Optional;

/**
 * 캐시 항목 저장소 추상화.
 *
 * <p><strong>구현 규약:</strong></p>
 * <ul>
 *   <li>get/put/invalidate는 서로에 대해 원자적이어야 합니다.</li>
 *   <li>만료된 항목은 get에서 없는 것으로 취급합니다.</li>
 *   <li>백엔드 장애는 {@link com.ryuqq.primitives.core.error.StoreUnavailableException}으로 알립니다.</li>
 * </ul>
 *
 * @param <V> 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EntryStore<V> {

    /**
     * 값 조회. 조회된 항목은 가장 최근 사용으로 표시됩니다.
     *
     * @param key 키
     * @return 값 (없거나 만료되었으면 empty)
     */
    Optional<V> get(String key);

    /**
     * 값 저장 (기존 값 덮어쓰기).
     *
     * @param key 키
     * @param value 값 (null 불가)
     */
    void put(String key, V value);

    /**
     * 항목 삭제.
     *
     * @return 삭제된 항목이 있었는지 여부
     */
    boolean invalidate(String key);

    /**
     * 모든 항목 삭제.
     */
    void clear();

    /**
     * 현재 항목 수. 백엔드가 알려줄 수 없으면 -1.
     */
    int size();

    /**
     * 용량 초과로 제거된 누적 항목 수.
     */
    default long evictionCount() {
        return 0L;
    }
}

package com.ryuqq.primitives.performance.memory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 메모리 계층 공통 기능.
 *
 * <p>Session, Window, Deep, Fact 네 계층이 같은 기능 집합(add, get, search, validate)을 제공합니다.</p>
 *
 * @param <E> 항목 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MemoryLayer<E> {

    /**
     * 항목 추가.
     *
     * @param key 계층별 키 (Session/Window는 sessionId)
     * @param entry 항목
     */
    void add(String key, E entry);

    /**
     * 키로 조회.
     *
     * @param key 키
     * @return 항목 (없으면 empty)
     */
    Optional<E> get(String key);

    /**
     * 질의 검색.
     *
     * @param query 질의
     * @return 검색 결과 (계층별 정렬 기준)
     */
    List<E> search(MemoryQuery query);

    /**
     * 키에 저장된 항목이 실제 값과 일치하는지 검증. 예외를 던지지 않습니다.
     *
     * <p>기본 구현은 {@link #get(String)} 결과와 actual의 equals 비교입니다.</p>
     *
     * @param key 키
     * @param actual 실제 값
     * @return 검증 결과
     */
    default FactValidation validate(String key, Object actual) {
        Optional<E> stored;
        try {
            stored = get(key);
        } catch (RuntimeException e) {
            return FactValidation.failed(key, null, actual, "Lookup failed: " + e.getMessage(), Severity.ERROR);
        }
        if (stored.isEmpty()) {
            return FactValidation.failed(key, null, actual, "No entry for key '" + key + "'", Severity.WARNING);
        }
        String expected = String.valueOf(stored.get());
        if (Objects.equals(stored.get(), actual)) {
            return FactValidation.passed(key, expected, actual);
        }
        return FactValidation.failed(key, expected, actual, "Stored entry differs from actual value", Severity.WARNING);
    }
}

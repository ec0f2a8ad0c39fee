package com.ryuqq.primitives.performance.memory;

import java.time.Duration;
import java.util.Set;

/**
 * 메모리 조회 질의.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param sessionId 대상 세션 (null이면 Context의 sessionId 또는 전체)
 * @param text 검색어 (null 또는 빈 문자열이면 전체 일치)
 * @param tags Deep Memory 태그 조건
 * @param categories Fact 카테고리 조건 (비어 있으면 전체)
 * @param limit 검색 결과 최대 수 (1 이상)
 * @param window 최근 구간 (null이면 설정의 defaultWindow)
 */
public record MemoryQuery(
    String sessionId,
    String text,
    Set<String> tags,
    Set<String> categories,
    int limit,
    Duration window
) {

    public static final int DEFAULT_LIMIT = 5;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public MemoryQuery {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        categories = categories == null ? Set.of() : Set.copyOf(categories);
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        if (window != null && (window.isZero() || window.isNegative())) {
            throw new IllegalArgumentException("window must be positive when present (current: " + window + ")");
        }
    }

    /**
     * 검색어만 있는 질의.
     */
    public static MemoryQuery text(String text) {
        return new MemoryQuery(null, text, Set.of(), Set.of(), DEFAULT_LIMIT, null);
    }

    /**
     * 세션 대상 질의.
     */
    public static MemoryQuery forSession(String sessionId) {
        return new MemoryQuery(sessionId, null, Set.of(), Set.of(), DEFAULT_LIMIT, null);
    }

    public MemoryQuery withSessionId(String sessionId) {
        return new MemoryQuery(sessionId, text, tags, categories, limit, window);
    }

    public MemoryQuery withText(String text) {
        return new MemoryQuery(sessionId, text, tags, categories, limit, window);
    }

    public MemoryQuery withTags(Set<String> tags) {
        return new MemoryQuery(sessionId, text, tags, categories, limit, window);
    }

    public MemoryQuery withCategories(Set<String> categories) {
        return new MemoryQuery(sessionId, text, tags, categories, limit, window);
    }

    public MemoryQuery withLimit(int limit) {
        return new MemoryQuery(sessionId, text, tags, categories, limit, window);
    }

    public MemoryQuery withWindow(Duration window) {
        return new MemoryQuery(sessionId, text, tags, categories, limit, window);
    }

    /**
     * 검색어가 있는지 여부.
     */
    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}

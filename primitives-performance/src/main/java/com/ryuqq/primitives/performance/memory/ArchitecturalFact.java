package com.ryuqq.primitives.performance.memory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;

/**
 * Permanent Architectural Fact (PAF): 아키텍처에 대한 불변의 검증 가능한 사실.
 *
 * <p>예: {@code test-coverage AT_LEAST 80} (QUAL), {@code java-version AT_LEAST 17} (LANG)</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param key 고유 키 (예: test-coverage)
 * @param category 분류 (예: LANG, QUAL, ARCH)
 * @param expected 기대 값 (컬렉션이면 불변 사본으로 보관)
 * @param comparison 비교 방식
 * @param rationale 근거 설명
 * @param status 상태
 * @param deprecationReason 폐기 사유 (ACTIVE면 null)
 */
public record ArchitecturalFact(
    String key,
    String category,
    Object expected,
    Comparison comparison,
    String rationale,
    FactStatus status,
    String deprecationReason
) {

    public ArchitecturalFact {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category cannot be null or blank");
        }
        if (expected == null) {
            throw new IllegalArgumentException("expected cannot be null");
        }
        if (comparison == null) {
            throw new IllegalArgumentException("comparison cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        rationale = rationale == null ? "" : rationale;
        if (expected instanceof Collection<?> values) {
            expected = Collections.unmodifiableList(new ArrayList<>(values));
        }
    }

    /**
     * ACTIVE 상태의 사실 생성.
     */
    public static ArchitecturalFact active(String key, String category, Object expected, Comparison comparison, String rationale) {
        return new ArchitecturalFact(key, category, expected, comparison, rationale, FactStatus.ACTIVE, null);
    }

    /**
     * DEPRECATED 상태의 사본.
     */
    public ArchitecturalFact deprecated(String reason) {
        return new ArchitecturalFact(key, category, expected, comparison, rationale, FactStatus.DEPRECATED, reason);
    }

    public boolean isActive() {
        return status == FactStatus.ACTIVE;
    }

    /**
     * 상태를 제외한 정의(키, 분류, 기대 값, 비교 방식, 근거)가 같은지 여부.
     */
    public boolean sameDefinition(ArchitecturalFact other) {
        return other != null
            && key.equals(other.key)
            && category.equals(other.category)
            && Objects.equals(expected, other.expected)
            && comparison == other.comparison
            && rationale.equals(other.rationale);
    }

    /**
     * 기대 조건 설명 (예: {@code ">= 80"}).
     */
    public String expectation() {
        return comparison.describe(expected);
    }
}

package com.ryuqq.primitives.performance.memory;

import java.time.Instant;
import java.util.Set;

/**
 * Layer 3 항목.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param key 키
 * @param content 내용
 * @param tags 태그
 * @param importance 중요도 (0.0 ~ 1.0)
 * @param createdAt 생성 시각
 */
public record DeepMemoryEntry(
    String key,
    String content,
    Set<String> tags,
    double importance,
    Instant createdAt
) {

    public DeepMemoryEntry {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (Double.isNaN(importance) || importance < 0.0 || importance > 1.0) {
            throw new IllegalArgumentException("importance must be between 0.0 and 1.0 (current: " + importance + ")");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }
}

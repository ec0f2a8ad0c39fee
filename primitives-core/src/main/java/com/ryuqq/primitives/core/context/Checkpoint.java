package com.ryuqq.primitives.core.context;

import java.time.Instant;

/**
 * 실행 중 기록되는 체크포인트 (이름, 시각).
 *
 * @param name 체크포인트 이름 (예: sequential.step.0)
 * @param at 기록 시각
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Checkpoint(String name, Instant at) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name 또는 at이 null인 경우
     */
    public Checkpoint {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
    }
}

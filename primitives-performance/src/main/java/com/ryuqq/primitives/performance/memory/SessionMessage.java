package com.ryuqq.primitives.performance.memory;

import java.time.Instant;

/**
 * 세션 메시지.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param sessionId 세션 ID
 * @param role 발화 주체 (예: user, assistant, system)
 * @param content 내용
 * @param at 기록 시각
 */
public record SessionMessage(
    String sessionId,
    String role,
    String content,
    Instant at
) {

    public SessionMessage {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
    }
}

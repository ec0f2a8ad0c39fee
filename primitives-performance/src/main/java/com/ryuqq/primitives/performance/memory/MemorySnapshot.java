package com.ryuqq.primitives.performance.memory;

import java.util.List;

/**
 * 한 번의 메모리 조회 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param sessionId 대상 세션 (없으면 null)
 * @param history 세션 기록 (오래된 것 먼저)
 * @param recent 최근 구간 메시지 (오래된 것 먼저)
 * @param related Deep Memory 검색 결과 (순위순)
 * @param facts 질의 카테고리의 ACTIVE 사실
 */
public record MemorySnapshot(
    String sessionId,
    List<SessionMessage> history,
    List<SessionMessage> recent,
    List<DeepMemoryEntry> related,
    List<ArchitecturalFact> facts
) {

    public MemorySnapshot {
        history = List.copyOf(history);
        recent = List.copyOf(recent);
        related = List.copyOf(related);
        facts = List.copyOf(facts);
    }
}

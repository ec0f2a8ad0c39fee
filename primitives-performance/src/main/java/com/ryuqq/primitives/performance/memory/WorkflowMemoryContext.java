package com.ryuqq.primitives.performance.memory;

/**
 * 단계별로 불러온 메모리.
 *
 * <p>{@link #snapshot()}에는 {@link #plan()}이 고른 계층만 채워지고, 나머지는 빈 목록입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param stage 작업 흐름 단계
 * @param mode 작업 흐름 모드
 * @param workflowId Context의 workflowId (없으면 null)
 * @param plan 적용한 계획
 * @param snapshot 불러온 메모리
 */
public record WorkflowMemoryContext(
    WorkflowStage stage,
    WorkflowMode mode,
    String workflowId,
    StageLoadPlan plan,
    MemorySnapshot snapshot
) {

    public WorkflowMemoryContext {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (plan == null) {
            throw new IllegalArgumentException("plan cannot be null");
        }
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
    }

    public String sessionId() {
        return snapshot.sessionId();
    }
}

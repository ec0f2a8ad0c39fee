package com.ryuqq.primitives.performance.memory;

import java.time.Duration;
import java.util.Set;

/**
 * 단계와 모드에 따라 불러올 메모리 계층과 양.
 *
 * <p><strong>단계 × 모드 표:</strong></p>
 * <pre>
 *              RAPID              STANDARD                          RIGOROUS
 * UNDERSTAND   history 10         history, 1h, deep 5, facts        history, 24h, deep 20, facts
 * DECOMPOSE    -                  history 20, facts                 history 20, facts, deep 5 (pattern)
 * PLAN         history 5          history, 1h, facts                history, 1h, facts, deep 10
 * IMPLEMENT    history, 1h        history, 1h                       history, 1h, facts
 * VALIDATE     -                  history 10, facts                 history 10, facts
 * REFLECT      -                  -                                 history
 * </pre>
 *
 * <p>Deep Memory 검색어는 Context의 workflowId이며, workflowId가 없으면 Deep Memory는 건너뜁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param historyLimit 불러올 최근 세션 메시지 수 (0이면 건너뜀, {@link #ALL_HISTORY}면 전체)
 * @param recentWindow 최근 구간 (null이면 건너뜀)
 * @param deepLimit Deep Memory 검색 결과 수 (0이면 건너뜀)
 * @param deepTags Deep Memory 결과가 모두 가져야 하는 태그 (비어 있으면 조건 없음)
 * @param includeFacts ACTIVE 사실 포함 여부
 */
public record StageLoadPlan(
    int historyLimit,
    Duration recentWindow,
    int deepLimit,
    Set<String> deepTags,
    boolean includeFacts
) {

    public static final int ALL_HISTORY = Integer.MAX_VALUE;
    public static final Duration SHORT_WINDOW = Duration.ofHours(1);
    public static final Duration LONG_WINDOW = Duration.ofHours(24);
    public static final String PATTERN_TAG = "pattern";

    private static final StageLoadPlan NOTHING = new StageLoadPlan(0, null, 0, Set.of(), false);

    public StageLoadPlan {
        if (historyLimit < 0) {
            throw new IllegalArgumentException("historyLimit must not be negative (current: " + historyLimit + ")");
        }
        if (recentWindow != null && (recentWindow.isZero() || recentWindow.isNegative())) {
            throw new IllegalArgumentException("recentWindow must be positive when present (current: " + recentWindow + ")");
        }
        if (deepLimit < 0) {
            throw new IllegalArgumentException("deepLimit must not be negative (current: " + deepLimit + ")");
        }
        deepTags = deepTags == null ? Set.of() : Set.copyOf(deepTags);
    }

    /**
     * 단계와 모드에 맞는 계획.
     *
     * @throws IllegalArgumentException stage 또는 mode가 null인 경우
     */
    public static StageLoadPlan of(WorkflowStage stage, WorkflowMode mode) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        switch (stage) {
            case UNDERSTAND:
                if (mode == WorkflowMode.RAPID) {
                    return new StageLoadPlan(10, null, 0, Set.of(), false);
                }
                return mode == WorkflowMode.STANDARD
                    ? new StageLoadPlan(ALL_HISTORY, SHORT_WINDOW, 5, Set.of(), true)
                    : new StageLoadPlan(ALL_HISTORY, LONG_WINDOW, 20, Set.of(), true);
            case DECOMPOSE:
                if (mode == WorkflowMode.RAPID) {
                    return NOTHING;
                }
                return mode == WorkflowMode.STANDARD
                    ? new StageLoadPlan(20, null, 0, Set.of(), true)
                    : new StageLoadPlan(20, null, 5, Set.of(PATTERN_TAG), true);
            case PLAN:
                if (mode == WorkflowMode.RAPID) {
                    return new StageLoadPlan(5, null, 0, Set.of(), false);
                }
                return new StageLoadPlan(ALL_HISTORY, SHORT_WINDOW, mode == WorkflowMode.RIGOROUS ? 10 : 0, Set.of(), true);
            case IMPLEMENT:
                return new StageLoadPlan(ALL_HISTORY, SHORT_WINDOW, 0, Set.of(), mode == WorkflowMode.RIGOROUS);
            case VALIDATE:
                return mode == WorkflowMode.RAPID ? NOTHING : new StageLoadPlan(10, null, 0, Set.of(), true);
            case REFLECT:
                return mode == WorkflowMode.RIGOROUS ? new StageLoadPlan(ALL_HISTORY, null, 0, Set.of(), false) : NOTHING;
            default:
                throw new IllegalStateException("Unknown stage: " + stage);
        }
    }

    public boolean loadsHistory() {
        return historyLimit > 0;
    }

    public boolean loadsRecent() {
        return recentWindow != null;
    }

    public boolean loadsDeep() {
        return deepLimit > 0;
    }

    /**
     * 아무 계층도 불러오지 않는 계획인지 여부.
     */
    public boolean isEmpty() {
        return !loadsHistory() && !loadsRecent() && !loadsDeep() && !includeFacts;
    }
}

package com.ryuqq.primitives.core.outcome;

/**
 * 병렬 분기 하나의 실행 결과.
 *
 * <p>BranchOutcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Succeeded}: 분기가 값을 반환함</li>
 *   <li>{@link Failed}: 분기가 예외를 던짐</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * for (BranchOutcome<String> outcome : settled.execute(input, context)) {
 *     if (outcome instanceof Succeeded<String> ok) {
 *         use(ok.value());
 *     } else if (outcome instanceof Failed<String> failed) {
 *         log.warn("branch {} failed", failed.index(), failed.error());
 *     }
 * }
 * }</pre>
 *
 * @param <O> 분기 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface BranchOutcome<O> permits Succeeded, Failed {

    /**
     * 분기 위치 (입력 순서, 0부터 시작).
     */
    int index();

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSucceeded() {
        return this instanceof Succeeded;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailed() {
        return this instanceof Failed;
    }
}

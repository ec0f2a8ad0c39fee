package com.ryuqq.primitives.recovery.compensation;

import java.util.List;

/**
 * 보상 실행 결과.
 *
 * @param failedStep 실패한 forward 단계 이름
 * @param cause forward 단계의 실패 원인
 * @param compensated 보상에 성공한 단계 이름 (실행 순서 = 역순)
 * @param failures 보상에 실패한 단계
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CompensationReport(
    String failedStep,
    Throwable cause,
    List<String> compensated,
    List<CompensationFailure> failures
) {

    /**
     * 보상 실패 항목.
     *
     * @param step 단계 이름
     * @param error 보상 작업이 던진 예외
     */
    public record CompensationFailure(String step, Throwable error) {
    }

    public CompensationReport {
        if (failedStep == null) {
            throw new IllegalArgumentException("failedStep cannot be null");
        }
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        compensated = List.copyOf(compensated);
        failures = List.copyOf(failures);
    }

    /**
     * 모든 보상이 성공했는지 여부.
     */
    public boolean fullyCompensated() {
        return failures.isEmpty();
    }
}

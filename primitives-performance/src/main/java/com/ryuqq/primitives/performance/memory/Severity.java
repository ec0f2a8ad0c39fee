package com.ryuqq.primitives.performance.memory;

/**
 * 검증 결과의 심각도.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Severity {
    ERROR,
    WARNING,
    INFO
}

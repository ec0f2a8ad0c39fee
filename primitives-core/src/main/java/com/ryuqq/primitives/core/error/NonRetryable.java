package com.ryuqq.primitives.core.error;

/**
 * 재시도해도 성공할 수 없는 실패를 표시하는 marker 인터페이스.
 *
 * <p>기본 재시도 정책은 이 인터페이스를 구현한 예외를 재시도하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface NonRetryable {
}

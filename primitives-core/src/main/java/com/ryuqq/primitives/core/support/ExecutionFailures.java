package com.ryuqq.primitives.core.support;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * executor 기반 실행의 실패 처리 유틸리티.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutionFailures {

    private ExecutionFailures() {
    }

    /**
     * {@link ExecutionException}을 벗겨 작업이 던진 원래 예외를 반환.
     *
     * <p>원인이 {@link Error}이면 그대로 던집니다.</p>
     *
     * @param e executor가 감싼 예외
     * @return 원래 예외
     */
    public static Exception unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Error error) {
            throw error;
        }
        if (cause instanceof Exception exception) {
            return exception;
        }
        return e;
    }

    /**
     * 아직 끝나지 않은 작업을 인터럽트와 함께 취소.
     *
     * @param futures 취소 대상
     */
    public static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            if (!future.isDone()) {
                future.cancel(true);
            }
        }
    }
}

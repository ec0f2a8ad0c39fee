package com.ryuqq.primitives.core.error;

/**
 * 저장소(캐시 저장소, 원격 메모리 저장소)를 사용할 수 없음.
 *
 * <p>Cache와 Memory는 이 예외를 받으면 로컬 경로로 성능 저하 모드 동작을 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StoreUnavailableException extends PrimitiveException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

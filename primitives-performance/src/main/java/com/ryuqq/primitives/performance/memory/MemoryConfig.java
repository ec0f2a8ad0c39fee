package com.ryuqq.primitives.performance.memory;

import java.time.Duration;

/**
 * MemoryPrimitive 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxMessagesPerSession: 세션당 보관 메시지 수, 초과 시 오래된 것부터 삭제 (기본 100)</li>
 *   <li>defaultWindow: 질의에 window가 없을 때 사용할 최근 구간 (기본 15분)</li>
 *   <li>maxDeepEntries: Deep Memory 로컬 저장소 최대 항목 수, 초과 시 LRU 제거 (기본 1000)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxMessagesPerSession 세션당 최대 메시지 수 (1 이상)
 * @param defaultWindow 기본 최근 구간 (양수)
 * @param maxDeepEntries Deep Memory 최대 항목 수 (1 이상)
 */
public record MemoryConfig(
    int maxMessagesPerSession,
    Duration defaultWindow,
    int maxDeepEntries
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxMessagesPerSession=100, defaultWindow=15m, maxDeepEntries=1000</p>
     */
    public MemoryConfig() {
        this(100, Duration.ofMinutes(15), 1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public MemoryConfig {
        if (maxMessagesPerSession <= 0) {
            throw new IllegalArgumentException(
                "maxMessagesPerSession must be positive (current: " + maxMessagesPerSession + ")"
            );
        }
        if (defaultWindow == null || defaultWindow.isZero() || defaultWindow.isNegative()) {
            throw new IllegalArgumentException("defaultWindow must be positive (current: " + defaultWindow + ")");
        }
        if (maxDeepEntries <= 0) {
            throw new IllegalArgumentException("maxDeepEntries must be positive (current: " + maxDeepEntries + ")");
        }
    }

    public MemoryConfig withMaxMessagesPerSession(int maxMessagesPerSession) {
        return new MemoryConfig(maxMessagesPerSession, defaultWindow, maxDeepEntries);
    }

    public MemoryConfig withDefaultWindow(Duration defaultWindow) {
        return new MemoryConfig(maxMessagesPerSession, defaultWindow, maxDeepEntries);
    }

    public MemoryConfig withMaxDeepEntries(int maxDeepEntries) {
        return new MemoryConfig(maxMessagesPerSession, defaultWindow, maxDeepEntries);
    }
}

package com.ryuqq.primitives.performance.memory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Layer 2: 최근 구간 조회.
 *
 * <p>별도 저장소 없이 {@link SessionMemory} 위에서 시각으로 걸러낸 결과만 돌려줍니다.
 * 추가는 SessionMemory에 그대로 위임합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WindowMemory implements MemoryLayer<SessionMessage> {

    private final SessionMemory session;
    private final Duration defaultWindow;

    /**
     * 생성자.
     *
     * @param session 기반 SessionMemory
     * @param defaultWindow 질의에 window가 없을 때 사용할 구간
     */
    public WindowMemory(SessionMemory session, Duration defaultWindow) {
        if (session == null) {
            throw new IllegalArgumentException("session cannot be null");
        }
        if (defaultWindow == null || defaultWindow.isZero() || defaultWindow.isNegative()) {
            throw new IllegalArgumentException("defaultWindow must be positive (current: " + defaultWindow + ")");
        }
        this.session = session;
        this.defaultWindow = defaultWindow;
    }

    /**
     * 지금으로부터 window 이내에 기록된 메시지 (오래된 것 먼저).
     *
     * @throws IllegalArgumentException window가 양수가 아닌 경우
     */
    public List<SessionMessage> recent(String sessionId, Duration window) {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive (current: " + window + ")");
        }
        Instant since = session.clock().instant().minus(window);
        return session.history(sessionId).stream()
            .filter(message -> !message.at().isBefore(since))
            .collect(Collectors.toUnmodifiableList());
    }

    public List<SessionMessage> recent(String sessionId) {
        return recent(sessionId, defaultWindow);
    }

    @Override
    public void add(String key, SessionMessage entry) {
        session.add(key, entry);
    }

    /**
     * 기본 구간 안에 있는 세션의 마지막 메시지.
     */
    @Override
    public Optional<SessionMessage> get(String key) {
        List<SessionMessage> recent = recent(key);
        return recent.isEmpty() ? Optional.empty() : Optional.of(recent.get(recent.size() - 1));
    }

    /**
     * SessionMemory 검색 결과 중 질의 구간(없으면 기본 구간) 안의 메시지만 반환.
     */
    @Override
    public List<SessionMessage> search(MemoryQuery query) {
        Duration window = query.window() != null ? query.window() : defaultWindow;
        Instant since = session.clock().instant().minus(window);
        return session.search(query.withLimit(Integer.MAX_VALUE)).stream()
            .filter(message -> !message.at().isBefore(since))
            .limit(query.limit())
            .collect(Collectors.toUnmodifiableList());
    }

    public Duration defaultWindow() {
        return defaultWindow;
    }
}

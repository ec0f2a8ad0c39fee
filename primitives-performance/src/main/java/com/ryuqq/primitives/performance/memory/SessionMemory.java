package com.ryuqq.primitives.performance.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Layer 1: 세션별 대화 기록.
 *
 * <p>세션마다 메시지를 추가 순서대로 보관합니다. 세션당 최대 개수를 넘으면 가장 오래된 메시지부터 삭제합니다.
 * 모든 상태는 하나의 {@link ReentrantLock}으로 보호됩니다.</p>
 *
 * <p>{@link MemoryLayer}의 key는 sessionId이며, {@link #get(String)}은 세션의 마지막 메시지를 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SessionMemory implements MemoryLayer<SessionMessage> {

    private static final Logger log = LoggerFactory.getLogger(SessionMemory.class);

    private final int maxMessagesPerSession;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Deque<SessionMessage>> sessions = new HashMap<>();

    /**
     * 생성자.
     *
     * @param maxMessagesPerSession 세션당 최대 메시지 수
     * @param clock 메시지 시각 기록용 시계
     */
    public SessionMemory(int maxMessagesPerSession, Clock clock) {
        if (maxMessagesPerSession <= 0) {
            throw new IllegalArgumentException(
                "maxMessagesPerSession must be positive (current: " + maxMessagesPerSession + ")"
            );
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.maxMessagesPerSession = maxMessagesPerSession;
        this.clock = clock;
    }

    /**
     * 현재 시각으로 메시지 추가.
     *
     * @return 추가된 메시지
     */
    public SessionMessage append(String sessionId, String role, String content) {
        SessionMessage message = new SessionMessage(sessionId, role, content, clock.instant());
        add(sessionId, message);
        return message;
    }

    /**
     * 메시지 추가.
     *
     * @param key sessionId (message의 sessionId와 같아야 함)
     * @param entry 메시지
     * @throws IllegalArgumentException key와 message의 sessionId가 다른 경우
     */
    @Override
    public void add(String key, SessionMessage entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        if (!entry.sessionId().equals(key)) {
            throw new IllegalArgumentException(
                "key must match message sessionId (key: " + key + ", sessionId: " + entry.sessionId() + ")"
            );
        }
        lock.lock();
        try {
            Deque<SessionMessage> history = sessions.computeIfAbsent(key, id -> new ArrayDeque<>());
            history.addLast(entry);
            while (history.size() > maxMessagesPerSession) {
                history.removeFirst();
                log.debug("Session {} exceeded {} messages, dropped oldest", key, maxMessagesPerSession);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 세션의 마지막 메시지.
     */
    @Override
    public Optional<SessionMessage> get(String key) {
        lock.lock();
        try {
            Deque<SessionMessage> history = sessions.get(key);
            return history == null ? Optional.empty() : Optional.ofNullable(history.peekLast());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 세션 전체 기록 (오래된 것 먼저).
     */
    public List<SessionMessage> history(String sessionId) {
        lock.lock();
        try {
            Deque<SessionMessage> history = sessions.get(sessionId);
            return history == null ? List.of() : List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 세션의 마지막 lastN개 메시지 (오래된 것 먼저).
     *
     * @throws IllegalArgumentException lastN이 음수인 경우
     */
    public List<SessionMessage> history(String sessionId, int lastN) {
        if (lastN < 0) {
            throw new IllegalArgumentException("lastN must not be negative (current: " + lastN + ")");
        }
        List<SessionMessage> all = history(sessionId);
        return all.subList(Math.max(0, all.size() - lastN), all.size());
    }

    /**
     * 내용에 검색어가 포함된 메시지를 최신순으로 검색.
     *
     * <p>질의에 sessionId가 있으면 해당 세션만, 없으면 전체 세션을 검색합니다.</p>
     */
    @Override
    public List<SessionMessage> search(MemoryQuery query) {
        List<SessionMessage> candidates = new ArrayList<>();
        lock.lock();
        try {
            if (query.sessionId() != null) {
                Deque<SessionMessage> history = sessions.get(query.sessionId());
                if (history != null) {
                    candidates.addAll(history);
                }
            } else {
                sessions.values().forEach(candidates::addAll);
            }
        } finally {
            lock.unlock();
        }

        String needle = query.hasText() ? query.text().toLowerCase(Locale.ROOT) : null;
        List<SessionMessage> matches = new ArrayList<>();
        candidates.sort((a, b) -> b.at().compareTo(a.at()));
        Iterator<SessionMessage> it = candidates.iterator();
        while (it.hasNext() && matches.size() < query.limit()) {
            SessionMessage message = it.next();
            if (needle == null || message.content().toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(message);
            }
        }
        return Collections.unmodifiableList(matches);
    }

    /**
     * 세션 기록 삭제.
     *
     * @return 삭제된 메시지 수
     */
    public int clearSession(String sessionId) {
        lock.lock();
        try {
            Deque<SessionMessage> removed = sessions.remove(sessionId);
            return removed == null ? 0 : removed.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 기록이 있는 세션 ID (정렬됨).
     */
    public Set<String> sessionIds() {
        lock.lock();
        try {
            return Collections.unmodifiableSet(new TreeSet<>(sessions.keySet()));
        } finally {
            lock.unlock();
        }
    }

    Clock clock() {
        return clock;
    }
}

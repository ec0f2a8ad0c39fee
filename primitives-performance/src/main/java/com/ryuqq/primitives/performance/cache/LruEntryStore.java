package com.ryuqq.primitives.performance.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * LRU + TTL 기반 in-process {@link EntryStore}.
 *
 * <p><strong>자료 구조:</strong></p>
 * <ul>
 *   <li>access-order {@link LinkedHashMap}: 조회 시 항목이 맨 뒤(가장 최근)로 이동</li>
 *   <li>단일 {@link ReentrantLock}: get/put/evict를 서로에 대해 원자적으로 보호</li>
 * </ul>
 *
 * <p><strong>만료:</strong> 만료된 항목은 읽을 때 제거합니다 (lazy expiry).
 * ttl이 null이면 만료되지 않습니다.</p>
 *
 * <p><strong>제거:</strong> put 후 항목 수가 maxSize를 넘으면 가장 오래 사용되지 않은 항목부터 제거합니다.</p>
 *
 * @param <V> 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LruEntryStore<V> implements EntryStore<V> {

    private static final Logger log = LoggerFactory.getLogger(LruEntryStore.class);

    private final int maxSize;
    private final Duration ttl;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, CacheEntry<V>> entries;
    private long evictions;

    /**
     * 생성자.
     *
     * @param maxSize 최대 항목 수 (1 이상)
     * @param ttl 항목 유효 시간 (null이면 만료 없음)
     * @param clock 만료 판단에 사용할 시계
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LruEntryStore(int maxSize, Duration ttl, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive (current: " + maxSize + ")");
        }
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new IllegalArgumentException("ttl must be positive when present (current: " + ttl + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.maxSize = maxSize;
        this.ttl = ttl;
        this.clock = clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    public static <V> LruEntryStore<V> of(CacheConfig config, Clock clock) {
        return new LruEntryStore<>(config.maxSize(), config.ttl(), clock);
    }

    @Override
    public Optional<V> get(String key) {
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            Instant now = clock.instant();
            if (entry.isExpired(now)) {
                entries.remove(key);
                return Optional.empty();
            }
            entries.put(key, entry.touchedAt(now));
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(String key, V value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        lock.lock();
        try {
            Instant now = clock.instant();
            entries.remove(key);
            entries.put(key, new CacheEntry<>(key, value, now, now, ttl));
            evictOverflow();
        } finally {
            lock.unlock();
        }
    }

    private void evictOverflow() {
        Iterator<Map.Entry<String, CacheEntry<V>>> eldest = entries.entrySet().iterator();
        while (entries.size() > maxSize && eldest.hasNext()) {
            String evicted = eldest.next().getKey();
            eldest.remove();
            evictions++;
            log.debug("Evicted least recently used entry {}", evicted);
        }
    }

    @Override
    public boolean invalidate(String key) {
        lock.lock();
        try {
            CacheEntry<V> removed = entries.remove(key);
            return removed != null && !removed.isExpired(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 항목 수 (아직 제거되지 않은 만료 항목 포함).
     */
    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long evictionCount() {
        lock.lock();
        try {
            return evictions;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 만료되지 않은 항목을 LRU 순서(가장 오래된 것 먼저)로 반환. 사용 시각은 갱신하지 않습니다.
     */
    public List<CacheEntry<V>> snapshot() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<CacheEntry<V>> live = new ArrayList<>(entries.size());
            for (CacheEntry<V> entry : entries.values()) {
                if (!entry.isExpired(now)) {
                    live.add(entry);
                }
            }
            return live;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 키를 LRU 순서(가장 오래된 것 먼저)로 반환.
     */
    public List<String> keys() {
        lock.lock();
        try {
            return new ArrayList<>(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int maxSize() {
        return maxSize;
    }
}

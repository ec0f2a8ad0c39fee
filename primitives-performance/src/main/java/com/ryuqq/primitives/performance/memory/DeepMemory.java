package com.ryuqq.primitives.performance.memory;

import com.ryuqq.primitives.core.error.StoreUnavailableException;
import com.ryuqq.primitives.core.spi.RemoteStore;
import com.ryuqq.primitives.performance.cache.CacheEntry;
import com.ryuqq.primitives.performance.cache.LruEntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Layer 3: 키워드/태그로 검색 가능한 장기 기억.
 *
 * <p><strong>저장:</strong> 로컬 {@link LruEntryStore}(최대 항목 수 제한, 만료 없음)가 기본이며 항상 완전하게 동작합니다.
 * 원격 저장소가 있으면 추가로 사용합니다.</p>
 * <ul>
 *   <li>add: 로컬에 항상 저장, 원격은 best-effort</li>
 *   <li>get: 원격 우선, 원격에 없거나 장애면 로컬</li>
 *   <li>search: 로컬 후보 + 원격 검색 결과를 합쳐 {@link RelevanceFunction}으로 순위 결정
 *       (원격 장애 시 로컬만). 원격에는 검색어와 태그를 키워드로 넘기고 limit보다 많이 가져오므로
 *       로컬 LRU에서 밀려난 항목도 태그로 다시 찾을 수 있습니다.</li>
 * </ul>
 *
 * <p><strong>순위:</strong> 관련도 점수 내림차순, 같으면 중요도 내림차순, 같으면 최신순.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DeepMemory implements MemoryLayer<DeepMemoryEntry> {

    private static final Logger log = LoggerFactory.getLogger(DeepMemory.class);

    static final String REMOTE_KEY_PREFIX = "deep:";

    private static final int REMOTE_OVERFETCH_FACTOR = 10;
    private static final int MIN_REMOTE_CANDIDATES = 100;

    private static final Comparator<Ranked> RANKING = Comparator
        .comparingDouble(Ranked::score).reversed()
        .thenComparing(Comparator.comparingDouble((Ranked ranked) -> ranked.entry().importance()).reversed())
        .thenComparing(Comparator.comparing((Ranked ranked) -> ranked.entry().createdAt()).reversed());

    private final LruEntryStore<DeepMemoryEntry> local;
    private final RemoteStore<DeepMemoryEntry> remote;
    private final RelevanceFunction relevance;
    private final Clock clock;

    /**
     * 로컬 저장소만 사용하는 DeepMemory.
     */
    public DeepMemory(int maxEntries, Clock clock) {
        this(maxEntries, clock, KeywordRelevance.INSTANCE, null);
    }

    /**
     * 생성자.
     *
     * @param maxEntries 로컬 최대 항목 수
     * @param clock 항목 생성 시각용 시계
     * @param relevance 관련도 함수
     * @param remote 원격 저장소 (null이면 로컬만)
     */
    public DeepMemory(int maxEntries, Clock clock, RelevanceFunction relevance, RemoteStore<DeepMemoryEntry> remote) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (relevance == null) {
            throw new IllegalArgumentException("relevance cannot be null");
        }
        this.local = new LruEntryStore<>(maxEntries, null, clock);
        this.remote = remote;
        this.relevance = relevance;
        this.clock = clock;
    }

    /**
     * 현재 시각으로 항목을 만들어 추가.
     *
     * @return 추가된 항목
     */
    public DeepMemoryEntry remember(String key, String content, Set<String> tags, double importance) {
        DeepMemoryEntry entry = new DeepMemoryEntry(key, content, tags, importance, clock.instant());
        add(key, entry);
        return entry;
    }

    @Override
    public void add(String key, DeepMemoryEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        if (!entry.key().equals(key)) {
            throw new IllegalArgumentException("key must match entry key (key: " + key + ", entry: " + entry.key() + ")");
        }
        local.put(key, entry);
        if (remote == null) {
            return;
        }
        try {
            remote.put(REMOTE_KEY_PREFIX + key, entry, null);
        } catch (StoreUnavailableException e) {
            log.warn("Remote store unavailable, deep memory {} kept locally only: {}", key, e.getMessage());
        }
    }

    @Override
    public Optional<DeepMemoryEntry> get(String key) {
        if (remote != null) {
            try {
                Optional<DeepMemoryEntry> found = remote.get(REMOTE_KEY_PREFIX + key);
                if (found.isPresent()) {
                    return found;
                }
            } catch (StoreUnavailableException e) {
                log.warn("Remote store unavailable, reading deep memory {} locally: {}", key, e.getMessage());
            }
        }
        return local.get(key);
    }

    @Override
    public List<DeepMemoryEntry> search(MemoryQuery query) {
        Map<String, DeepMemoryEntry> candidates = new LinkedHashMap<>();
        for (CacheEntry<DeepMemoryEntry> cached : local.snapshot()) {
            candidates.put(cached.key(), cached.value());
        }
        for (DeepMemoryEntry entry : remoteCandidates(query)) {
            candidates.putIfAbsent(entry.key(), entry);
        }

        List<Ranked> ranked = new ArrayList<>(candidates.size());
        for (DeepMemoryEntry entry : candidates.values()) {
            double score = relevance.score(query, entry);
            if (score > 0.0) {
                ranked.add(new Ranked(entry, score));
            }
        }
        return ranked.stream()
            .sorted(RANKING)
            .limit(query.limit())
            .map(Ranked::entry)
            .collect(Collectors.toList());
    }

    private List<DeepMemoryEntry> remoteCandidates(MemoryQuery query) {
        if (remote == null) {
            return List.of();
        }
        try {
            return remote.search(remoteQueryText(query), remoteCandidateLimit(query), Map.of());
        } catch (StoreUnavailableException e) {
            log.warn("Remote store unavailable, searching deep memory locally: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * 원격 검색어: 검색어와 태그를 합친 키워드.
     * 원격 저장소의 필터는 단일 값 속성이라 태그 집합을 표현할 수 없으므로 태그는 키워드로 넘긴다.
     */
    private static String remoteQueryText(MemoryQuery query) {
        List<String> terms = new ArrayList<>();
        if (query.hasText()) {
            terms.add(query.text().trim());
        }
        terms.addAll(new TreeSet<>(query.tags()));
        return String.join(" ", terms);
    }

    /**
     * 원격 순위는 로컬 순위와 다르므로 limit보다 넉넉히 가져와 로컬에서 다시 거른다.
     */
    private static int remoteCandidateLimit(MemoryQuery query) {
        long overFetched = (long) query.limit() * REMOTE_OVERFETCH_FACTOR;
        return (int) Math.min(Integer.MAX_VALUE, Math.max(MIN_REMOTE_CANDIDATES, overFetched));
    }

    /**
     * 항목 삭제 (로컬과 원격 모두).
     *
     * @return 로컬 또는 원격에서 삭제된 항목이 있었는지 여부
     */
    public boolean forget(String key) {
        boolean remoteRemoved = false;
        if (remote != null) {
            try {
                remoteRemoved = remote.delete(REMOTE_KEY_PREFIX + key);
            } catch (StoreUnavailableException e) {
                log.warn("Remote store unavailable, forgetting deep memory {} locally: {}", key, e.getMessage());
            }
        }
        return local.invalidate(key) || remoteRemoved;
    }

    /**
     * 로컬 항목 수.
     */
    public int size() {
        return local.size();
    }

    public boolean isRemoteBacked() {
        return remote != null;
    }

    private record Ranked(DeepMemoryEntry entry, double score) {
    }
}

package com.ryuqq.primitives.performance.memory;

import com.ryuqq.primitives.core.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Layer 4: Permanent Architectural Facts 레지스트리.
 *
 * <p>등록된 사실은 바뀌지 않습니다. 같은 키를 같은 정의로 다시 등록하면 무시하고,
 * 다른 정의로 등록하면 {@link ConfigurationException}을 던집니다.
 * 사실을 없애는 유일한 방법은 {@link #deprecate(String, String)}입니다.</p>
 *
 * <p><strong>검증:</strong> {@link #validate(String, Object)}는 예외를 던지지 않습니다.
 * 알 수 없는 키, DEPRECATED 사실, null 실제 값, 타입 불일치는 모두 실패 결과로 돌려줍니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FactMemory implements MemoryLayer<ArchitecturalFact> {

    private static final Logger log = LoggerFactory.getLogger(FactMemory.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ArchitecturalFact> facts = new LinkedHashMap<>();

    /**
     * 사실 등록.
     *
     * @return 새로 등록되었으면 true, 같은 정의가 이미 있으면 false
     * @throws ConfigurationException 같은 키에 다른 정의가 이미 있는 경우
     */
    public boolean register(ArchitecturalFact fact) {
        if (fact == null) {
            throw new IllegalArgumentException("fact cannot be null");
        }
        lock.lock();
        try {
            ArchitecturalFact existing = facts.get(fact.key());
            if (existing == null) {
                facts.put(fact.key(), fact);
                log.debug("Registered fact {} ({} {})", fact.key(), fact.category(), fact.expectation());
                return true;
            }
            if (existing.sameDefinition(fact)) {
                return false;
            }
            throw new ConfigurationException(
                "Fact '" + fact.key() + "' is already registered with a different definition"
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * 여러 사실 등록.
     *
     * @return 새로 등록된 수
     */
    public int registerAll(Collection<ArchitecturalFact> toRegister) {
        int registered = 0;
        for (ArchitecturalFact fact : toRegister) {
            if (register(fact)) {
                registered++;
            }
        }
        return registered;
    }

    /**
     * {@link #register(ArchitecturalFact)}와 같으며 key는 fact의 키와 같아야 합니다.
     */
    @Override
    public void add(String key, ArchitecturalFact entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        if (!entry.key().equals(key)) {
            throw new IllegalArgumentException("key must match fact key (key: " + key + ", fact: " + entry.key() + ")");
        }
        register(entry);
    }

    @Override
    public Optional<ArchitecturalFact> get(String key) {
        lock.lock();
        try {
            return Optional.ofNullable(facts.get(key));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 사실을 DEPRECATED 사본으로 교체.
     *
     * @return 교체되었으면 true, 키가 없거나 이미 DEPRECATED면 false
     */
    public boolean deprecate(String key, String reason) {
        lock.lock();
        try {
            ArchitecturalFact existing = facts.get(key);
            if (existing == null || !existing.isActive()) {
                return false;
            }
            facts.put(key, existing.deprecated(reason));
            log.info("Deprecated fact {}: {}", key, reason);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public FactValidation validate(String key, Object actual) {
        Optional<ArchitecturalFact> found = get(key);
        if (found.isEmpty()) {
            return FactValidation.failed(key, null, actual, "Unknown fact '" + key + "'", Severity.WARNING);
        }
        ArchitecturalFact fact = found.get();
        String expected = fact.expectation();
        if (!fact.isActive()) {
            return FactValidation.failed(key, expected, actual,
                "Fact '" + key + "' is deprecated: " + fact.deprecationReason(), Severity.WARNING);
        }
        if (actual == null) {
            return FactValidation.failed(key, expected, null, "Actual value is missing", Severity.ERROR);
        }
        try {
            if (fact.comparison().test(fact.expected(), actual)) {
                return FactValidation.passed(key, expected, actual);
            }
            return FactValidation.failed(key, expected, actual,
                "Expected " + expected + " but was " + actual, Severity.ERROR);
        } catch (RuntimeException | StackOverflowError e) {
            // 역추적이 깊은 정규식은 긴 입력에서 스택을 소진한다
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.debug("Fact {} comparison failed for actual {}: {}", key, actual, reason);
            return FactValidation.failed(key, expected, actual, "Cannot compare: " + reason, Severity.ERROR);
        }
    }

    /**
     * 여러 값을 한 번에 검증 (입력 순서 유지).
     */
    public List<FactValidation> validateAll(Map<String, ?> actuals) {
        List<FactValidation> results = new ArrayList<>(actuals.size());
        actuals.forEach((key, actual) -> results.add(validate(key, actual)));
        return results;
    }

    /**
     * ACTIVE 사실 (등록 순서).
     */
    public List<ArchitecturalFact> active() {
        lock.lock();
        try {
            List<ArchitecturalFact> result = new ArrayList<>();
            for (ArchitecturalFact fact : facts.values()) {
                if (fact.isActive()) {
                    result.add(fact);
                }
            }
            return List.copyOf(result);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 카테고리의 ACTIVE 사실.
     */
    public List<ArchitecturalFact> byCategory(String category) {
        return search(MemoryQuery.text(null)
            .withCategories(Set.of(category))
            .withLimit(Integer.MAX_VALUE));
    }

    /**
     * ACTIVE 사실 중 카테고리(비어 있으면 전체)와 검색어(키 또는 근거에 포함)가 맞는 것.
     */
    @Override
    public List<ArchitecturalFact> search(MemoryQuery query) {
        String needle = query.hasText() ? query.text().toLowerCase(Locale.ROOT) : null;
        List<ArchitecturalFact> matches = new ArrayList<>();
        for (ArchitecturalFact fact : active()) {
            if (matches.size() >= query.limit()) {
                break;
            }
            if (!query.categories().isEmpty() && !query.categories().contains(fact.category())) {
                continue;
            }
            if (needle == null
                || fact.key().toLowerCase(Locale.ROOT).contains(needle)
                || fact.rationale().toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(fact);
            }
        }
        return List.copyOf(matches);
    }

    /**
     * 상태/카테고리별 집계.
     */
    public FactSummary summary() {
        lock.lock();
        try {
            int active = 0;
            Map<String, Integer> byCategory = new TreeMap<>();
            for (ArchitecturalFact fact : facts.values()) {
                if (fact.isActive()) {
                    active++;
                    byCategory.merge(fact.category(), 1, Integer::sum);
                }
            }
            return new FactSummary(facts.size(), active, facts.size() - active, byCategory);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return facts.size();
        } finally {
            lock.unlock();
        }
    }
}

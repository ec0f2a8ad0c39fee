package com.ryuqq.primitives.adapter.inmemory.store;

import com.ryuqq.primitives.core.error.StoreUnavailableException;
import com.ryuqq.primitives.core.spi.RemoteStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link RemoteStore} SPI for testing and reference purposes.
 *
 * <p>This implementation stands in for a real remote backend (Redis, a vector database, ...)
 * so that Cache and Deep Memory can be exercised end to end without infrastructure.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>entries:</strong> ConcurrentHashMap&lt;String, StoredValue&gt; - value, expiry and insertion sequence (O(1) access)</li>
 * </ul>
 *
 * <p><strong>Search:</strong></p>
 * <ul>
 *   <li>Text of a value is produced by the text extractor (default {@link String#valueOf(Object)})</li>
 *   <li>Score = number of query terms contained in the text, case-insensitive</li>
 *   <li>Values with score 0 are excluded; ties keep insertion order</li>
 *   <li>Filters are matched against the attribute extractor's map; every filter entry must match</li>
 * </ul>
 *
 * <p><strong>Outage Simulation:</strong></p>
 * <ul>
 *   <li>{@link #simulateOutage(boolean)} makes every operation throw {@link StoreUnavailableException}</li>
 *   <li>Used to verify degraded-mode behavior of callers</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Expired entries are removed lazily on access</li>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryRemoteStore&lt;String&gt; store = new InMemoryRemoteStore&lt;&gt;();
 * store.put("fact:1", "circuit breaker opens after 5 failures", Duration.ofHours(1));
 * List&lt;String&gt; hits = store.search("circuit", 10, Map.of());
 * </pre>
 *
 * @param <V> value type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryRemoteStore<V> implements RemoteStore<V> {

    private final ConcurrentHashMap<String, StoredValue<V>> entries;
    private final AtomicLong sequence;
    private final Clock clock;
    private final Function<? super V, String> textExtractor;
    private final Function<? super V, Map<String, String>> attributeExtractor;
    private volatile boolean unavailable;

    /**
     * Creates a store using the system clock and {@link String#valueOf(Object)} as searchable text.
     */
    public InMemoryRemoteStore() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a store using the given clock for TTL decisions.
     *
     * @param clock clock used for expiry
     */
    public InMemoryRemoteStore(Clock clock) {
        this(clock, String::valueOf, value -> Map.of());
    }

    /**
     * Creates a fully customized store.
     *
     * @param clock clock used for expiry
     * @param textExtractor extracts searchable text from a value
     * @param attributeExtractor extracts filterable attributes from a value
     * @throws IllegalArgumentException if any argument is null
     */
    public InMemoryRemoteStore(
        Clock clock,
        Function<? super V, String> textExtractor,
        Function<? super V, Map<String, String>> attributeExtractor
    ) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (textExtractor == null) {
            throw new IllegalArgumentException("textExtractor cannot be null");
        }
        if (attributeExtractor == null) {
            throw new IllegalArgumentException("attributeExtractor cannot be null");
        }
        this.entries = new ConcurrentHashMap<>();
        this.sequence = new AtomicLong();
        this.clock = clock;
        this.textExtractor = textExtractor;
        this.attributeExtractor = attributeExtractor;
    }

    @Override
    public void put(String key, V value, Duration ttl) {
        ensureAvailable();
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new IllegalArgumentException("ttl must be positive when present, but was: " + ttl);
        }

        Instant expiresAt = ttl == null ? null : clock.instant().plus(ttl);
        entries.put(key, new StoredValue<>(value, expiresAt, sequence.incrementAndGet()));
    }

    @Override
    public Optional<V> get(String key) {
        ensureAvailable();
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        StoredValue<V> stored = entries.get(key);
        if (stored == null) {
            return Optional.empty();
        }
        if (stored.isExpired(clock.instant())) {
            // Lazy expiry: only remove the exact entry we observed
            entries.remove(key, stored);
            return Optional.empty();
        }
        return Optional.of(stored.value);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Blank query matches every live value (filters still apply)</li>
     *   <li>Performance: O(N) scan over all entries</li>
     * </ul>
     */
    @Override
    public List<V> search(String query, int limit, Map<String, String> filters) {
        ensureAvailable();
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }

        List<String> terms = tokenize(query);
        Map<String, String> requiredAttributes = filters == null ? Map.of() : filters;
        Instant now = clock.instant();

        return entries.values().stream()
                .filter(stored -> !stored.isExpired(now))
                .filter(stored -> matchesFilters(stored.value, requiredAttributes))
                .map(stored -> new Scored<>(stored, score(stored.value, terms)))
                .filter(scored -> terms.isEmpty() || scored.score > 0)
                .sorted(Comparator.<Scored<V>>comparingInt(scored -> scored.score).reversed()
                        .thenComparingLong(scored -> scored.stored.sequence))
                .limit(limit)
                .map(scored -> scored.stored.value)
                .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String key) {
        ensureAvailable();
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        StoredValue<V> removed = entries.remove(key);
        return removed != null && !removed.isExpired(clock.instant());
    }

    /**
     * {@inheritDoc}
     *
     * <p>Expired entries under the prefix are removed too but are not counted.</p>
     */
    @Override
    public int deleteByPrefix(String prefix) {
        ensureAvailable();
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, StoredValue<V>> entry : entries.entrySet()) {
            if (entry.getKey().startsWith(prefix) && entries.remove(entry.getKey(), entry.getValue())
                    && !entry.getValue().isExpired(now)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public void clear() {
        ensureAvailable();
        entries.clear();
    }

    /**
     * Toggles outage simulation.
     *
     * @param unavailable true to make every operation fail with {@link StoreUnavailableException}
     */
    public void simulateOutage(boolean unavailable) {
        this.unavailable = unavailable;
    }

    /**
     * Returns the number of stored entries, including expired ones not yet evicted.
     */
    public int size() {
        return entries.size();
    }

    private void ensureAvailable() {
        if (unavailable) {
            throw new StoreUnavailableException("InMemoryRemoteStore is unavailable (simulated outage)");
        }
    }

    private boolean matchesFilters(V value, Map<String, String> filters) {
        if (filters.isEmpty()) {
            return true;
        }
        Map<String, String> attributes = attributeExtractor.apply(value);
        return filters.entrySet().stream()
                .allMatch(filter -> filter.getValue().equals(attributes.get(filter.getKey())));
    }

    private int score(V value, List<String> terms) {
        String text = textExtractor.apply(value);
        if (text == null) {
            return 0;
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        int score = 0;
        for (String term : terms) {
            if (normalized.contains(term)) {
                score++;
            }
        }
        return score;
    }

    private static List<String> tokenize(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return Arrays.stream(query.toLowerCase(Locale.ROOT).trim().split("\\s+"))
                .distinct()
                .collect(Collectors.toList());
    }

    /**
     * Stored value with optional expiry and insertion sequence.
     */
    private static final class StoredValue<V> {
        final V value;
        final Instant expiresAt;
        final long sequence;

        StoredValue(V value, Instant expiresAt, long sequence) {
            this.value = value;
            this.expiresAt = expiresAt;
            this.sequence = sequence;
        }

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    private static final class Scored<V> {
        final StoredValue<V> stored;
        final int score;

        Scored(StoredValue<V> stored, int score) {
            this.stored = stored;
            this.score = score;
        }
    }
}

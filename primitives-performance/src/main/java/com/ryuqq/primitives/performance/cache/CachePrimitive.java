package com.ryuqq.primitives.performance.cache;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.error.StoreUnavailableException;
import com.ryuqq.primitives.core.instrumentation.InstrumentationSink;
import com.ryuqq.primitives.core.instrumentation.SafeInstrumentationSink;
import com.ryuqq.primitives.core.instrumentation.noop.NoOpInstrumentationSink;
import com.ryuqq.primitives.core.support.ExecutionFailures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 결과를 캐시하는 데코레이터.
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>hit: 저장된 값을 반환하고 감싼 Primitive는 호출하지 않음</li>
 *   <li>miss: 감싼 Primitive를 실행하고 결과를 저장 (null 결과는 저장하지 않음)</li>
 *   <li>singleFlight: 같은 키의 동시 miss는 한 번만 실행하고 나머지는 그 결과를 공유</li>
 *   <li>저장소 장애({@link StoreUnavailableException}): 캐시를 건너뛰고 감싼 Primitive를 직접 실행</li>
 * </ul>
 *
 * <p><strong>계측 이벤트:</strong> cache.hit, cache.miss, cache.coalesced, cache.degraded</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CachePrimitive<Query, Answer> cached = new CachePrimitive<>(llmCall, new CacheConfig().withTtl(Duration.ofMinutes(10)));
 * Answer answer = cached.execute(query, Context.create());
 * }</pre>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CachePrimitive<I, O> implements Primitive<I, O> {

    private static final Logger log = LoggerFactory.getLogger(CachePrimitive.class);

    /**
     * 마지막 실행의 캐시 결과(hit, miss, coalesced, degraded)가 기록되는 Context metadata 키.
     */
    public static final String RESULT_METADATA_KEY = "cache.result";

    private final Primitive<I, O> delegate;
    private final CacheConfig config;
    private final CacheKeyFunction<? super I> keyFunction;
    private final EntryStore<O> store;
    private final InstrumentationSink sink;
    private final ConcurrentHashMap<String, CompletableFuture<O>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * 기본 키 함수({@link CacheKeys#serializedInputHash()})와 LRU 저장소로 생성.
     */
    public CachePrimitive(Primitive<I, O> delegate, CacheConfig config) {
        this(delegate, config, CacheKeys.serializedInputHash());
    }

    public CachePrimitive(Primitive<I, O> delegate, CacheConfig config, CacheKeyFunction<? super I> keyFunction) {
        this(delegate, config, keyFunction, LruEntryStore.of(requireConfig(config), Clock.systemUTC()),
            NoOpInstrumentationSink.INSTANCE);
    }

    /**
     * 생성자.
     *
     * @param delegate 감쌀 Primitive
     * @param config 캐시 설정 (singleFlight 여부를 사용, ttl/maxSize는 store 생성 시 반영)
     * @param keyFunction 캐시 키 함수
     * @param store 항목 저장소
     * @param sink 계측 sink
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CachePrimitive(
        Primitive<I, O> delegate,
        CacheConfig config,
        CacheKeyFunction<? super I> keyFunction,
        EntryStore<O> store,
        InstrumentationSink sink
    ) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        requireConfig(config);
        if (keyFunction == null) {
            throw new IllegalArgumentException("keyFunction cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.delegate = delegate;
        this.config = config;
        this.keyFunction = keyFunction;
        this.store = store;
        this.sink = SafeInstrumentationSink.wrap(sink);
    }

    private static CacheConfig requireConfig(CacheConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }

    @Override
    public O execute(I input, Context context) throws Exception {
        String key = keyFunction.keyFor(input, context);

        Optional<O> cached;
        try {
            cached = store.get(key);
        } catch (StoreUnavailableException e) {
            return executeDegraded(input, context, e);
        }

        if (cached.isPresent()) {
            hits.incrementAndGet();
            mark(context, "hit", key);
            return cached.get();
        }

        if (!config.singleFlight()) {
            misses.incrementAndGet();
            mark(context, "miss", key);
            return load(key, input, context);
        }
        return loadOnce(key, input, context);
    }

    private O loadOnce(String key, I input, Context context) throws Exception {
        CompletableFuture<O> promise = new CompletableFuture<>();
        CompletableFuture<O> existing = inFlight.putIfAbsent(key, promise);
        if (existing != null) {
            hits.incrementAndGet();
            mark(context, "coalesced", key);
            return awaitLeader(existing);
        }

        try {
            // 앞선 leader가 저장을 마친 직후 도착한 경우
            Optional<O> stored = peek(key);
            if (stored.isPresent()) {
                hits.incrementAndGet();
                mark(context, "hit", key);
                promise.complete(stored.get());
                return stored.get();
            }
            misses.incrementAndGet();
            mark(context, "miss", key);
            O value = load(key, input, context);
            promise.complete(value);
            return value;
        } catch (Exception | Error e) {
            promise.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, promise);
        }
    }

    private Optional<O> peek(String key) {
        try {
            return store.get(key);
        } catch (StoreUnavailableException e) {
            log.debug("{} store unavailable on re-check, loading: {}", name(), e.getMessage());
            return Optional.empty();
        }
    }

    private O awaitLeader(CompletableFuture<O> leader) throws Exception {
        try {
            return leader.get();
        } catch (ExecutionException e) {
            throw ExecutionFailures.unwrap(e);
        }
    }

    private O load(String key, I input, Context context) throws Exception {
        O value = delegate.execute(input, context);
        if (value == null) {
            return null;
        }
        try {
            store.put(key, value);
        } catch (StoreUnavailableException e) {
            log.warn("{} could not store result, returning it uncached: {}", name(), e.getMessage());
        }
        return value;
    }

    private O executeDegraded(I input, Context context, StoreUnavailableException cause) throws Exception {
        log.warn("{} store unavailable, executing {} directly: {}", name(), delegate.name(), cause.getMessage());
        context.metadata().put(RESULT_METADATA_KEY, "degraded");
        sink.event(name(), "cache.degraded", context, Map.of("cause", String.valueOf(cause.getMessage())));
        return delegate.execute(input, context);
    }

    private void mark(Context context, String result, String key) {
        context.metadata().put(RESULT_METADATA_KEY, result);
        sink.event(name(), "cache." + result, context, Map.of("key", key));
    }

    /**
     * 입력에 해당하는 항목 삭제.
     *
     * @return 삭제된 항목이 있었는지 여부
     */
    public boolean invalidate(I input, Context context) {
        return invalidate(keyFunction.keyFor(input, context));
    }

    /**
     * 키에 해당하는 항목 삭제.
     *
     * @return 삭제된 항목이 있었는지 여부
     */
    public boolean invalidate(String key) {
        return store.invalidate(key);
    }

    /**
     * 모든 항목 삭제. 통계는 유지됩니다.
     */
    public void clear() {
        store.clear();
    }

    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), store.evictionCount(), store.size());
    }

    @Override
    public String name() {
        return "cache(" + delegate.name() + ")";
    }

    public CacheConfig config() {
        return config;
    }

    /**
     * 현재 실행 중인 miss 수 (single-flight 대기 키 수).
     */
    public int inFlightCount() {
        return inFlight.size();
    }
}

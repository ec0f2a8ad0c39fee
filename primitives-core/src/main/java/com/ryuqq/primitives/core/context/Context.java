package com.ryuqq.primitives.core.context;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 호출 단위로 전파되는 실행 컨텍스트.
 *
 * <p>루트 {@code execute} 호출 하나에 대해 생성되며, 조합기를 따라 자식 Primitive로 전달됩니다.</p>
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>correlationId: 생성 시 한 번 결정되며 변경되지 않음 (없으면 UUID 생성)</li>
 *   <li>traceId / spanId / parentSpanId / causationId: 분산 추적 연결 정보</li>
 *   <li>workflowId / sessionId: 선택적 식별자</li>
 *   <li>metadata: 조합기와 데코레이터가 남기는 정보 (예: router.route)</li>
 *   <li>state: 작업 간 공유 scratch 영역</li>
 *   <li>baggage: 하위 호출로 전파되는 문자열 쌍</li>
 *   <li>checkpoints: 시간 순서의 (이름, 시각) 목록</li>
 * </ul>
 *
 * <p><strong>공유 규칙:</strong></p>
 * <ul>
 *   <li>Sequential: 모든 단계가 같은 Context 인스턴스를 공유 (state 변경이 다음 단계에 보임)</li>
 *   <li>Parallel: 분기마다 {@link #createChild()}로 만든 독립 Context 사용</li>
 * </ul>
 *
 * <p>metadata, state, baggage 맵은 null 키와 null 값을 거부합니다 ({@link NullPointerException}).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Context {

    private final String correlationId;
    private final String traceId;
    private final String spanId;
    private final String parentSpanId;
    private final String causationId;
    private final String workflowId;
    private final String sessionId;
    private final Map<String, Object> metadata;
    private final Map<String, Object> state;
    private final Map<String, String> baggage;
    private final List<Checkpoint> checkpoints;
    private final Clock clock;
    private final Instant startedAt;

    private Context(Builder builder) {
        this.correlationId = builder.correlationId != null ? builder.correlationId : UUID.randomUUID().toString();
        this.traceId = builder.traceId;
        this.spanId = builder.spanId != null ? builder.spanId : newSpanId();
        this.parentSpanId = builder.parentSpanId;
        this.causationId = builder.causationId;
        this.workflowId = builder.workflowId;
        this.sessionId = builder.sessionId;
        this.metadata = new ConcurrentHashMap<>(builder.metadata);
        this.state = new ConcurrentHashMap<>(builder.state);
        this.baggage = new ConcurrentHashMap<>(builder.baggage);
        this.checkpoints = new CopyOnWriteArrayList<>();
        this.clock = builder.clock;
        this.startedAt = clock.instant();
    }

    /**
     * 기본값으로 루트 Context 생성 (correlationId, spanId 자동 생성).
     *
     * @return 새 Context
     */
    public static Context create() {
        return builder().build();
    }

    /**
     * Builder 생성.
     *
     * @return Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 자식 Context 생성.
     *
     * <p><strong>연결 규칙:</strong></p>
     * <ul>
     *   <li>correlationId, traceId, workflowId, sessionId: 부모 값 유지</li>
     *   <li>parentSpanId: 부모의 spanId</li>
     *   <li>spanId: 새로 생성</li>
     *   <li>causationId: 부모의 correlationId</li>
     *   <li>metadata, state, baggage: 복사본 (이후 변경은 서로 독립)</li>
     *   <li>checkpoints: 빈 목록에서 시작</li>
     * </ul>
     *
     * @return 자식 Context
     */
    public Context createChild() {
        Builder builder = builder()
            .correlationId(correlationId)
            .traceId(traceId)
            .parentSpanId(spanId)
            .causationId(correlationId)
            .workflowId(workflowId)
            .sessionId(sessionId)
            .clock(clock);
        builder.metadata.putAll(metadata);
        builder.state.putAll(state);
        builder.baggage.putAll(baggage);
        return builder.build();
    }

    /**
     * 체크포인트 기록.
     *
     * @param name 체크포인트 이름
     * @return 기록된 체크포인트
     * @throws IllegalArgumentException name이 비어 있는 경우
     */
    public Checkpoint checkpoint(String name) {
        Checkpoint checkpoint = new Checkpoint(name, clock.instant());
        checkpoints.add(checkpoint);
        return checkpoint;
    }

    /**
     * 기록된 체크포인트 목록 (기록 순서, 읽기 전용).
     */
    public List<Checkpoint> checkpoints() {
        return Collections.unmodifiableList(checkpoints);
    }

    /**
     * 이름으로 가장 최근 체크포인트 조회.
     */
    public Optional<Checkpoint> lastCheckpoint(String name) {
        for (int i = checkpoints.size() - 1; i >= 0; i--) {
            Checkpoint checkpoint = checkpoints.get(i);
            if (checkpoint.name().equals(name)) {
                return Optional.of(checkpoint);
            }
        }
        return Optional.empty();
    }

    /**
     * Context 생성 이후 경과 시간.
     */
    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    public String correlationId() {
        return correlationId;
    }

    public Optional<String> traceId() {
        return Optional.ofNullable(traceId);
    }

    public String spanId() {
        return spanId;
    }

    public Optional<String> parentSpanId() {
        return Optional.ofNullable(parentSpanId);
    }

    public Optional<String> causationId() {
        return Optional.ofNullable(causationId);
    }

    public Optional<String> workflowId() {
        return Optional.ofNullable(workflowId);
    }

    public Optional<String> sessionId() {
        return Optional.ofNullable(sessionId);
    }

    /**
     * metadata 맵 (변경 가능, 스레드 안전).
     */
    public Map<String, Object> metadata() {
        return metadata;
    }

    /**
     * state 맵 (변경 가능, 스레드 안전).
     */
    public Map<String, Object> state() {
        return state;
    }

    /**
     * baggage 맵 (변경 가능, 스레드 안전).
     */
    public Map<String, String> baggage() {
        return baggage;
    }

    /**
     * state 값을 지정 타입으로 조회.
     *
     * @param key 키
     * @param type 기대 타입
     * @return 값 (없거나 타입이 다르면 empty)
     */
    public <T> Optional<T> stateValue(String key, Class<T> type) {
        Object value = state.get(key);
        if (type.isInstance(value)) {
            return Optional.of(type.cast(value));
        }
        return Optional.empty();
    }

    public Clock clock() {
        return clock;
    }

    public Instant startedAt() {
        return startedAt;
    }

    @Override
    public String toString() {
        return "Context{" +
            "correlationId='" + correlationId + '\'' +
            ", spanId='" + spanId + '\'' +
            ", parentSpanId='" + parentSpanId + '\'' +
            ", checkpoints=" + checkpoints.size() +
            '}';
    }

    private static String newSpanId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    /**
     * Context Builder.
     */
    public static final class Builder {

        private String correlationId;
        private String traceId;
        private String spanId;
        private String parentSpanId;
        private String causationId;
        private String workflowId;
        private String sessionId;
        private final Map<String, Object> metadata = new ConcurrentHashMap<>();
        private final Map<String, Object> state = new ConcurrentHashMap<>();
        private final Map<String, String> baggage = new ConcurrentHashMap<>();
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder spanId(String spanId) {
            this.spanId = spanId;
            return this;
        }

        public Builder parentSpanId(String parentSpanId) {
            this.parentSpanId = parentSpanId;
            return this;
        }

        public Builder causationId(String causationId) {
            this.causationId = causationId;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder state(String key, Object value) {
            this.state.put(key, value);
            return this;
        }

        public Builder baggage(String key, String value) {
            this.baggage.put(key, value);
            return this;
        }

        /**
         * 시간 소스 지정 (기본: {@link Clock#systemUTC()}).
         *
         * @throws IllegalArgumentException clock이 null인 경우
         */
        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("clock cannot be null");
            }
            this.clock = clock;
            return this;
        }

        public Context build() {
            if (correlationId != null && correlationId.isBlank()) {
                throw new IllegalArgumentException("correlationId cannot be blank");
            }
            return new Context(this);
        }
    }
}

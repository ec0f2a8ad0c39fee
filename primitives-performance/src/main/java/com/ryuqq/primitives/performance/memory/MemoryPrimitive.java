package com.ryuqq.primitives.performance.memory;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.spi.RemoteStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 4계층 메모리를 하나로 묶은 Primitive.
 *
 * <p>한 번의 {@link #execute(MemoryQuery, Context)}로 다음을 모아 {@link MemorySnapshot}을 반환합니다.</p>
 * <ul>
 *   <li>history: 세션 전체 기록 (Layer 1)</li>
 *   <li>recent: 질의 window(없으면 기본 구간) 안의 메시지 (Layer 2)</li>
 *   <li>related: 질의 검색어/태그로 찾은 장기 기억 (Layer 3)</li>
 *   <li>facts: 질의 카테고리의 ACTIVE 사실, 카테고리가 없으면 전체 (Layer 4)</li>
 * </ul>
 *
 * <p>세션은 질의의 sessionId, 없으면 Context의 sessionId를 사용합니다.
 * 둘 다 없으면 history와 recent는 비어 있습니다.</p>
 *
 * <p>{@link #loadForStage(Context, WorkflowStage, WorkflowMode)}는 작업 흐름 단계와 모드에 따라
 * 필요한 계층만 골라 불러옵니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * MemoryPrimitive memory = new MemoryPrimitive(new MemoryConfig());
 * memory.session().append("s-1", "user", "캐시 TTL을 10분으로 바꿔 주세요");
 * memory.facts().register(ArchitecturalFact.active("test-coverage", "QUAL", 80, Comparison.AT_LEAST, "Minimum coverage"));
 *
 * MemorySnapshot snapshot = memory.execute(MemoryQuery.forSession("s-1").withText("캐시"), Context.create());
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MemoryPrimitive implements Primitive<MemoryQuery, MemorySnapshot> {

    private static final Logger log = LoggerFactory.getLogger(MemoryPrimitive.class);

    private final MemoryConfig config;
    private final SessionMemory session;
    private final WindowMemory window;
    private final DeepMemory deep;
    private final FactMemory facts;

    /**
     * 로컬 저장소만 사용하는 MemoryPrimitive.
     */
    public MemoryPrimitive(MemoryConfig config) {
        this(config, Clock.systemUTC(), null, new FactMemory());
    }

    /**
     * 생성자.
     *
     * @param config 메모리 설정
     * @param clock 메시지/항목 시각 및 window 계산용 시계
     * @param remote Deep Memory 원격 저장소 (null이면 로컬만)
     * @param facts 공유할 Fact 레지스트리
     * @throws IllegalArgumentException config, clock, facts가 null인 경우
     */
    public MemoryPrimitive(MemoryConfig config, Clock clock, RemoteStore<DeepMemoryEntry> remote, FactMemory facts) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (facts == null) {
            throw new IllegalArgumentException("facts cannot be null");
        }
        this.config = config;
        this.session = new SessionMemory(config.maxMessagesPerSession(), clock);
        this.window = new WindowMemory(session, config.defaultWindow());
        this.deep = new DeepMemory(config.maxDeepEntries(), clock, KeywordRelevance.INSTANCE, remote);
        this.facts = facts;
    }

    @Override
    public MemorySnapshot execute(MemoryQuery query, Context context) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        String sessionId = query.sessionId() != null
            ? query.sessionId()
            : context.sessionId().orElse(null);

        List<SessionMessage> history = List.of();
        List<SessionMessage> recent = List.of();
        if (sessionId != null) {
            Duration recentWindow = query.window() != null ? query.window() : config.defaultWindow();
            history = session.history(sessionId);
            recent = window.recent(sessionId, recentWindow);
        }
        List<DeepMemoryEntry> related = deep.search(query);
        List<ArchitecturalFact> activeFacts = facts.active().stream()
            .filter(fact -> query.categories().isEmpty() || query.categories().contains(fact.category()))
            .collect(Collectors.toList());

        log.debug("Memory snapshot for session {}: history={}, recent={}, related={}, facts={}",
            sessionId, history.size(), recent.size(), related.size(), activeFacts.size());
        return new MemorySnapshot(sessionId, history, recent, related, activeFacts);
    }

    /**
     * 작업 흐름 단계와 모드에 맞춰 필요한 계층만 불러옵니다.
     *
     * <p>세션은 Context의 sessionId, Deep Memory 검색어는 Context의 workflowId입니다.
     * sessionId가 없으면 아무 계층도 불러오지 않습니다. 어떤 계층을 불러오는지는 {@link StageLoadPlan}을 따릅니다.</p>
     *
     * @param context 실행 컨텍스트
     * @param stage 작업 흐름 단계
     * @param mode 작업 흐름 모드
     * @return 불러온 메모리
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public WorkflowMemoryContext loadForStage(Context context, WorkflowStage stage, WorkflowMode mode) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        StageLoadPlan plan = StageLoadPlan.of(stage, mode);
        String sessionId = context.sessionId().orElse(null);
        String workflowId = context.workflowId().orElse(null);
        if (sessionId == null) {
            log.debug("No session in context, skipping {} memory load ({})", stage, mode.value());
            return new WorkflowMemoryContext(stage, mode, workflowId, plan,
                new MemorySnapshot(null, List.of(), List.of(), List.of(), List.of()));
        }

        List<SessionMessage> history = plan.loadsHistory() ? session.history(sessionId, plan.historyLimit()) : List.of();
        List<SessionMessage> recent = plan.loadsRecent() ? window.recent(sessionId, plan.recentWindow()) : List.of();
        List<DeepMemoryEntry> related = plan.loadsDeep() && workflowId != null
            ? searchDeep(workflowId, plan)
            : List.of();
        List<ArchitecturalFact> activeFacts = plan.includeFacts() ? facts.active() : List.of();

        log.debug("Loaded {} memory ({}) for session {}: history={}, recent={}, related={}, facts={}",
            stage, mode.value(), sessionId, history.size(), recent.size(), related.size(), activeFacts.size());
        return new WorkflowMemoryContext(stage, mode, workflowId, plan,
            new MemorySnapshot(sessionId, history, recent, related, activeFacts));
    }

    /**
     * STANDARD 모드로 단계별 메모리를 불러옵니다.
     */
    public WorkflowMemoryContext loadForStage(Context context, WorkflowStage stage) {
        return loadForStage(context, stage, WorkflowMode.STANDARD);
    }

    private List<DeepMemoryEntry> searchDeep(String workflowId, StageLoadPlan plan) {
        MemoryQuery query = MemoryQuery.text(workflowId)
            .withTags(plan.deepTags())
            .withLimit(plan.deepLimit());
        return deep.search(query).stream()
            .filter(entry -> entry.tags().containsAll(plan.deepTags()))
            .collect(Collectors.toList());
    }

    @Override
    public String name() {
        return "memory";
    }

    public SessionMemory session() {
        return session;
    }

    public WindowMemory window() {
        return window;
    }

    public DeepMemory deep() {
        return deep;
    }

    public FactMemory facts() {
        return facts;
    }

    public MemoryConfig config() {
        return config;
    }
}

package com.ryuqq.primitives.core.combinator;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.error.ConfigurationException;
import com.ryuqq.primitives.core.support.ExecutionFailures;
import com.ryuqq.primitives.core.support.NamedDaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * fail-fast 병렬 실행 조합기.
 *
 * <p>모든 분기에 같은 입력을 주고 동시에 실행하여, 결과를 분기 순서(입력 순서)대로 담은 목록을 반환합니다.</p>
 *
 * <p><strong>실행 규칙:</strong></p>
 * <ul>
 *   <li>분기마다 {@link Context#createChild()}로 만든 독립 Context 사용</li>
 *   <li>결과 순서는 완료 순서와 무관하게 분기 순서</li>
 *   <li>첫 번째 실패가 나오면 나머지 분기를 인터럽트로 취소하고, 그 예외를 그대로 다시 던짐</li>
 * </ul>
 *
 * <p><strong>Executor:</strong></p>
 * <ul>
 *   <li>기본 생성자: 인스턴스 전용 cached daemon 스레드 풀 ({@link #close()}로 종료)</li>
 *   <li>executor 주입 생성자: 호출자가 종료 책임을 가짐</li>
 * </ul>
 *
 * <p>모든 분기 결과를 수집해야 한다면 {@link SettledParallelPrimitive}를 사용합니다.</p>
 *
 * @param <I> 입력 타입
 * @param <O> 분기 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ParallelPrimitive<I, O> implements Primitive<I, List<O>>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ParallelPrimitive.class);

    private final List<Primitive<? super I, ? extends O>> branches;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    /**
     * 기본 executor로 생성.
     *
     * @param branches 병렬 분기
     * @throws IllegalArgumentException branches가 null이거나 null 원소를 포함한 경우
     * @throws ConfigurationException branches가 비어 있는 경우
     */
    public ParallelPrimitive(List<? extends Primitive<? super I, ? extends O>> branches) {
        this(branches, Executors.newCachedThreadPool(new NamedDaemonThreadFactory("primitives-parallel")), true);
    }

    /**
     * 외부 executor로 생성.
     *
     * @param branches 병렬 분기
     * @param executor 분기 실행 executor (종료는 호출자 책임)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws ConfigurationException branches가 비어 있는 경우
     */
    public ParallelPrimitive(List<? extends Primitive<? super I, ? extends O>> branches, ExecutorService executor) {
        this(branches, executor, false);
    }

    private ParallelPrimitive(
        List<? extends Primitive<? super I, ? extends O>> branches,
        ExecutorService executor,
        boolean ownsExecutor
    ) {
        this.branches = validateBranches(branches, "ParallelPrimitive");
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    @Override
    public List<O> execute(I input, Context context) throws Exception {
        CompletionService<O> completion = new ExecutorCompletionService<>(executor);
        List<Future<O>> futures = new ArrayList<>(branches.size());
        try {
            for (Primitive<? super I, ? extends O> branch : branches) {
                Context child = context.createChild();
                futures.add(completion.submit(() -> branch.execute(input, child)));
            }
            for (int i = 0; i < futures.size(); i++) {
                Future<O> done = completion.take();
                try {
                    done.get();
                } catch (ExecutionException e) {
                    ExecutionFailures.cancelAll(futures);
                    Exception failure = ExecutionFailures.unwrap(e);
                    log.debug("Parallel branch failed, cancelled remaining branches: {}", failure.toString());
                    throw failure;
                }
            }
        } catch (InterruptedException | RuntimeException e) {
            ExecutionFailures.cancelAll(futures);
            throw e;
        }

        List<O> results = new ArrayList<>(futures.size());
        for (Future<O> future : futures) {
            results.add(future.get());
        }
        return Collections.unmodifiableList(results);
    }

    /**
     * 분기 목록 (읽기 전용).
     */
    public List<Primitive<? super I, ? extends O>> branches() {
        return branches;
    }

    /**
     * 인스턴스 전용 executor를 종료합니다. 주입받은 executor는 종료하지 않습니다.
     */
    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    static <I, O> List<Primitive<? super I, ? extends O>> validateBranches(
        List<? extends Primitive<? super I, ? extends O>> branches,
        String owner
    ) {
        if (branches == null) {
            throw new IllegalArgumentException("branches cannot be null");
        }
        if (branches.isEmpty()) {
            throw new ConfigurationException(owner + " requires at least one branch");
        }
        for (Primitive<? super I, ? extends O> branch : branches) {
            if (branch == null) {
                throw new IllegalArgumentException("branches cannot contain null");
            }
        }
        return List.<Primitive<? super I, ? extends O>>copyOf(branches);
    }
}

package com.ryuqq.primitives.core.combinator;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.outcome.BranchOutcome;
import com.ryuqq.primitives.core.outcome.Failed;
import com.ryuqq.primitives.core.outcome.Succeeded;
import com.ryuqq.primitives.core.support.ExecutionFailures;
import com.ryuqq.primitives.core.support.NamedDaemonThreadFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 모든 분기 결과를 수집하는 병렬 실행 조합기 (non-fail-fast).
 *
 * <p>{@link ParallelPrimitive}와 달리 한 분기의 실패가 다른 분기를 취소하지 않습니다.
 * 모든 분기가 끝난 뒤 분기 순서대로 {@link BranchOutcome} 목록을 반환하며,
 * 분기 실패 때문에 예외를 던지지는 않습니다.</p>
 *
 * @param <I> 입력 타입
 * @param <O> 분기 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SettledParallelPrimitive<I, O> implements Primitive<I, List<BranchOutcome<O>>>, AutoCloseable {

    private final List<Primitive<? super I, ? extends O>> branches;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    public SettledParallelPrimitive(List<? extends Primitive<? super I, ? extends O>> branches) {
        this(branches, Executors.newCachedThreadPool(new NamedDaemonThreadFactory("primitives-settled")), true);
    }

    public SettledParallelPrimitive(List<? extends Primitive<? super I, ? extends O>> branches, ExecutorService executor) {
        this(branches, executor, false);
    }

    private SettledParallelPrimitive(
        List<? extends Primitive<? super I, ? extends O>> branches,
        ExecutorService executor,
        boolean ownsExecutor
    ) {
        this.branches = ParallelPrimitive.validateBranches(branches, "SettledParallelPrimitive");
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * 모든 분기를 실행하고 결과를 수집합니다.
     *
     * @throws InterruptedException 대기 중 호출 스레드가 인터럽트된 경우 (남은 분기는 취소됨)
     */
    @Override
    public List<BranchOutcome<O>> execute(I input, Context context) throws InterruptedException {
        List<Future<O>> futures = new ArrayList<>(branches.size());
        try {
            for (Primitive<? super I, ? extends O> branch : branches) {
                Context child = context.createChild();
                futures.add(executor.<O>submit(() -> branch.execute(input, child)));
            }

            List<BranchOutcome<O>> outcomes = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(i, futures.get(i)));
            }
            return Collections.unmodifiableList(outcomes);
        } catch (InterruptedException | RuntimeException e) {
            ExecutionFailures.cancelAll(futures);
            throw e;
        }
    }

    private BranchOutcome<O> await(int index, Future<O> future) throws InterruptedException {
        try {
            return new Succeeded<>(index, future.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return new Failed<>(index, cause);
        }
    }

    public List<Primitive<? super I, ? extends O>> branches() {
        return branches;
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }
}

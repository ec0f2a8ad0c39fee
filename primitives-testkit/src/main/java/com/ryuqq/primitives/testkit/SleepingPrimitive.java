package com.ryuqq.primitives.testkit;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.context.Context;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 지정 시간 동안 대기한 뒤 값을 반환하는 테스트용 Primitive.
 *
 * <p>대기 중 인터럽트되면 {@link #wasInterrupted()}가 true가 되고 {@link InterruptedException}을 던집니다.</p>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SleepingPrimitive<I, O> implements Primitive<I, O> {

    private final String name;
    private final Duration delay;
    private final O result;
    private final AtomicBoolean interrupted = new AtomicBoolean();
    private final CountDownLatch started = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);

    public SleepingPrimitive(String name, Duration delay, O result) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be null or negative");
        }
        this.name = name;
        this.delay = delay;
        this.result = result;
    }

    @Override
    public O execute(I input, Context context) throws Exception {
        started.countDown();
        try {
            Thread.sleep(delay.toMillis());
            return result;
        } catch (InterruptedException e) {
            interrupted.set(true);
            throw e;
        } finally {
            finished.countDown();
        }
    }

    @Override
    public String name() {
        return name;
    }

    public boolean wasInterrupted() {
        return interrupted.get();
    }

    /**
     * 실행이 끝날 때까지 최대 timeout 동안 대기.
     *
     * @return 시간 안에 끝났는지 여부
     */
    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean awaitStarted(Duration timeout) throws InterruptedException {
        return started.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}

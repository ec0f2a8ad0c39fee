package com.ryuqq.primitives.recovery.timeout;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.error.ExecutionTimeoutException;
import com.ryuqq.primitives.core.instrumentation.InstrumentationSink;
import com.ryuqq.primitives.core.instrumentation.SafeInstrumentationSink;
import com.ryuqq.primitives.core.instrumentation.noop.NoOpInstrumentationSink;
import com.ryuqq.primitives.core.support.ExecutionFailures;
import com.ryuqq.primitives.core.support.NamedDaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 실행 시간 제한 데코레이터.
 *
 * <p>감싼 Primitive를 별도 스레드에서 실행하고 제한 시간 안에 끝나지 않으면 실행을 포기합니다.</p>
 *
 * <p><strong>시간 초과 시 동작:</strong></p>
 * <ol>
 *   <li>진행 중인 작업을 취소 (interruptOnTimeout=true면 인터럽트)</li>
 *   <li>fallback이 있으면 fallback 실행 결과 반환</li>
 *   <li>없으면 {@link ExecutionTimeoutException}</li>
 * </ol>
 *
 * <p><strong>Soft timeout:</strong> 인터럽트에 반응하지 않는 작업(블로킹 I/O 등)은 백그라운드에서 계속 실행될 수 있으며,
 * 그 늦은 결과는 버려집니다. 이때 작업과 호출자가 같은 Context를 공유하므로
 * 늦게 끝난 작업의 Context 변경이 보일 수 있습니다.</p>
 *
 * <p><strong>대체 경로 패턴:</strong></p>
 * <pre>{@code
 * Primitive<Query, Answer> answer = new FallbackPrimitive<>(
 *     new TimeoutPrimitive<>(slowModel, TimeoutConfig.of(Duration.ofSeconds(2))),
 *     List.of(fastModel)
 * );
 * }</pre>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TimeoutPrimitive<I, O> implements Primitive<I, O>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimeoutPrimitive.class);

    private final Primitive<I, O> delegate;
    private final TimeoutConfig config;
    private final Primitive<? super I, ? extends O> fallback;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final InstrumentationSink sink;

    public TimeoutPrimitive(Primitive<I, O> delegate, TimeoutConfig config) {
        this(delegate, config, null);
    }

    /**
     * 시간 초과 시 fallback을 실행하는 TimeoutPrimitive 생성.
     *
     * @param fallback 시간 초과 시 실행할 Primitive (null이면 예외)
     */
    public TimeoutPrimitive(Primitive<I, O> delegate, TimeoutConfig config, Primitive<? super I, ? extends O> fallback) {
        this(delegate, config, fallback,
            Executors.newCachedThreadPool(new NamedDaemonThreadFactory("primitives-timeout")), true,
            NoOpInstrumentationSink.INSTANCE);
    }

    /**
     * 외부 executor를 사용하는 TimeoutPrimitive 생성 (executor 종료는 호출자 책임).
     *
     * @param delegate 감쌀 Primitive
     * @param config 시간 제한 설정
     * @param fallback 시간 초과 시 실행할 Primitive (null 가능)
     * @param executor 감싼 Primitive를 실행할 executor
     * @param sink 계측 sink
     * @throws IllegalArgumentException 필수 인자가 null인 경우
     */
    public TimeoutPrimitive(
        Primitive<I, O> delegate,
        TimeoutConfig config,
        Primitive<? super I, ? extends O> fallback,
        ExecutorService executor,
        InstrumentationSink sink
    ) {
        this(delegate, config, fallback, executor, false, sink);
    }

    private TimeoutPrimitive(
        Primitive<I, O> delegate,
        TimeoutConfig config,
        Primitive<? super I, ? extends O> fallback,
        ExecutorService executor,
        boolean ownsExecutor,
        InstrumentationSink sink
    ) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.delegate = delegate;
        this.config = config;
        this.fallback = fallback;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.sink = SafeInstrumentationSink.wrap(sink);
    }

    /**
     * 시간 초과 시 고정 값을 반환하는 TimeoutPrimitive 생성.
     */
    public static <I, O> TimeoutPrimitive<I, O> withDefaultValue(Primitive<I, O> delegate, TimeoutConfig config, O value) {
        return new TimeoutPrimitive<I, O>(delegate, config, (input, context) -> value);
    }

    @Override
    public O execute(I input, Context context) throws Exception {
        Future<O> future = executor.submit(() -> delegate.execute(input, context));
        try {
            return future.get(config.timeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw ExecutionFailures.unwrap(e);
        } catch (TimeoutException e) {
            future.cancel(config.interruptOnTimeout());
            return onTimeout(input, context);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private O onTimeout(I input, Context context) throws Exception {
        long timeoutMs = config.timeout().toMillis();
        sink.event(name(), "timeout", context, Map.of(
            "timeoutMs", String.valueOf(timeoutMs),
            "fallback", String.valueOf(fallback != null)
        ));
        if (fallback == null) {
            log.warn("{} timed out after {}ms", delegate.name(), timeoutMs);
            throw new ExecutionTimeoutException(delegate.name(), config.timeout());
        }
        log.warn("{} timed out after {}ms, running fallback {}", delegate.name(), timeoutMs, fallback.name());
        return fallback.execute(input, context);
    }

    @Override
    public String name() {
        return "timeout(" + delegate.name() + ")";
    }

    public TimeoutConfig config() {
        return config;
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
}

package com.ryuqq.primitives.recovery.fallback;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.error.ConfigurationException;
import com.ryuqq.primitives.core.instrumentation.InstrumentationSink;
import com.ryuqq.primitives.core.instrumentation.SafeInstrumentationSink;
import com.ryuqq.primitives.core.instrumentation.noop.NoOpInstrumentationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 대체 경로 데코레이터.
 *
 * <p>primary가 예외를 던지면 fallback을 순서대로 시도하고, 처음 성공한 결과를 반환합니다.
 * primary가 정상 반환한 값은 (null 포함) 그대로 결과가 됩니다.</p>
 *
 * <p><strong>모두 실패한 경우:</strong> 마지막 fallback의 예외를 다시 던지며,
 * 앞선 실패(primary와 이전 fallback)는 suppressed로 붙습니다.</p>
 *
 * <p>결과를 만든 경로는 Context metadata {@code fallback.used}에 기록됩니다
 * ({@code primary} 또는 fallback 이름).</p>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FallbackPrimitive<I, O> implements Primitive<I, O> {

    private static final Logger log = LoggerFactory.getLogger(FallbackPrimitive.class);

    /**
     * 결과를 만든 경로가 기록되는 metadata 키.
     */
    public static final String USED_METADATA_KEY = "fallback.used";

    private final Primitive<? super I, ? extends O> primary;
    private final List<Primitive<? super I, ? extends O>> fallbacks;
    private final InstrumentationSink sink;

    public FallbackPrimitive(
        Primitive<? super I, ? extends O> primary,
        List<? extends Primitive<? super I, ? extends O>> fallbacks
    ) {
        this(primary, fallbacks, NoOpInstrumentationSink.INSTANCE);
    }

    /**
     * 생성자.
     *
     * @param primary 우선 실행할 Primitive
     * @param fallbacks 대체 경로 (순서대로 시도)
     * @param sink 계측 sink
     * @throws IllegalArgumentException 인자가 null이거나 fallbacks에 null이 있는 경우
     * @throws ConfigurationException fallbacks가 비어 있는 경우
     */
    public FallbackPrimitive(
        Primitive<? super I, ? extends O> primary,
        List<? extends Primitive<? super I, ? extends O>> fallbacks,
        InstrumentationSink sink
    ) {
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
        if (fallbacks == null) {
            throw new IllegalArgumentException("fallbacks cannot be null");
        }
        if (fallbacks.isEmpty()) {
            throw new ConfigurationException("FallbackPrimitive requires at least one fallback");
        }
        for (Primitive<? super I, ? extends O> fallback : fallbacks) {
            if (fallback == null) {
                throw new IllegalArgumentException("fallbacks cannot contain null");
            }
        }
        this.primary = primary;
        this.fallbacks = List.<Primitive<? super I, ? extends O>>copyOf(fallbacks);
        this.sink = SafeInstrumentationSink.wrap(sink);
    }

    @Override
    public O execute(I input, Context context) throws Exception {
        O result;
        try {
            result = primary.execute(input, context);
        } catch (Exception primaryFailure) {
            return runFallbacks(input, context, primaryFailure);
        }
        context.metadata().put(USED_METADATA_KEY, "primary");
        return result;
    }

    private O runFallbacks(I input, Context context, Exception primaryFailure) throws Exception {
        List<Exception> failures = new ArrayList<>();
        failures.add(primaryFailure);
        log.debug("{} failed ({}), trying {} fallback(s)", primary.name(), primaryFailure.toString(), fallbacks.size());

        for (int i = 0; i < fallbacks.size(); i++) {
            Primitive<? super I, ? extends O> fallback = fallbacks.get(i);
            sink.event(name(), "fallback.triggered", context, Map.of(
                "index", String.valueOf(i),
                "fallback", fallback.name(),
                "cause", failures.get(failures.size() - 1).getClass().getSimpleName()
            ));
            try {
                O result = fallback.execute(input, context);
                context.metadata().put(USED_METADATA_KEY, fallback.name());
                log.info("{} recovered by fallback {} (index {})", primary.name(), fallback.name(), i);
                return result;
            } catch (Exception e) {
                failures.add(e);
            }
        }

        Exception last = failures.remove(failures.size() - 1);
        for (Exception earlier : failures) {
            if (earlier != last) {
                last.addSuppressed(earlier);
            }
        }
        log.warn("{} and all {} fallback(s) failed: {}", primary.name(), fallbacks.size(), last.toString());
        throw last;
    }

    @Override
    public String name() {
        return "fallback(" + primary.name() + ")";
    }

    public List<Primitive<? super I, ? extends O>> fallbacks() {
        return fallbacks;
    }
}

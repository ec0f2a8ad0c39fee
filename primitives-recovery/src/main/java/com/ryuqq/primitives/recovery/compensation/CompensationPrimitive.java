package com.ryuqq.primitives.recovery.compensation;

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
import java.util.stream.Collectors;

/**
 * 보상(Saga) 데코레이터.
 *
 * <p>forward 단계를 순차 실행하고(출력이 다음 단계의 입력), 중간 단계가 실패하면
 * 이미 성공한 단계의 보상 작업을 역순으로 실행한 뒤 원래 예외를 그대로 다시 던집니다.</p>
 *
 * <p><strong>보상 규칙:</strong></p>
 * <ul>
 *   <li>실패한 단계 자신은 보상하지 않음</li>
 *   <li>보상 작업의 실패(Error 포함)는 WARN 로그와 {@link CompensationReport}에 기록되고, 나머지 보상은 계속 실행</li>
 *   <li>실패 시 Context state의 {@link #REPORT_KEY}에 보고서 저장</li>
 * </ul>
 *
 * <pre>{@code
 * CompensationPrimitive<Order, Receipt> checkout = CompensationPrimitive.<Order>builder()
 *     .step("reserve", reserveStock, (order, reservation, ctx) -> releaseStock(reservation))
 *     .step("charge", chargeCard, (reservation, payment, ctx) -> refund(payment))
 *     .step("ship", shipOrder)
 *     .build();
 * }</pre>
 *
 * @param <I> 첫 단계 입력 타입
 * @param <O> 마지막 단계 출력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CompensationPrimitive<I, O> implements Primitive<I, O> {

    private static final Logger log = LoggerFactory.getLogger(CompensationPrimitive.class);

    /**
     * 실패 시 보상 보고서가 저장되는 Context state 키.
     */
    public static final String REPORT_KEY = "compensation.report";

    private final String name;
    private final List<Step> steps;
    private final InstrumentationSink sink;

    private CompensationPrimitive(String name, List<Step> steps, InstrumentationSink sink) {
        this.name = name;
        this.steps = List.copyOf(steps);
        this.sink = SafeInstrumentationSink.wrap(sink);
    }

    public static <I> Builder<I, I> builder() {
        return new Builder<>("compensation", List.of(), NoOpInstrumentationSink.INSTANCE);
    }

    @Override
    @SuppressWarnings("unchecked")
    public O execute(I input, Context context) throws Exception {
        List<Completed> completed = new ArrayList<>(steps.size());
        Object current = input;
        for (Step step : steps) {
            try {
                Object output = step.forward().execute(current, context);
                completed.add(new Completed(step, current, output));
                current = output;
            } catch (Exception e) {
                CompensationReport report = compensate(completed, step.name(), e, context);
                context.state().put(REPORT_KEY, report);
                throw e;
            }
        }
        return (O) current;
    }

    private CompensationReport compensate(List<Completed> completed, String failedStep, Exception cause, Context context) {
        log.warn("{} step {} failed ({}), compensating {} completed step(s)",
            name, failedStep, cause.toString(), completed.size());
        sink.event(name, "compensation.started", context, Map.of(
            "failedStep", failedStep,
            "steps", String.valueOf(completed.size())
        ));

        List<String> compensated = new ArrayList<>();
        List<CompensationReport.CompensationFailure> failures = new ArrayList<>();
        for (int i = completed.size() - 1; i >= 0; i--) {
            Completed done = completed.get(i);
            String stepName = done.step().name();
            try {
                done.step().compensator().compensate(done.input(), done.output(), context);
                compensated.add(stepName);
            } catch (Exception | Error e) {
                log.warn("{} compensation of step {} failed", name, stepName, e);
                sink.event(name, "compensation.failed", context, Map.of(
                    "step", stepName,
                    "error", e.getClass().getSimpleName()
                ));
                failures.add(new CompensationReport.CompensationFailure(stepName, e));
            }
        }
        return new CompensationReport(failedStep, cause, compensated, failures);
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * 단계 이름 목록 (실행 순서).
     */
    public List<String> stepNames() {
        return steps.stream().map(Step::name).collect(Collectors.toUnmodifiableList());
    }

    private record Step(String name, Primitive<Object, Object> forward, Compensator<Object, Object> compensator) {
    }

    private record Completed(Step step, Object input, Object output) {
    }

    /**
     * 타입 안전한 단계 연결 Builder.
     *
     * <p>불변입니다. 각 메서드는 새 Builder를 반환하므로 같은 Builder에서 여러 흐름을 갈라 만들 수 있습니다.</p>
     *
     * @param <I> 첫 단계 입력 타입
     * @param <C> 현재까지 마지막 단계의 출력 타입
     */
    public static final class Builder<I, C> {

        private final String name;
        private final List<Step> steps;
        private final InstrumentationSink sink;

        private Builder(String name, List<Step> steps, InstrumentationSink sink) {
            this.name = name;
            this.steps = steps;
            this.sink = sink;
        }

        public Builder<I, C> name(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            return new Builder<>(name, steps, sink);
        }

        public Builder<I, C> sink(InstrumentationSink sink) {
            if (sink == null) {
                throw new IllegalArgumentException("sink cannot be null");
            }
            return new Builder<>(name, steps, sink);
        }

        /**
         * 보상 작업이 있는 단계 추가.
         *
         * @param stepName 단계 이름
         * @param forward 단계 작업 (이전 단계의 출력을 입력으로 받음)
         * @param compensator 보상 작업
         * @throws IllegalArgumentException 인자가 null인 경우
         */
        @SuppressWarnings("unchecked")
        public <N> Builder<I, N> step(
            String stepName,
            Primitive<? super C, ? extends N> forward,
            Compensator<? super C, ? super N> compensator
        ) {
            if (stepName == null || stepName.isBlank()) {
                throw new IllegalArgumentException("stepName cannot be null or blank");
            }
            if (forward == null) {
                throw new IllegalArgumentException("forward cannot be null");
            }
            if (compensator == null) {
                throw new IllegalArgumentException("compensator cannot be null");
            }
            List<Step> extended = new ArrayList<>(steps);
            extended.add(new Step(
                stepName,
                (Primitive<Object, Object>) forward,
                (Compensator<Object, Object>) compensator
            ));
            return new Builder<>(name, List.copyOf(extended), sink);
        }

        /**
         * 되돌릴 것이 없는 단계 추가.
         */
        public <N> Builder<I, N> step(String stepName, Primitive<? super C, ? extends N> forward) {
            return step(stepName, forward, Compensator.none());
        }

        /**
         * @throws ConfigurationException 단계가 없는 경우
         */
        public CompensationPrimitive<I, C> build() {
            if (steps.isEmpty()) {
                throw new ConfigurationException("CompensationPrimitive requires at least one step");
            }
            return new CompensationPrimitive<>(name, steps, sink);
        }
    }
}

/**
 * Micrometer 계측 어댑터.
 *
 * <p>{@link com.ryuqq.primitives.core.instrumentation.InstrumentationSink}를
 * Micrometer {@code MeterRegistry}에 연결합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.adapter.micrometer;

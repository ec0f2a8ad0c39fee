package com.ryuqq.primitives.core.instrumentation;

import com.ryuqq.primitives.core.context.Context;

import java.time.Instant;

/**
 * 계측 대상 실행 구간 (span) 정보.
 *
 * @param primitiveName Primitive 이름
 * @param correlationId 상관관계 ID
 * @param traceId 추적 ID (null 가능)
 * @param spanId 구간 ID
 * @param parentSpanId 부모 구간 ID (null 가능)
 * @param startedAt 시작 시각
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SpanRecord(
    String primitiveName,
    String correlationId,
    String traceId,
    String spanId,
    String parentSpanId,
    Instant startedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public SpanRecord {
        if (primitiveName == null) {
            throw new IllegalArgumentException("primitiveName cannot be null");
        }
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
    }

    /**
     * Context의 추적 정보로 SpanRecord 생성.
     *
     * @param primitiveName Primitive 이름
     * @param context 실행 컨텍스트
     * @return 현재 시각에 시작한 SpanRecord
     */
    public static SpanRecord start(String primitiveName, Context context) {
        return new SpanRecord(
            primitiveName,
            context.correlationId(),
            context.traceId().orElse(null),
            context.spanId(),
            context.parentSpanId().orElse(null),
            context.clock().instant()
        );
    }
}

/**
 * 실행 컨텍스트 패키지.
 *
 * <p>루트 호출 하나에 대해 생성되어 Primitive 트리를 따라 전파되는
 * {@link com.ryuqq.primitives.core.context.Context}와 체크포인트 모델을 제공합니다.</p>
 *
 * <p><strong>전파 규칙:</strong></p>
 * <pre>
 * Root Context (correlationId=C, spanId=S0)
 *   │
 *   ├─ Sequential 단계: 같은 인스턴스 공유
 *   │
 *   └─ Parallel 분기: createChild()
 *        correlationId=C, parentSpanId=S0, spanId=S1, causationId=C
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.core.context;

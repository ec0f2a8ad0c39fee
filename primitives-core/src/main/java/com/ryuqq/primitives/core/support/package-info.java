/**
 * 내부 지원 유틸리티.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.primitives.core.support;

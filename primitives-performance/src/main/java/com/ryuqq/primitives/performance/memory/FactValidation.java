package com.ryuqq.primitives.performance.memory;

/**
 * 검증 결과.
 *
 * <p>검증은 예외를 던지지 않고 항상 이 결과를 반환합니다. 위반은 외부 도구가 판단할 신호입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param key 검증한 키
 * @param valid 통과 여부
 * @param expected 기대 값 설명 (알 수 없으면 null)
 * @param actual 실제 값
 * @param message 위반 사유 (통과 시 null)
 * @param severity 심각도
 */
public record FactValidation(
    String key,
    boolean valid,
    String expected,
    Object actual,
    String message,
    Severity severity
) {

    public static FactValidation passed(String key, String expected, Object actual) {
        return new FactValidation(key, true, expected, actual, null, Severity.INFO);
    }

    public static FactValidation failed(String key, String expected, Object actual, String message, Severity severity) {
        return new FactValidation(key, false, expected, actual, message, severity);
    }
}

package com.ryuqq.primitives.performance.memory;

import java.util.Locale;

/**
 * 작업 흐름 모드. 단계별로 불러오는 메모리의 폭을 정합니다.
 *
 * <ul>
 *   <li>RAPID: 현재 세션의 최근 메시지 정도만</li>
 *   <li>STANDARD: 세션, 최근 1시간, 일부 장기 기억과 사실</li>
 *   <li>RIGOROUS: 최근 24시간과 넓은 장기 기억 검색까지</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WorkflowMode {

    RAPID("rapid"),
    STANDARD("standard"),
    RIGOROUS("augster-rigorous");

    private final String value;

    WorkflowMode(String value) {
        this.value = value;
    }

    /**
     * 외부 표기 (예: "augster-rigorous").
     */
    public String value() {
        return value;
    }

    /**
     * 외부 표기 또는 상수 이름으로 모드 조회.
     *
     * @param value "rapid", "standard", "augster-rigorous" 또는 상수 이름 (대소문자 무시)
     * @return 모드
     * @throws IllegalArgumentException null이거나 알 수 없는 값인 경우
     */
    public static WorkflowMode of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("mode cannot be null or blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (WorkflowMode mode : values()) {
            if (mode.value.equals(normalized) || mode.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown workflow mode: " + value);
    }
}

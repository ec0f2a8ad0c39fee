package com.ryuqq.primitives.performance.memory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StageLoadPlan, WorkflowStage, WorkflowMode 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("StageLoadPlan 테스트")
class StageLoadPlanTest {

    @Test
    @DisplayName("PLAN 단계는 RIGOROUS에서만 장기 기억을 10개까지 불러온다")
    void PLAN_모드별() {
        // when
        StageLoadPlan rapid = StageLoadPlan.of(WorkflowStage.PLAN, WorkflowMode.RAPID);
        StageLoadPlan standard = StageLoadPlan.of(WorkflowStage.PLAN, WorkflowMode.STANDARD);
        StageLoadPlan rigorous = StageLoadPlan.of(WorkflowStage.PLAN, WorkflowMode.RIGOROUS);

        // then
        assertThat(rapid.historyLimit()).isEqualTo(5);
        assertThat(rapid.loadsRecent()).isFalse();
        assertThat(rapid.includeFacts()).isFalse();
        assertThat(standard.recentWindow()).isEqualTo(Duration.ofHours(1));
        assertThat(standard.loadsDeep()).isFalse();
        assertThat(rigorous.deepLimit()).isEqualTo(10);
        assertThat(rigorous.includeFacts()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = WorkflowMode.class, names = {"RAPID", "STANDARD"})
    @DisplayName("REFLECT 단계는 RIGOROUS가 아니면 아무것도 불러오지 않는다")
    void REFLECT_RIGOROUS_전용(WorkflowMode mode) {
        assertThat(StageLoadPlan.of(WorkflowStage.REFLECT, mode).isEmpty()).isTrue();
        assertThat(StageLoadPlan.of(WorkflowStage.REFLECT, WorkflowMode.RIGOROUS).historyLimit())
            .isEqualTo(StageLoadPlan.ALL_HISTORY);
    }

    @ParameterizedTest
    @EnumSource(WorkflowStage.class)
    @DisplayName("모든 단계와 모드 조합에 계획이 있다")
    void 모든_조합(WorkflowStage stage) {
        for (WorkflowMode mode : WorkflowMode.values()) {
            assertThat(StageLoadPlan.of(stage, mode)).isNotNull();
        }
    }

    @Test
    @DisplayName("모드는 외부 표기와 상수 이름 모두로 찾을 수 있다")
    void 모드_조회() {
        assertThat(WorkflowMode.of("augster-rigorous")).isEqualTo(WorkflowMode.RIGOROUS);
        assertThat(WorkflowMode.of("Rigorous")).isEqualTo(WorkflowMode.RIGOROUS);
        assertThat(WorkflowMode.of(" rapid ")).isEqualTo(WorkflowMode.RAPID);
        assertThat(WorkflowMode.STANDARD.value()).isEqualTo("standard");
        assertThatThrownBy(() -> WorkflowMode.of("careless"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("careless");
    }

    @Test
    @DisplayName("단계는 대소문자 구분 없이 찾을 수 있다")
    void 단계_조회() {
        assertThat(WorkflowStage.of("understand")).isEqualTo(WorkflowStage.UNDERSTAND);
        assertThat(WorkflowStage.of("Validate")).isEqualTo(WorkflowStage.VALIDATE);
        assertThatThrownBy(() -> WorkflowStage.of("deploy"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("deploy");
        assertThatThrownBy(() -> WorkflowStage.of(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("잘못된 계획 값은 거부된다")
    void 계획_검증() {
        assertThatThrownBy(() -> new StageLoadPlan(-1, null, 0, null, false))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("historyLimit");
        assertThatThrownBy(() -> new StageLoadPlan(0, Duration.ZERO, 0, null, false))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StageLoadPlan.of(null, WorkflowMode.RAPID))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

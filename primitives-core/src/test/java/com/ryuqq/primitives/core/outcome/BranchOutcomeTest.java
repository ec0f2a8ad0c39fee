package com.ryuqq.primitives.core.outcome;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BranchOutcome 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("BranchOutcome 테스트")
class BranchOutcomeTest {

    @Test
    @DisplayName("Succeeded는 isSucceeded, Failed는 isFailed")
    void 분류() {
        BranchOutcome<String> ok = new Succeeded<>(0, "v");
        BranchOutcome<String> failed = new Failed<>(1, new IllegalStateException());

        assertThat(ok.isSucceeded()).isTrue();
        assertThat(ok.isFailed()).isFalse();
        assertThat(failed.isFailed()).isTrue();
        assertThat(failed.index()).isEqualTo(1);
    }

    @Test
    @DisplayName("Failed는 error가 필요하다")
    void Failed_error_필수() {
        assertThatThrownBy(() -> new Failed<String>(0, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("error cannot be null");
    }

    @Test
    @DisplayName("음수 index는 거부된다")
    void 음수_index() {
        assertThatThrownBy(() -> new Succeeded<>(-1, "v"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

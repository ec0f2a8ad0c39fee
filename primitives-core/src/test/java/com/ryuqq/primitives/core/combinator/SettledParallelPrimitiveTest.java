package com.ryuqq.primitives.core.combinator;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.Primitives;
import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.outcome.BranchOutcome;
import com.ryuqq.primitives.core.outcome.Failed;
import com.ryuqq.primitives.core.outcome.Succeeded;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SettledParallelPrimitive 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("SettledParallelPrimitive 테스트")
class SettledParallelPrimitiveTest {

    @Test
    @DisplayName("실패한 분기가 있어도 모든 분기 결과를 순서대로 반환한다")
    void 모든_결과_수집() throws Exception {
        // given
        AtomicBoolean slowCompleted = new AtomicBoolean();
        Primitive<String, String> ok = Primitives.function("ok", s -> s + "!");
        Primitive<String, String> failing = Primitives.lambda("failing", (in, ctx) -> {
            throw new IOException("io");
        });
        Primitive<String, String> slow = Primitives.lambda("slow", (in, ctx) -> {
            Thread.sleep(100);
            slowCompleted.set(true);
            return "slow";
        });

        try (SettledParallelPrimitive<String, String> settled =
                 new SettledParallelPrimitive<>(List.of(ok, failing, slow))) {
            // when
            List<BranchOutcome<String>> outcomes = settled.execute("x", Context.create());

            // then
            assertThat(outcomes).hasSize(3);
            assertThat(outcomes.get(0)).isEqualTo(new Succeeded<>(0, "x!"));
            assertThat(outcomes.get(1).isFailed()).isTrue();
            assertThat(((Failed<String>) outcomes.get(1)).error()).isInstanceOf(IOException.class).hasMessage("io");
            assertThat(outcomes.get(2)).isEqualTo(new Succeeded<>(2, "slow"));
            assertThat(slowCompleted).isTrue();
        }
    }
}

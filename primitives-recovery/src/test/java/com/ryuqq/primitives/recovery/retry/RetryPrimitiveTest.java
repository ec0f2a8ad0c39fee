package com.ryuqq.primitives.recovery.retry;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.error.RetryExhaustedException;
import com.ryuqq.primitives.core.error.ValidationException;
import com.ryuqq.primitives.recovery.retry.backoff.BackoffStrategy;
import com.ryuqq.primitives.testkit.FailingPrimitive;
import com.ryuqq.primitives.testkit.RecordingInstrumentationSink;
import com.ryuqq.primitives.testkit.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * RetryPrimitive 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("RetryPrimitive 테스트")
class RetryPrimitiveTest {

    private RecordingSleeper sleeper;
    private RecordingInstrumentationSink sink;
    private RetryConfig config;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        sink = new RecordingInstrumentationSink();
        config = new RetryConfig(3, BackoffStrategy.exponential(Duration.ofMillis(100), Duration.ofSeconds(10), 0.0));
    }

    @Test
    @DisplayName("두 번 실패 후 성공하면 결과를 반환하고 backoff만큼 두 번 대기한다")
    void 실패_후_성공() throws Exception {
        // given
        FailingPrimitive<String, String> flaky = FailingPrimitive.failingTimes(2, () -> new IOException("io"), "ok");
        RetryPrimitive<String, String> retry = retry(flaky);

        // when
        String result = retry.execute("x", Context.create());

        // then
        assertThat(result).isEqualTo("ok");
        assertThat(flaky.attempts()).isEqualTo(3);
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
        assertThat(sink.events("retry.attempt")).hasSize(2);
    }

    @ParameterizedTest(name = "maxRetries={0}")
    @ValueSource(ints = {0, 1, 3, 5})
    @DisplayName("항상 실패하면 maxRetries + 1번 시도 후 원래 예외를 다시 던진다")
    void 재시도_종료(int maxRetries) {
        // given
        FailingPrimitive<String, String> failing = FailingPrimitive.alwaysFailing("fetch", () -> new IOException("down"));
        RetryPrimitive<String, String> retry = new RetryPrimitive<>(
            failing, config.withMaxRetries(maxRetries), RetryPredicates.defaultPolicy(), sleeper, sink
        );

        // when
        Throwable thrown = catchThrowable(() -> retry.execute("x", Context.create()));

        // then
        assertThat(thrown).isInstanceOf(IOException.class).hasMessage("down");
        assertThat(failing.attempts()).isEqualTo(maxRetries + 1);
        assertThat(RetryExhaustedException.attemptsOf(thrown)).hasValue(maxRetries + 1);
        assertThat(sleeper.sleeps()).hasSize(maxRetries);
        assertThat(sink.events("retry.exhausted")).hasSize(1);
    }

    @Test
    @DisplayName("NonRetryable 예외는 재시도하지 않는다")
    void NonRetryable_즉시_중단() {
        // given
        FailingPrimitive<String, String> invalid =
            FailingPrimitive.alwaysFailing("validate", () -> new ValidationException("bad input"));
        RetryPrimitive<String, String> retry = retry(invalid);

        // when & then
        assertThatThrownBy(() -> retry.execute("x", Context.create()))
            .isInstanceOf(ValidationException.class);
        assertThat(invalid.attempts()).isEqualTo(1);
        assertThat(sleeper.sleeps()).isEmpty();
        assertThat(sink.events("retry.aborted")).hasSize(1);
    }

    @Test
    @DisplayName("onlyOn 조건에 맞지 않는 예외는 재시도하지 않는다")
    void onlyOn_조건() {
        // given
        FailingPrimitive<String, String> failing =
            FailingPrimitive.alwaysFailing("state", () -> new IllegalStateException("nope"));
        RetryPrimitive<String, String> retry = new RetryPrimitive<>(
            failing, config, RetryPredicates.onlyOn(IOException.class), sleeper, sink
        );

        // when & then
        assertThatThrownBy(() -> retry.execute("x", Context.create())).isInstanceOf(IllegalStateException.class);
        assertThat(failing.attempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("성공하면 대기 없이 한 번만 실행한다")
    void 첫_시도_성공() throws Exception {
        // given
        Primitive<String, String> upper = (in, ctx) -> in.toUpperCase();

        // when
        String result = retry(upper).execute("abc", Context.create());

        // then
        assertThat(result).isEqualTo("ABC");
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    @DisplayName("음수 maxRetries는 IllegalArgumentException")
    void 설정_검증() {
        assertThatThrownBy(() -> new RetryConfig(-1, BackoffStrategy.none()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxRetries");
    }

    private RetryPrimitive<String, String> retry(Primitive<String, String> delegate) {
        return new RetryPrimitive<>(delegate, config, RetryPredicates.defaultPolicy(), sleeper, sink);
    }
}

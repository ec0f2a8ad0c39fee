package com.ryuqq.primitives.recovery.timeout;

import com.ryuqq.primitives.core.Primitive;
import com.ryuqq.primitives.core.context.Context;
import com.ryuqq.primitives.core.error.ExecutionTimeoutException;
import com.ryuqq.primitives.testkit.RecordingInstrumentationSink;
import com.ryuqq.primitives.testkit.SleepingPrimitive;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TimeoutPrimitive 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("TimeoutPrimitive 테스트")
class TimeoutPrimitiveTest {

    private ExecutorService executor;
    private RecordingInstrumentationSink sink;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        sink = new RecordingInstrumentationSink();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("제한 시간 안에 끝나면 결과를 그대로 반환한다")
    void 제한_시간_내_완료() throws Exception {
        // given
        SleepingPrimitive<String, String> fast = new SleepingPrimitive<>("fast", Duration.ofMillis(10), "done");
        TimeoutPrimitive<String, String> timeout = timeout(fast, Duration.ofSeconds(2), null);

        // when
        String result = timeout.execute("x", Context.create());

        // then
        assertThat(result).isEqualTo("done");
        assertThat(sink.events("timeout")).isEmpty();
    }

    @Test
    @DisplayName("제한 시간을 넘기면 ExecutionTimeoutException을 던지고 작업을 인터럽트한다")
    void 제한_시간_초과() throws Exception {
        // given
        SleepingPrimitive<String, String> slow = new SleepingPrimitive<>("slow", Duration.ofSeconds(10), "late");
        TimeoutPrimitive<String, String> timeout = timeout(slow, Duration.ofMillis(100), null);
        long startNanos = System.nanoTime();

        // when & then
        assertThatThrownBy(() -> timeout.execute("x", Context.create()))
            .isInstanceOfSatisfying(ExecutionTimeoutException.class, e ->
                assertThat(e.getMessage()).contains("slow"));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        assertThat(elapsedMs).isLessThan(5_000);
        assertThat(slow.awaitFinished(Duration.ofSeconds(2))).isTrue();
        assertThat(slow.wasInterrupted()).isTrue();
        assertThat(sink.events("timeout")).hasSize(1);
    }

    @Test
    @DisplayName("제한 시간을 넘기면 fallback Primitive의 결과를 반환한다")
    void 제한_시간_초과_fallback() throws Exception {
        // given
        SleepingPrimitive<String, String> slow = new SleepingPrimitive<>("slow", Duration.ofSeconds(10), "late");
        Primitive<String, String> cached = (in, ctx) -> "cached:" + in;
        TimeoutPrimitive<String, String> timeout = timeout(slow, Duration.ofMillis(50), cached);

        // when
        String result = timeout.execute("key", Context.create());

        // then
        assertThat(result).isEqualTo("cached:key");
    }

    @Test
    @DisplayName("withDefaultValue는 시간 초과 시 고정 값을 반환한다")
    void 기본값_반환() throws Exception {
        // given
        SleepingPrimitive<String, String> slow = new SleepingPrimitive<>("slow", Duration.ofSeconds(10), "late");

        // when
        String result;
        try (TimeoutPrimitive<String, String> timeout =
                 TimeoutPrimitive.withDefaultValue(slow, TimeoutConfig.of(Duration.ofMillis(50)), "default")) {
            result = timeout.execute("x", Context.create());
        }

        // then
        assertThat(result).isEqualTo("default");
    }

    @Test
    @DisplayName("작업이 던진 예외는 감싸지 않고 그대로 전파한다")
    void 작업_예외_전파() {
        // given
        Primitive<String, String> broken = (in, ctx) -> {
            throw new IOException("disk");
        };
        TimeoutPrimitive<String, String> timeout = timeout(broken, Duration.ofSeconds(1), null);

        // when & then
        assertThatThrownBy(() -> timeout.execute("x", Context.create()))
            .isInstanceOf(IOException.class)
            .hasMessage("disk");
    }

    @Test
    @DisplayName("주입받은 executor는 close해도 종료하지 않는다")
    void 주입받은_executor_유지() {
        // given
        TimeoutPrimitive<String, String> timeout = timeout((in, ctx) -> in, Duration.ofSeconds(1), null);

        // when
        timeout.close();

        // then
        assertThat(executor.isShutdown()).isFalse();
    }

    @Test
    @DisplayName("0 이하의 timeout은 IllegalArgumentException")
    void 설정_검증() {
        assertThatThrownBy(() -> TimeoutConfig.of(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TimeoutConfig.of(Duration.ofMillis(-1))).isInstanceOf(IllegalArgumentException.class);
    }

    private TimeoutPrimitive<String, String> timeout(
        Primitive<String, String> delegate,
        Duration limit,
        Primitive<String, String> fallback
    ) {
        return new TimeoutPrimitive<>(delegate, TimeoutConfig.of(limit), fallback, executor, sink);
    }
}

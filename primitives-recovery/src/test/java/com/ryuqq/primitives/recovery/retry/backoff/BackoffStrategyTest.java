package com.ryuqq.primitives.recovery.retry.backoff;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffStrategy 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("BackoffStrategy 테스트")
class BackoffStrategyTest {

    @Test
    @DisplayName("jitter가 없으면 base * 2^(retry-1)로 증가하고 maxDelay에서 멈춘다")
    void exponential_증가와_상한() {
        // given
        BackoffStrategy backoff = BackoffStrategy.exponential(Duration.ofMillis(100), Duration.ofMillis(1000), 0.0);

        // when & then
        assertThat(backoff.delayBefore(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(backoff.delayBefore(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(backoff.delayBefore(3)).isEqualTo(Duration.ofMillis(400));
        assertThat(backoff.delayBefore(5)).isEqualTo(Duration.ofMillis(1000));
        assertThat(backoff.delayBefore(200)).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    @DisplayName("jitter는 nominal 값을 중심으로 ±jitterFactor 범위에서 흔든다")
    void exponential_대칭_jitter() {
        // given
        ExponentialBackoff lowest = new ExponentialBackoff(Duration.ofSeconds(1), 2.0, Duration.ofMinutes(5), 0.1, () -> 0.0);
        ExponentialBackoff middle = new ExponentialBackoff(Duration.ofSeconds(1), 2.0, Duration.ofMinutes(5), 0.1, () -> 0.5);
        ExponentialBackoff random = new ExponentialBackoff(Duration.ofSeconds(1), 2.0, Duration.ofMinutes(5), 0.1);

        // when & then
        assertThat(lowest.delayBefore(2)).isEqualTo(Duration.ofMillis(1800));
        assertThat(middle.delayBefore(2)).isEqualTo(Duration.ofMillis(2000));
        for (int i = 0; i < 100; i++) {
            assertThat(random.delayBefore(2).toMillis()).isBetween(1800L, 2200L);
        }
    }

    @Test
    @DisplayName("상한에 도달한 뒤에는 jitter가 더해져도 maxDelay를 넘지 않는다")
    void exponential_jitter_상한() {
        // given
        ExponentialBackoff highest = new ExponentialBackoff(Duration.ofMillis(100), 2.0, Duration.ofSeconds(1), 0.5, () -> 0.999);

        // when & then
        assertThat(highest.delayBefore(10)).isEqualTo(Duration.ofSeconds(1));
        assertThat(highest.delayBefore(Integer.MAX_VALUE)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("배수를 지정하면 그 배수로 증가한다")
    void exponential_배수() {
        // given
        BackoffStrategy backoff = BackoffStrategy.exponential(Duration.ofMillis(100), 3.0, Duration.ofSeconds(10), 0.0);

        // when & then
        assertThat(backoff.delayBefore(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(backoff.delayBefore(2)).isEqualTo(Duration.ofMillis(300));
        assertThat(backoff.delayBefore(3)).isEqualTo(Duration.ofMillis(900));
    }

    @Test
    @DisplayName("잘못된 exponential 설정은 IllegalArgumentException")
    void exponential_검증() {
        assertThatThrownBy(() -> new ExponentialBackoff(Duration.ZERO, 2.0, Duration.ofMillis(100), 0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("initialDelay must be positive");
        assertThatThrownBy(() -> new ExponentialBackoff(Duration.ofMillis(100), 2.0, Duration.ofMillis(50), 0.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExponentialBackoff(Duration.ofMillis(100), 0.5, Duration.ofMillis(1000), 0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("multiplier");
        assertThatThrownBy(() -> new ExponentialBackoff(Duration.ofMillis(100), 2.0, Duration.ofMillis(1000), 1.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExponentialBackoff().delayBefore(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("linear는 step * retry로 증가하고 maxDelay에서 멈춘다")
    void linear_증가와_상한() {
        // given
        BackoffStrategy backoff = BackoffStrategy.linear(Duration.ofMillis(50), Duration.ofMillis(120));

        // when & then
        assertThat(backoff.delayBefore(1)).isEqualTo(Duration.ofMillis(50));
        assertThat(backoff.delayBefore(2)).isEqualTo(Duration.ofMillis(100));
        assertThat(backoff.delayBefore(3)).isEqualTo(Duration.ofMillis(120));
    }

    @Test
    @DisplayName("fixed는 항상 같은 간격, none은 0")
    void fixed_none() {
        assertThat(BackoffStrategy.fixed(Duration.ofMillis(30)).delayBefore(7)).isEqualTo(Duration.ofMillis(30));
        assertThat(BackoffStrategy.none().delayBefore(3)).isEqualTo(Duration.ZERO);
    }
}

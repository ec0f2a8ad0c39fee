package com.ryuqq.primitives.testkit;

import com.ryuqq.primitives.core.support.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 실제로 대기하지 않고 요청된 대기 시간을 기록하는 Sleeper.
 *
 * <p>{@link MutableClock}을 함께 주면 대기한 만큼 시계를 진행시킵니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private final MutableClock clock;

    public RecordingSleeper() {
        this(null);
    }

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
        if (clock != null) {
            clock.advance(duration);
        }
    }

    public List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }

    public Duration total() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }
}

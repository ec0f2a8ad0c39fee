package com.ryuqq.primitives.core.support;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 이름 접두사가 붙은 daemon 스레드 팩토리.
 *
 * <p>Primitive가 소유하는 기본 executor에 사용됩니다.
 * daemon 스레드이므로 종료되지 않은 executor가 JVM 종료를 막지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NamedDaemonThreadFactory implements ThreadFactory {

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger();

    /**
     * 생성자.
     *
     * @param prefix 스레드 이름 접두사 (예: primitives-parallel)
     * @throws IllegalArgumentException prefix가 비어 있는 경우
     */
    public NamedDaemonThreadFactory(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + "-" + sequence.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }
}

package com.ryuqq.retrier.adapter.runner;

import com.ryuqq.retrier.core.spi.RetryClock;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * {@link System#nanoTime()}과 {@link Thread#sleep}을 사용하는 기본 시계.
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public final class SystemRetryClock implements RetryClock {

    @Override
    public long nanoTime() {
        return System.nanoTime();
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        TimeUnit.NANOSECONDS.sleep(AttemptLoop.toNanosSaturated(duration));
    }
}

package com.ryuqq.retrier.core.spi;

import java.time.Duration;

/**
 * 시도 소요 시간 측정과 interval 대기를 위한 시계 SPI.
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public interface RetryClock {

    /**
     * 단조 증가 시각 조회 (나노초).
     *
     * @return 임의 기준점으로부터의 나노초
     */
    long nanoTime();

    /**
     * 현재 스레드를 지정 시간 동안 정지.
     *
     * @param duration 대기 시간 (0 이상)
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void sleep(Duration duration) throws InterruptedException;
}

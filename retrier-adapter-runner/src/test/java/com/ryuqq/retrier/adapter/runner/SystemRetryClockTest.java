package com.ryuqq.retrier.adapter.runner;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SystemRetryClock 테스트.
 *
 * @author Retrier Team
 * @since 1.0.0
 */
class SystemRetryClockTest {

    private final SystemRetryClock clock = new SystemRetryClock();

    @AfterEach
    void clearInterruptFlag() {
        Thread.interrupted();
    }

    @Test
    void sleep_1ms_미만도_요청한_시간_이상_대기() throws Exception {
        // given
        Duration interval = Duration.ofNanos(900_000);
        long start = clock.nanoTime();

        // when
        clock.sleep(interval);

        // then
        assertThat(clock.nanoTime() - start).isGreaterThanOrEqualTo(interval.toNanos());
    }

    @Test
    void sleep_0은_즉시_반환() throws Exception {
        long start = clock.nanoTime();

        clock.sleep(Duration.ZERO);

        assertThat(clock.nanoTime() - start).isLessThan(Duration.ofSeconds(1).toNanos());
    }

    @Test
    void sleep_나노초_범위를_넘는_Duration도_ArithmeticException_없이_대기() {
        // given: 인터럽트 상태에서는 양수 대기가 즉시 InterruptedException으로 끝남
        Thread.currentThread().interrupt();

        // when & then
        assertThatThrownBy(() -> clock.sleep(Duration.ofSeconds(Long.MAX_VALUE)))
            .isInstanceOf(InterruptedException.class);
    }

    @Test
    void toNanosSaturated_범위_초과는_Long_MAX_VALUE() {
        assertThat(AttemptLoop.toNanosSaturated(Duration.ofSeconds(Long.MAX_VALUE))).isEqualTo(Long.MAX_VALUE);
        assertThat(AttemptLoop.toNanosSaturated(Duration.ofMillis(5))).isEqualTo(5_000_000L);
    }
}

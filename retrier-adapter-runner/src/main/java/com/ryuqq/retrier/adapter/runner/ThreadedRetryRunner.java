package com.ryuqq.retrier.adapter.runner;

import com.ryuqq.retrier.application.retrier.Retrier;
import com.ryuqq.retrier.application.retrier.RetryConfig;
import com.ryuqq.retrier.core.attempt.Attempt;
import com.ryuqq.retrier.core.outcome.RetryOutcome;
import com.ryuqq.retrier.core.spi.AttemptLogSink;
import com.ryuqq.retrier.core.spi.RetryClock;

import java.time.Duration;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 스레드 기반 Retrier 구현체.
 *
 * <p>run() 호출마다 전용 스레드 하나에서 {@link AttemptLoop}를 실행하고,
 * 호출 스레드는 "결과 확정"과 "timeout 경과" 중 먼저 일어나는 쪽까지만 대기합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>입력 유효성 검증</li>
 *   <li>AttemptLoop 생성 후 전용 스레드 시작</li>
 *   <li>단일 슬롯 handoff에서 timeout 동안 대기</li>
 *   <li>결과 도착 시: Ok 또는 Failed 반환</li>
 *   <li>timeout 경과 시: 루프를 abandon 표시하고 TimedOut 반환</li>
 * </ol>
 *
 * <p><strong>알려진 제약:</strong></p>
 * <ul>
 *   <li>timeout 시점에 진행 중인 시도는 중단되지 않고 백그라운드에서 끝까지 실행됨
 *       (결과는 버려지고, 루프는 그 뒤 새 시도 없이 종료)</li>
 *   <li>기본 ThreadFactory는 daemon 스레드를 만들어, 버려진 시도가 JVM 종료를 막지 않음</li>
 * </ul>
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public final class ThreadedRetryRunner implements Retrier {

    private static final AtomicInteger THREAD_SEQUENCE = new AtomicInteger();

    private final AttemptLogSink logSink;
    private final RetryClock clock;
    private final ThreadFactory threadFactory;

    /**
     * 생성자 (SLF4J 로그, 시스템 시계, daemon 스레드).
     */
    public ThreadedRetryRunner() {
        this(new Slf4jAttemptLogSink());
    }

    /**
     * 생성자 (로그 수신자 커스터마이징).
     *
     * @param logSink 시도 실패 진단 수신자
     * @throws IllegalArgumentException logSink가 null인 경우
     */
    public ThreadedRetryRunner(AttemptLogSink logSink) {
        this(logSink, new SystemRetryClock(), ThreadedRetryRunner::newAttemptThread);
    }

    /**
     * 생성자 (모든 협력자 주입).
     *
     * @param logSink 시도 실패 진단 수신자
     * @param clock 시도 소요 시간 측정 및 interval 대기용 시계
     * @param threadFactory 시도 스레드 생성기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ThreadedRetryRunner(AttemptLogSink logSink, RetryClock clock, ThreadFactory threadFactory) {
        if (logSink == null) {
            throw new IllegalArgumentException("logSink cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (threadFactory == null) {
            throw new IllegalArgumentException("threadFactory cannot be null");
        }
        this.logSink = logSink;
        this.clock = clock;
        this.threadFactory = threadFactory;
    }

    @Override
    public RetryOutcome run(Attempt attempt, Duration timeout, Duration interval) {
        validateInput(attempt, timeout, interval);

        AttemptLoop loop = new AttemptLoop(attempt, interval, clock, logSink);
        threadFactory.newThread(loop).start();

        return awaitOutcome(loop, timeout);
    }

    /**
     * 입력 유효성 검증.
     *
     * @param attempt 시도
     * @param timeout 전체 허용 시간
     * @param interval 재시도 간격
     * @throws IllegalArgumentException 유효하지 않은 입력인 경우
     */
    private void validateInput(Attempt attempt, Duration timeout, Duration interval) {
        if (attempt == null) {
            throw new IllegalArgumentException("attempt cannot be null");
        }
        RetryConfig.requireNonNegative("timeout", timeout);
        RetryConfig.requireNonNegative("interval", interval);
    }

    /**
     * 결과 확정 또는 timeout 중 먼저 일어나는 쪽까지 대기.
     *
     * <p>InterruptedException 발생 시 루프를 abandon 표시하고, 현재 스레드의 인터럽트 플래그를
     * 복원한 뒤 RuntimeException으로 래핑하여 던집니다.</p>
     *
     * @param loop 시도 루프
     * @param timeout 전체 허용 시간
     * @return 최종 결과
     * @throws RuntimeException 대기 중 인터럽트 발생 시
     */
    private RetryOutcome awaitOutcome(AttemptLoop loop, Duration timeout) {
        try {
            RetryOutcome outcome = loop.awaitOutcome(timeout);
            if (outcome == null) {
                loop.abandon();
                return RetryOutcome.timedOut();
            }
            return outcome;
        } catch (InterruptedException e) {
            loop.abandon();
            Thread.currentThread().interrupt();
            throw new RuntimeException("Retry wait interrupted", e);
        }
    }

    private static Thread newAttemptThread(Runnable task) {
        Thread thread = new Thread(task, "retrier-attempt-" + THREAD_SEQUENCE.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }
}

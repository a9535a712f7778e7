package com.ryuqq.retrier.adapter.runner;

import com.ryuqq.retrier.core.attempt.Attempt;
import com.ryuqq.retrier.core.attempt.AttemptResult;
import com.ryuqq.retrier.core.attempt.RetriableFailure;
import com.ryuqq.retrier.core.attempt.Success;
import com.ryuqq.retrier.core.attempt.TerminalFailure;
import com.ryuqq.retrier.core.outcome.RetryOutcome;
import com.ryuqq.retrier.core.spi.AttemptLogSink;
import com.ryuqq.retrier.core.spi.RetryClock;
import com.ryuqq.retrier.core.statemachine.AttemptState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 시도 루프 (단일 실행 전용).
 *
 * <p>전용 스레드에서 Attempt를 순차적으로 실행하고, 결과가 확정되면
 * 단일 슬롯 handoff에 한 번 게시합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * while (!abandoned):
 *   ATTEMPTING: attempt.attempt()
 *     - Success          → handoff.offer(Ok), DONE
 *     - TerminalFailure  → handoff.offer(Failed), DONE
 *     - RetriableFailure → logSink.log(...)
 *   WAITING: clock.sleep(interval)
 * ABANDONED
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>handoff 용량은 1이고 {@code offer}로만 게시하므로, 호출자가 떠난 뒤에도 블로킹되지 않음</li>
 *   <li>abandon()은 진행 중인 시도를 중단하지 않으며, 다음 시도나 대기 전에만 확인됨</li>
 * </ul>
 *
 * @author Retrier Team
 * @since 1.0.0
 */
final class AttemptLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(AttemptLoop.class);

    private final Attempt attempt;
    private final Duration interval;
    private final RetryClock clock;
    private final AttemptLogSink logSink;

    private final BlockingQueue<RetryOutcome> handoff = new ArrayBlockingQueue<>(1);
    private final AtomicBoolean abandoned = new AtomicBoolean(false);
    private final AtomicInteger attemptCount = new AtomicInteger();
    private volatile AttemptState state = AttemptState.ATTEMPTING;

    AttemptLoop(Attempt attempt, Duration interval, RetryClock clock, AttemptLogSink logSink) {
        this.attempt = attempt;
        this.interval = interval;
        this.clock = clock;
        this.logSink = logSink;
    }

    @Override
    public void run() {
        while (!abandoned.get()) {
            state = AttemptState.ATTEMPTING;
            int attemptNumber = attemptCount.incrementAndGet();
            long startNanos = clock.nanoTime();

            AttemptResult result = invoke();

            if (result instanceof Success) {
                complete(RetryOutcome.ok());
                return;
            }
            if (result instanceof TerminalFailure terminal) {
                complete(RetryOutcome.failed(terminal.cause()));
                return;
            }
            RetriableFailure failure = (RetriableFailure) result;

            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(clock.nanoTime() - startNanos);
            report(formatFailure(attemptNumber, elapsedMillis, failure.cause()));

            if (abandoned.get()) {
                break;
            }
            state = AttemptState.WAITING;
            try {
                clock.sleep(interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        state = AttemptState.ABANDONED;
    }

    /**
     * Attempt 실행 (예외 및 null 결과 분류).
     *
     * <p>Attempt가 직접 던진 RuntimeException은 {@link Attempt#classify(Exception)} 규칙을 따르고,
     * null 결과는 계약 위반이므로 재시도 불가로 처리합니다.</p>
     *
     * @return 시도 결과
     */
    private AttemptResult invoke() {
        try {
            AttemptResult result = attempt.attempt();
            if (result == null) {
                return AttemptResult.terminal(new IllegalStateException("attempt returned null result"));
            }
            return result;
        } catch (RuntimeException e) {
            return Attempt.classify(e);
        }
    }

    /**
     * 시도 실패 진단 전달.
     *
     * <p>logSink 예외는 WARN으로 남기고 루프는 계속 진행합니다.</p>
     *
     * @param message 진단 메시지
     */
    private void report(String message) {
        try {
            logSink.log(message);
        } catch (RuntimeException e) {
            log.warn("AttemptLogSink failed for message: {}", message, e);
        }
    }

    private void complete(RetryOutcome outcome) {
        state = AttemptState.DONE;
        handoff.offer(outcome);
    }

    /**
     * 결과 대기 (timeout 감시).
     *
     * @param timeout 최대 대기 시간
     * @return 확정된 결과, timeout 경과 시 null
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    RetryOutcome awaitOutcome(Duration timeout) throws InterruptedException {
        return handoff.poll(toNanosSaturated(timeout), TimeUnit.NANOSECONDS);
    }

    /**
     * 호출자 이탈 표시.
     *
     * <p>진행 중인 시도는 끝까지 실행되고, 이후 새 시도나 대기 없이 루프가 종료됩니다.</p>
     */
    void abandon() {
        abandoned.set(true);
    }

    boolean isAbandoned() {
        return abandoned.get();
    }

    AttemptState state() {
        return state;
    }

    int attemptCount() {
        return attemptCount.get();
    }

    static String formatFailure(int attemptNumber, long elapsedMillis, Throwable cause) {
        return "try #" + attemptNumber + " failed (attempt took " + elapsedMillis + "ms): " + cause;
    }

    static long toNanosSaturated(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}

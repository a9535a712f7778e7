package com.ryuqq.retrier.testkit.contract;

import com.ryuqq.retrier.application.retrier.Retrier;
import com.ryuqq.retrier.core.outcome.Failed;
import com.ryuqq.retrier.core.outcome.RetryOutcome;
import com.ryuqq.retrier.core.outcome.TimedOut;
import com.ryuqq.retrier.core.signal.TerminalFailures;
import com.ryuqq.retrier.core.spi.AttemptLogSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Abstract base class for Retrier Contract Tests.
 *
 * <p>Any {@link Retrier} implementation can extend this class and supply itself through
 * {@link #createRetrier(AttemptLogSink)}. The inherited tests check the behavior every
 * implementation must share:</p>
 * <ul>
 *   <li>k failures then success within the deadline → Ok</li>
 *   <li>Ordinary failures only → TimedOut at the deadline, never Failed</li>
 *   <li>Terminal signal → Failed at once, with a cause recognised by TerminalFailures</li>
 *   <li>One log line per retried attempt, none for the final attempt</li>
 *   <li>Attempts never overlap and are spaced by at least the interval</li>
 *   <li>No further invocations once a timed-out run has settled</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyRetrierContractTest extends AbstractRetrierContractTest {
 *     {@literal @}Override
 *     protected Retrier createRetrier(AttemptLogSink logSink) {
 *         return new MyRetrier(logSink);
 *     }
 * }
 * </pre>
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public abstract class AbstractRetrierContractTest {

    protected static final Duration INTERVAL = Duration.ofMillis(100);
    protected static final Duration TIMEOUT = Duration.ofSeconds(1);

    protected RecordingLogSink logSink;
    protected Retrier retrier;

    /**
     * Creates the Retrier under test.
     *
     * @param logSink sink that must receive attempt diagnostics
     * @return the Retrier implementation
     */
    protected abstract Retrier createRetrier(AttemptLogSink logSink);

    /**
     * Sets up a fresh log sink and Retrier before each test.
     */
    @BeforeEach
    void setUp() {
        logSink = new RecordingLogSink();
        retrier = createRetrier(logSink);
    }

    /**
     * Clears recorded messages after each test.
     */
    @AfterEach
    void tearDown() {
        if (logSink != null) {
            logSink.clear();
        }
    }

    @Test
    void testFailsThreeTimesThenSucceeds_ReturnsOk() {
        // Given
        ScriptedAttempt attempt = ScriptedAttempt.failingTimes(3);
        long start = System.nanoTime();

        // When
        RetryOutcome outcome = retrier.run(attempt, TIMEOUT, INTERVAL);

        // Then
        long elapsedMs = elapsedMillisSince(start);
        assertThat(outcome).isEqualTo(RetryOutcome.ok());
        assertThat(attempt.invocationCount()).isEqualTo(4);
        assertThat(elapsedMs)
            .as("three intervals of 100ms, well under the 1s timeout")
            .isBetween(290L, 900L);
    }

    @Test
    void testAlwaysFailing_ReturnsTimedOutAtDeadline() {
        // Given
        ScriptedAttempt attempt = ScriptedAttempt.alwaysFailing();
        long start = System.nanoTime();

        // When
        RetryOutcome outcome = retrier.run(attempt, TIMEOUT, INTERVAL);

        // Then
        long elapsedMs = elapsedMillisSince(start);
        assertThat(outcome).isEqualTo(RetryOutcome.timedOut());
        assertThat(outcome).isNotInstanceOf(Failed.class);
        assertThat(elapsedMs).isBetween(950L, 1900L);
        assertThat(attempt.invocationCount()).isGreaterThan(1);
    }

    @Test
    void testTerminalSignal_ReturnsFailedImmediately() {
        // Given
        ScriptedAttempt attempt = ScriptedAttempt.terminalAfter(0, "wut");
        long start = System.nanoTime();

        // When
        RetryOutcome outcome = retrier.run(attempt, Duration.ofSeconds(5), INTERVAL);

        // Then
        long elapsedMs = elapsedMillisSince(start);
        assertThat(outcome).isInstanceOf(Failed.class);
        Failed failed = (Failed) outcome;
        assertThat(failed.cause().getMessage()).contains("wut");
        assertThat(failed.originalCause()).hasMessage("wut");
        assertThat(TerminalFailures.isTerminal(failed.cause())).isTrue();
        assertThat(elapsedMs).isLessThan(1000L);
        assertThat(attempt.invocationCount()).isEqualTo(1);
        assertThat(logSink.messages()).isEmpty();
    }

    @Test
    void testTerminalAfterRetriableFailures_LogsOnlyRetriedAttempts() {
        // Given
        ScriptedAttempt attempt = ScriptedAttempt.terminalAfter(2, "wut");

        // When
        RetryOutcome outcome = retrier.run(attempt, TIMEOUT, Duration.ofMillis(20));

        // Then
        assertThat(outcome.isFailed()).isTrue();
        List<String> messages = logSink.messages();
        assertThat(messages).hasSize(2);
        assertThat(messages).allSatisfy(message -> assertThat(message).contains("whoops").contains("ms"));
        assertThat(messages).noneSatisfy(message -> assertThat(message).contains("wut"));
    }

    @Test
    void testSuccess_DoesNotLogFinalOutcome() {
        // When
        RetryOutcome outcome = retrier.run(ScriptedAttempt.failingTimes(1), TIMEOUT, Duration.ofMillis(20));

        // Then
        assertThat(outcome.isOk()).isTrue();
        assertThat(logSink.messages()).hasSize(1);
    }

    @Test
    void testOrdinaryFailures_NeverProduceFailed() {
        // When
        RetryOutcome outcome = retrier.run(ScriptedAttempt.alwaysFailing(), Duration.ofMillis(300), Duration.ofMillis(20));

        // Then
        assertThat(outcome).isInstanceOf(TimedOut.class);
        assertThat(outcome.isFailed()).isFalse();
    }

    @Test
    void testAttempts_AreSequentialAndSpacedByInterval() {
        // Given
        Duration interval = Duration.ofMillis(40);
        ScriptedAttempt attempt = ScriptedAttempt.failingTimes(4);

        // When
        RetryOutcome outcome = retrier.run(attempt, TIMEOUT, interval);

        // Then
        assertThat(outcome.isOk()).isTrue();
        assertThat(attempt.maxConcurrentInvocations()).isEqualTo(1);
        List<Long> starts = attempt.startNanos();
        for (int i = 1; i < starts.size(); i++) {
            long gapMs = TimeUnit.NANOSECONDS.toMillis(starts.get(i) - starts.get(i - 1));
            assertThat(gapMs)
                .as("gap between attempt %d and %d", i, i + 1)
                .isGreaterThanOrEqualTo(interval.toMillis() - 5);
        }
    }

    @Test
    void testAfterTimedOut_InvocationCountSettles() {
        // Given
        Duration timeout = Duration.ofMillis(300);
        Duration interval = Duration.ofMillis(50);
        ScriptedAttempt attempt = ScriptedAttempt.alwaysFailing();

        // When
        RetryOutcome outcome = retrier.run(attempt, timeout, interval);

        // Then: let any in-flight attempt finish, then observe over a full timeout + interval
        assertThat(outcome.isTimedOut()).isTrue();
        sleep(interval.toMillis() * 3);
        int settled = attempt.invocationCount();
        sleep(timeout.toMillis() + interval.toMillis());
        assertThat(attempt.invocationCount())
            .as("abandoned attempt loop must not keep invoking the operation")
            .isEqualTo(settled);
    }

    /**
     * Milliseconds elapsed since a {@link System#nanoTime()} reading.
     *
     * @param startNanos the earlier reading
     * @return elapsed milliseconds
     */
    protected static long elapsedMillisSince(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /**
     * Sleeps for the specified duration. Used for timing-sensitive tests.
     *
     * @param millis the duration in milliseconds
     */
    protected void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Sleep interrupted", e);
        }
    }
}

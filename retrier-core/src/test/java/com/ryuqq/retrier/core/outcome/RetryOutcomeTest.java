package com.ryuqq.retrier.core.outcome;

import com.ryuqq.retrier.core.signal.TerminalFailureException;
import com.ryuqq.retrier.core.signal.TerminalFailures;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryOutcome 테스트.
 *
 * @author Retrier Team
 * @since 1.0.0
 */
class RetryOutcomeTest {

    @Test
    void timedOut_IsStructurallyEqual() {
        // Given
        RetryOutcome first = RetryOutcome.timedOut();
        RetryOutcome second = new TimedOut();

        // When & Then
        assertNotSame(first, second);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void outcomes_AreMutuallyDistinguishable() {
        // Given
        RetryOutcome ok = RetryOutcome.ok();
        RetryOutcome timedOut = RetryOutcome.timedOut();
        RetryOutcome failed = RetryOutcome.failed(TerminalFailures.mark(new IOException("wut")));

        // Then
        assertTrue(ok.isOk());
        assertFalse(ok.isTimedOut());
        assertFalse(ok.isFailed());

        assertTrue(timedOut.isTimedOut());
        assertFalse(timedOut.isOk());
        assertFalse(timedOut.isFailed());

        assertTrue(failed.isFailed());
        assertFalse(failed.isOk());
        assertFalse(failed.isTimedOut());

        assertNotEquals(ok, timedOut);
        assertNotEquals(timedOut, failed);
    }

    @Test
    void failed_ExposesTerminalCauseAndOriginalCause() {
        // Given
        IOException original = new IOException("wut");
        TerminalFailureException signal = TerminalFailures.mark(original);

        // When
        Failed failed = new Failed(signal);

        // Then
        assertSame(signal, failed.cause());
        assertSame(original, failed.originalCause());
        assertTrue(TerminalFailures.isTerminal(failed.cause()));
    }

    @Test
    void failed_NullCause_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Failed(null)
        );
        assertTrue(exception.getMessage().contains("cause cannot be null"));
    }
}

package com.ryuqq.retrier.core.statemachine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AttemptState 테스트.
 *
 * @author Retrier Team
 * @since 1.0.0
 */
class AttemptStateTest {

    @Test
    void isTerminal_DoneAndAbandoned_ReturnsTrue() {
        assertTrue(AttemptState.DONE.isTerminal());
        assertTrue(AttemptState.ABANDONED.isTerminal());
    }

    @Test
    void isTerminal_AttemptingAndWaiting_ReturnsFalse() {
        assertFalse(AttemptState.ATTEMPTING.isTerminal());
        assertFalse(AttemptState.WAITING.isTerminal());
    }
}

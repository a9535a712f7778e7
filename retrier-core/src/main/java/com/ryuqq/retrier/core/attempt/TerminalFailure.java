package com.ryuqq.retrier.core.attempt;

import com.ryuqq.retrier.core.signal.TerminalFailureException;

/**
 * 재시도 불가 실패.
 *
 * <p>재시도해도 성공할 수 없어 실행을 즉시 종료해야 하는 경우를 나타냅니다.
 * 원인은 항상 {@link TerminalFailureException}으로 감싸져 있습니다.</p>
 *
 * @param cause 재시도 불가 신호 (원래 원인은 {@code cause.getCause()})
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public record TerminalFailure(TerminalFailureException cause) implements AttemptResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public TerminalFailure {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }
}

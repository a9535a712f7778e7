package com.ryuqq.retrier.core.outcome;

import com.ryuqq.retrier.core.signal.TerminalFailureException;

/**
 * 재시도 불가 실패로 종료된 결과.
 *
 * @param cause 재시도 불가 신호 ({@code TerminalFailures.isTerminal(cause)}는 항상 true)
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public record Failed(TerminalFailureException cause) implements RetryOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public Failed {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }

    /**
     * 재시도 불가로 표시되기 전의 원래 원인 조회.
     *
     * @return 원래 원인
     */
    public Throwable originalCause() {
        return cause.getCause();
    }
}

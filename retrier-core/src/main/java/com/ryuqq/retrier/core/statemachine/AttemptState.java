package com.ryuqq.retrier.core.statemachine;

/**
 * 시도 루프(attempt loop)의 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * ATTEMPTING ──(RetriableFailure)──► WAITING
 *    ▲                                  │
 *    └────────────(interval 경과)────────┘
 *
 * ATTEMPTING ──(Success / TerminalFailure)──► DONE
 * ATTEMPTING / WAITING ──(호출자 이탈)──► ABANDONED
 * </pre>
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public enum AttemptState {

    /**
     * 시도 실행 중.
     */
    ATTEMPTING,

    /**
     * 다음 시도 전 interval 대기 중.
     */
    WAITING,

    /**
     * 결과 확정 (Ok 또는 Failed 전달됨).
     */
    DONE,

    /**
     * 호출자가 타임아웃 또는 인터럽트로 떠난 뒤 루프 종료.
     */
    ABANDONED;

    /**
     * 종료 상태인지 확인.
     *
     * @return DONE 또는 ABANDONED인 경우 true
     */
    public boolean isTerminal() {
        return this == DONE || this == ABANDONED;
    }
}

package com.ryuqq.retrier.core.outcome;

import com.ryuqq.retrier.core.signal.TerminalFailureException;

/**
 * 실행(run) 전체의 최종 결과.
 *
 * <p>RetryOutcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 시도가 성공함</li>
 *   <li>{@link TimedOut}: 성공 또는 재시도 불가 실패 전에 timeout 경과</li>
 *   <li>{@link Failed}: 시도가 재시도 불가 실패를 반환함</li>
 * </ul>
 *
 * <p>결과는 실행당 정확히 한 번 생성됩니다. 모든 케이스가 값 기반 record이므로
 * {@code equals}로 비교할 수 있습니다 ({@code new TimedOut().equals(new TimedOut())}).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RetryOutcome outcome = retrier.run(attempt, timeout, interval);
 * if (outcome instanceof Failed failed) {
 *     log.error("gave up", failed.originalCause());
 * } else if (outcome.isTimedOut()) {
 *     // deadline 초과
 * }
 * </pre>
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public sealed interface RetryOutcome permits Ok, TimedOut, Failed {

    /**
     * 성공 결과 생성.
     *
     * @return Ok 인스턴스
     */
    static RetryOutcome ok() {
        return new Ok();
    }

    /**
     * 타임아웃 결과 생성.
     *
     * @return TimedOut 인스턴스
     */
    static RetryOutcome timedOut() {
        return new TimedOut();
    }

    /**
     * 재시도 불가 실패 결과 생성.
     *
     * @param cause 재시도 불가 신호
     * @return Failed 인스턴스
     * @throws IllegalArgumentException cause가 null인 경우
     */
    static RetryOutcome failed(TerminalFailureException cause) {
        return new Failed(cause);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 타임아웃인지 확인.
     *
     * @return 타임아웃 여부
     */
    default boolean isTimedOut() {
        return this instanceof TimedOut;
    }

    /**
     * 결과가 재시도 불가 실패인지 확인.
     *
     * @return 재시도 불가 실패 여부
     */
    default boolean isFailed() {
        return this instanceof Failed;
    }
}

package com.ryuqq.retrier.core.attempt;

import com.ryuqq.retrier.core.signal.TerminalFailures;

/**
 * 단일 시도(attempt)의 결과.
 *
 * <p>AttemptResult는 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 성공, 실행 종료</li>
 *   <li>{@link RetriableFailure}: 일시적 실패, interval 후 재시도</li>
 *   <li>{@link TerminalFailure}: 재시도 불가 실패, 즉시 종료</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public sealed interface AttemptResult permits Success, RetriableFailure, TerminalFailure {

    /**
     * 성공 결과 생성.
     *
     * @return Success 인스턴스
     */
    static AttemptResult success() {
        return new Success();
    }

    /**
     * 재시도 가능한 실패 결과 생성.
     *
     * @param cause 실패 원인
     * @return RetriableFailure 인스턴스
     * @throws IllegalArgumentException cause가 null인 경우
     */
    static AttemptResult retriable(Throwable cause) {
        return new RetriableFailure(cause);
    }

    /**
     * 재시도 불가 실패 결과 생성.
     *
     * <p>cause는 {@link TerminalFailures#mark(Throwable)}로 감싸집니다.</p>
     *
     * @param cause 실패 원인
     * @return TerminalFailure 인스턴스
     * @throws IllegalArgumentException cause가 null인 경우
     */
    static AttemptResult terminal(Throwable cause) {
        return new TerminalFailure(TerminalFailures.mark(cause));
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * 결과가 재시도 가능한지 확인.
     *
     * @return 재시도 가능 여부
     */
    default boolean isRetriable() {
        return this instanceof RetriableFailure;
    }

    /**
     * 결과가 재시도 불가 실패인지 확인.
     *
     * @return 재시도 불가 여부
     */
    default boolean isTerminal() {
        return this instanceof TerminalFailure;
    }
}

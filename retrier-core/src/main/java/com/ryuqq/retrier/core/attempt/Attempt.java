package com.ryuqq.retrier.core.attempt;

import com.ryuqq.retrier.core.signal.TerminalFailures;

/**
 * Retrier가 반복 호출하는 작업 한 번의 시도.
 *
 * <p>구현체는 여러 번 호출되어도 안전해야 합니다. Retrier는 호출을 중복 제거하거나
 * 결과를 캐시하지 않습니다.</p>
 *
 * @author Retrier Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Attempt {

    /**
     * 시도 실행.
     *
     * @return 시도 결과 (Success, RetriableFailure, TerminalFailure)
     */
    AttemptResult attempt();

    /**
     * 예외 기반 작업을 Attempt로 변환.
     *
     * <p><strong>분류 규칙:</strong></p>
     * <ul>
     *   <li>정상 반환 → {@link Success}</li>
     *   <li>재시도 불가로 표시된 예외 → {@link TerminalFailure}</li>
     *   <li>그 외 Exception → {@link RetriableFailure}</li>
     * </ul>
     *
     * @param operation 예외로 실패를 알리는 작업
     * @return Attempt 인스턴스
     * @throws IllegalArgumentException operation이 null인 경우
     */
    static Attempt of(FallibleOperation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        return () -> {
            try {
                operation.run();
                return AttemptResult.success();
            } catch (Exception e) {
                return classify(e);
            }
        };
    }

    /**
     * 예외를 시도 결과로 분류.
     *
     * @param failure 시도 중 발생한 예외
     * @return TerminalFailure 또는 RetriableFailure
     */
    static AttemptResult classify(Exception failure) {
        if (TerminalFailures.isTerminal(failure)) {
            return AttemptResult.terminal(failure);
        }
        return AttemptResult.retriable(failure);
    }
}

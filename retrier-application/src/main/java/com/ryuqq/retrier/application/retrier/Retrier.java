package com.ryuqq.retrier.application.retrier;

import com.ryuqq.retrier.core.attempt.Attempt;
import com.ryuqq.retrier.core.outcome.RetryOutcome;

import java.time.Duration;

/**
 * 고정 간격 재시도 실행자.
 *
 * <p>Attempt를 성공하거나, 재시도 불가 신호를 반환하거나, timeout이 경과할 때까지
 * interval 간격으로 반복 실행합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RetryOutcome outcome = retrier.run(
 *     Attempt.of(() -> healthCheck.ping()),
 *     Duration.ofSeconds(1),
 *     Duration.ofMillis(100));
 *
 * if (outcome.isOk()) {
 *     // 성공
 * } else if (outcome.isTimedOut()) {
 *     // deadline 초과
 * } else {
 *     // 재시도 불가 실패: ((Failed) outcome).cause()
 * }
 * </pre>
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public interface Retrier {

    /**
     * Attempt를 결과가 확정될 때까지 반복 실행.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>호출 시점부터 timeout 감시 시작</li>
     *   <li>Attempt 실행</li>
     *   <li>Success → Ok, TerminalFailure → Failed (즉시 반환)</li>
     *   <li>RetriableFailure → 로그 기록 후 interval 대기, 2번으로</li>
     *   <li>timeout 경과 시 → TimedOut (진행 중인 시도는 버려짐)</li>
     * </ol>
     *
     * @param attempt 반복 실행할 시도
     * @param timeout 전체 허용 시간 (0 이상)
     * @param interval 실패한 시도와 다음 시도 사이 대기 시간 (0 이상)
     * @return 최종 결과 (Ok, TimedOut, Failed)
     * @throws IllegalArgumentException 인자가 null이거나 음수 Duration인 경우
     */
    RetryOutcome run(Attempt attempt, Duration timeout, Duration interval);

    /**
     * 설정 record로 실행.
     *
     * @param attempt 반복 실행할 시도
     * @param config timeout과 interval 설정
     * @return 최종 결과 (Ok, TimedOut, Failed)
     * @throws IllegalArgumentException attempt 또는 config가 null인 경우
     */
    default RetryOutcome run(Attempt attempt, RetryConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return run(attempt, config.timeout(), config.interval());
    }
}

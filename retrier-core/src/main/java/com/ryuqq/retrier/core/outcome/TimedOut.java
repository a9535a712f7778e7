package com.ryuqq.retrier.core.outcome;

/**
 * 타임아웃 결과.
 *
 * <p>진행 중이던 시도는 강제로 중단되지 않으며, 백그라운드에서 끝난 뒤 결과는 버려집니다.</p>
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public record TimedOut() implements RetryOutcome {
}

package com.ryuqq.retrier.core.outcome;

/**
 * 성공 결과.
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public record Ok() implements RetryOutcome {
}

package com.ryuqq.retrier.core.attempt;

/**
 * 성공한 시도.
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public record Success() implements AttemptResult {
}

/**
 * Attempt model.
 *
 * <p>An {@link com.ryuqq.retrier.core.attempt.Attempt} is invoked once per try and reports one of
 * three {@link com.ryuqq.retrier.core.attempt.AttemptResult} cases:</p>
 * <ul>
 *   <li>{@link com.ryuqq.retrier.core.attempt.Success} - stop with Ok</li>
 *   <li>{@link com.ryuqq.retrier.core.attempt.RetriableFailure} - log, wait, try again</li>
 *   <li>{@link com.ryuqq.retrier.core.attempt.TerminalFailure} - stop with Failed</li>
 * </ul>
 *
 * <p>Operations that report failure by throwing are adapted with
 * {@link com.ryuqq.retrier.core.attempt.Attempt#of(com.ryuqq.retrier.core.attempt.FallibleOperation)}.</p>
 *
 * @since 1.0.0
 * @author Retrier Team
 */
package com.ryuqq.retrier.core.attempt;

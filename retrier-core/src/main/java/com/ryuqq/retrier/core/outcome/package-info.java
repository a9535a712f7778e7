/**
 * Run outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for the single result of a run.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retrier.core.outcome.Ok} - An attempt succeeded</li>
 *   <li>{@link com.ryuqq.retrier.core.outcome.TimedOut} - The deadline elapsed first</li>
 *   <li>{@link com.ryuqq.retrier.core.outcome.Failed} - An attempt signalled a terminal failure</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Value equality:</strong> outcomes are records, so a timeout is recognised by type or
 *       {@code equals}, never by identity with a shared sentinel</li>
 *   <li><strong>Final disposition only:</strong> causes of retried attempts are logged and never
 *       appear in the outcome</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Retrier Team
 */
package com.ryuqq.retrier.core.outcome;

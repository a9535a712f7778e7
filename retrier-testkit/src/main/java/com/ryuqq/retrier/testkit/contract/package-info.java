/**
 * Contract test support for {@link com.ryuqq.retrier.application.retrier.Retrier} implementations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.retrier.testkit.contract.AbstractRetrierContractTest} - inherited contract tests</li>
 *   <li>{@link com.ryuqq.retrier.testkit.contract.ScriptedAttempt} - attempt double with invocation tracking</li>
 *   <li>{@link com.ryuqq.retrier.testkit.contract.RecordingLogSink} - in-memory log sink</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Retrier Team
 */
package com.ryuqq.retrier.testkit.contract;

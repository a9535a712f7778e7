/**
 * Service Provider Interfaces for the collaborators a Retrier uses but does not own.
 *
 * <ul>
 *   <li>{@link com.ryuqq.retrier.core.spi.AttemptLogSink} - receives one diagnostic line per retried attempt</li>
 *   <li>{@link com.ryuqq.retrier.core.spi.RetryClock} - measures attempt duration and sleeps between attempts</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Retrier Team
 */
package com.ryuqq.retrier.core.spi;

/**
 * Terminal-failure signalling.
 *
 * <p>An attempt marks a cause as non-retriable with
 * {@link com.ryuqq.retrier.core.signal.TerminalFailures#mark(Throwable)}. Callers test the
 * final cause with {@link com.ryuqq.retrier.core.signal.TerminalFailures#isTerminal(Throwable)}
 * to tell a terminal stop apart from a timeout.</p>
 *
 * @since 1.0.0
 * @author Retrier Team
 */
package com.ryuqq.retrier.core.signal;

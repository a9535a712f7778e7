/**
 * Attempt loop state machine.
 *
 * @since 1.0.0
 * @author Retrier Team
 */
package com.ryuqq.retrier.core.statemachine;

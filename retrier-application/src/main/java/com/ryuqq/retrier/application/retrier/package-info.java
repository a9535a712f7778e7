/**
 * Retrier Application Layer.
 *
 * <p>이 패키지는 재시도 실행 계약과 설정을 정의합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retrier.application.retrier.Retrier} - 재시도 실행 포트</li>
 *   <li>{@link com.ryuqq.retrier.application.retrier.RetryConfig} - timeout / interval 설정</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ThreadedRetryRunner)
 *   ↓ implements
 * application (Retrier interface)
 *   ↓ depends on
 * core (Attempt, AttemptResult, RetryOutcome, TerminalFailures, SPI)
 * </pre>
 *
 * @author Retrier Team
 * @since 1.0.0
 */
package com.ryuqq.retrier.application.retrier;

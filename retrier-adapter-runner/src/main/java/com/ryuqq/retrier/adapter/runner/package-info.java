/**
 * Runner Adapter Layer - Retrier 구현체.
 *
 * <p>이 패키지는 Retrier 인터페이스의 구체적인 구현체들을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retrier.adapter.runner.ThreadedRetryRunner} - 전용 스레드 + timeout 대기 러너</li>
 *   <li>{@link com.ryuqq.retrier.adapter.runner.Slf4jAttemptLogSink} - SLF4J WARN 로그 수신자</li>
 *   <li>{@link com.ryuqq.retrier.adapter.runner.SystemRetryClock} - 시스템 시계</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ThreadedRetryRunner, AttemptLoop)
 *   ↓ implements
 * application (Retrier interface)
 *   ↓ depends on
 * core (Attempt, AttemptResult, RetryOutcome, AttemptState, SPI)
 * </pre>
 *
 * @author Retrier Team
 * @since 1.0.0
 */
package com.ryuqq.retrier.adapter.runner;

package com.ryuqq.retrier.application.retrier;

import java.time.Duration;

/**
 * Retrier 실행 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>timeout: 전체 허용 시간 (기본 15초)</li>
 *   <li>interval: 재시도 간격 (기본 100ms)</li>
 * </ul>
 *
 * <p>0은 허용됩니다. interval=0이면 쉬지 않고 재시도하고, timeout=0이면
 * 첫 시도가 즉시 끝나지 않는 한 TimedOut을 반환합니다.</p>
 *
 * @author Retrier Team
 * @since 1.0.0
 * @param timeout 전체 허용 시간 (0 이상)
 * @param interval 재시도 간격 (0 이상)
 */
public record RetryConfig(
    Duration timeout,
    Duration interval
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(100);

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: timeout=15s, interval=100ms</p>
     */
    public RetryConfig() {
        this(DEFAULT_TIMEOUT, DEFAULT_INTERVAL);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        requireNonNegative("timeout", timeout);
        requireNonNegative("interval", interval);
    }

    /**
     * timeout만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withTimeout(Duration timeout) {
        return new RetryConfig(timeout, interval);
    }

    /**
     * interval만 변경한 새 인스턴스 생성.
     */
    public RetryConfig withInterval(Duration interval) {
        return new RetryConfig(timeout, interval);
    }

    /**
     * Duration 인자 검증.
     *
     * <p>Retrier 구현체의 입력 검증에서도 같은 규칙과 메시지를 사용합니다.</p>
     *
     * @param name 인자 이름
     * @param value 검증할 값
     * @throws IllegalArgumentException value가 null이거나 음수인 경우
     */
    public static void requireNonNegative(String name, Duration value) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        if (value.isNegative()) {
            throw new IllegalArgumentException(
                name + " must be non-negative (current: " + value + ")"
            );
        }
    }
}

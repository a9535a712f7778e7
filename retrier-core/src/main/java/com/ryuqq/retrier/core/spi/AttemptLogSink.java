package com.ryuqq.retrier.core.spi;

/**
 * 시도 실패 진단 메시지 수신자.
 *
 * <p>재시도될 실패마다 한 줄씩 호출됩니다. 제어 흐름에 영향을 주지 않으며,
 * 구현체는 오래 블로킹하면 안 됩니다.</p>
 *
 * @author Retrier Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AttemptLogSink {

    /**
     * 진단 메시지 기록.
     *
     * @param message 사람이 읽을 수 있는 메시지 (원인과 시도 소요 시간 포함)
     */
    void log(String message);
}

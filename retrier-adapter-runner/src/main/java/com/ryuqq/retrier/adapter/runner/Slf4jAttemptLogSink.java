package com.ryuqq.retrier.adapter.runner;

import com.ryuqq.retrier.core.spi.AttemptLogSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLF4J 기반 AttemptLogSink.
 *
 * <p>재시도될 실패를 WARN 레벨로 기록합니다. 기본 로거 이름은 {@code ThreadedRetryRunner}이므로
 * 로깅 설정에서는 러너 클래스 기준으로 레벨을 조정하면 됩니다.</p>
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public final class Slf4jAttemptLogSink implements AttemptLogSink {

    private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(ThreadedRetryRunner.class);

    private final Logger log;

    /**
     * 생성자 (ThreadedRetryRunner 로거 사용).
     */
    public Slf4jAttemptLogSink() {
        this(DEFAULT_LOGGER);
    }

    /**
     * 생성자 (로거 주입).
     *
     * @param log 기록할 로거
     * @throws IllegalArgumentException log가 null인 경우
     */
    public Slf4jAttemptLogSink(Logger log) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.log = log;
    }

    @Override
    public void log(String message) {
        log.warn("{}", message);
    }
}

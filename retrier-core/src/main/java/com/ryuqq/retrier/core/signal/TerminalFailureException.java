package com.ryuqq.retrier.core.signal;

/**
 * 재시도 불가 신호.
 *
 * <p>원인 예외를 감싸서 Retrier가 더 이상 재시도하지 않고 즉시 종료하도록 표시합니다.
 * 원래 원인은 {@link #getCause()}로 조회할 수 있으며, 메시지는 "terminal: " 접두어 뒤에
 * 원인 메시지를 그대로 유지합니다.</p>
 *
 * <p>직접 생성하지 말고 {@link TerminalFailures#mark(Throwable)}를 사용하세요.</p>
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public final class TerminalFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    static final String MESSAGE_PREFIX = "terminal: ";

    TerminalFailureException(Throwable cause) {
        super(MESSAGE_PREFIX + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getName();
    }
}

package com.ryuqq.retrier.core.signal;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * 재시도 불가(terminal) 신호 유틸리티.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Attempt attempt = Attempt.of(() -> {
 *     Response response = client.call();
 *     if (response.status() == 403) {
 *         throw TerminalFailures.mark(new IllegalStateException("forbidden"));
 *     }
 * });
 *
 * RetryOutcome outcome = retrier.run(attempt, Duration.ofSeconds(5), Duration.ofMillis(100));
 * if (outcome instanceof Failed failed && TerminalFailures.isTerminal(failed.cause())) {
 *     // 재시도 불가로 종료됨 (타임아웃 아님)
 * }
 * }</pre>
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public final class TerminalFailures {

    private TerminalFailures() {
    }

    /**
     * 원인을 재시도 불가로 표시.
     *
     * <p>이미 표시된 예외를 다시 표시하면 같은 인스턴스를 반환합니다.</p>
     *
     * @param cause 원인
     * @return 원인을 감싼 TerminalFailureException
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public static TerminalFailureException mark(Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        if (cause instanceof TerminalFailureException terminal) {
            return terminal;
        }
        return new TerminalFailureException(cause);
    }

    /**
     * 재시도 불가 신호인지 확인.
     *
     * <p>throwable 자신 또는 cause chain 중 하나라도 재시도 불가로 표시되어 있으면 true.
     * 순환하는 cause chain은 이미 방문한 예외에서 탐색을 멈춥니다.</p>
     *
     * @param throwable 검사할 예외 (null 허용)
     * @return 재시도 불가 여부
     */
    public static boolean isTerminal(Throwable throwable) {
        Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            if (current instanceof TerminalFailureException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}

package com.ryuqq.retrier.core.attempt;

/**
 * 예외로 실패를 알리는 작업.
 *
 * <p>{@link Attempt#of(FallibleOperation)}로 감싸서 Retrier에 전달합니다.</p>
 *
 * @author Retrier Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FallibleOperation {

    /**
     * 작업 실행.
     *
     * @throws Exception 실패 시 (재시도 불가로 표시된 예외는 즉시 종료)
     */
    void run() throws Exception;
}

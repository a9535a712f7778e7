package com.ryuqq.retrier.core.attempt;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p>명시적으로 재시도 불가로 표시되지 않은 모든 실패의 기본 분류입니다.
 * 원인은 로그로만 남고 호출자에게 개별적으로 반환되지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>네트워크 타임아웃</li>
 *   <li>외부 서비스 일시 장애 (503 Service Unavailable)</li>
 *   <li>아직 준비되지 않은 리소스</li>
 * </ul>
 *
 * @param cause 실패 원인
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public record RetriableFailure(Throwable cause) implements AttemptResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public RetriableFailure {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }
}

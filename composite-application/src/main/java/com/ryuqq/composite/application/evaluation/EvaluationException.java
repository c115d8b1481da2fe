package com.ryuqq.composite.application.evaluation;

/**
 * 트리 평가 실패.
 *
 * <p>순차 평가는 순수 메모리 연산이라 발생하지 않으며, 작업자 스레드를 사용하는
 * 구현에서 작업 제출이 거부되거나 하위 트리 평가가 실패하거나 대기 중 인터럽트가 발생한 경우에 사용합니다.</p>
 *
 * @author Composite Team
 * @since 1.0.0
 */
public final class EvaluationException extends RuntimeException {

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}

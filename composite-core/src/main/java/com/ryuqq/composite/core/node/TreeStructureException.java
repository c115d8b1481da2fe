package com.ryuqq.composite.core.node;

/**
 * 트리 구조 연산 실패의 공통 상위 예외.
 *
 * <p>모든 구조 예외는 즉시, 국소적으로 발생하며 트리는 변경되지 않은 상태로 남습니다.</p>
 *
 * @author Composite Team
 * @since 1.0.0
 */
public abstract class TreeStructureException extends RuntimeException {

    protected TreeStructureException(String message) {
        super(message);
    }
}

package com.ryuqq.composite.core.node;

/**
 * 자식 관리 연산을 Leaf에 요청했을 때 발생.
 *
 * <p>{@link Trees#add(Node, Node)}/{@link Trees#remove(Node, Node)}처럼 부모 타입을
 * {@link Node}로 받는 균일 API에서만 발생합니다. {@link Leaf} 타입으로는
 * 해당 연산을 호출할 수 없습니다.</p>
 *
 * @author Composite Team
 * @since 1.0.0
 */
public final class InvalidOperationException extends TreeStructureException {

    private final String operation;

    /**
     * 생성자.
     *
     * @param operation 요청한 연산 이름 (예: "add")
     * @param target 연산 대상 Leaf
     */
    public InvalidOperationException(String operation, Leaf target) {
        super(String.format("Operation '%s' is not supported on leaf node %s", operation, target));
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}

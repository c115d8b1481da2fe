package com.ryuqq.composite.core.node;

/**
 * Container를 자기 자신 또는 자신의 하위 노드에 추가하려 할 때 발생.
 *
 * <p>이 예외가 발생하면 트리는 변경되지 않습니다.</p>
 *
 * @author Composite Team
 * @since 1.0.0
 */
public final class CycleDetectedException extends TreeStructureException {

    private final transient Container target;
    private final transient Node child;

    /**
     * 생성자.
     *
     * @param target 자식을 추가하려던 Container
     * @param child 추가하려던 노드 (target 자신 또는 target의 조상)
     */
    public CycleDetectedException(Container target, Node child) {
        super(String.format("Cannot add %s to %s: child is the container itself or one of its ancestors",
            child, target));
        this.target = target;
        this.child = child;
    }

    public Container getTarget() {
        return target;
    }

    public Node getChild() {
        return child;
    }
}

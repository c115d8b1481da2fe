package com.ryuqq.composite.core.node;

import com.ryuqq.composite.core.aggregation.TreeAggregator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 순서 있는 자식 목록을 소유하고 그 결과를 집계하는 노드.
 *
 * <p><strong>불변식 (모든 public 연산 이후 유지):</strong></p>
 * <ul>
 *   <li>I1 트리 형태: 자식 관계에 순환이 없음</li>
 *   <li>I2 부모 일관성: 자식의 부모 참조는 항상 자신을 포함한 Container</li>
 *   <li>I3 단일 소유: 노드는 한 번에 최대 하나의 Container에만 속함</li>
 *   <li>I4 순서 안정성: 순서는 {@code add}(끝에 추가)와 {@code remove}(나머지 순서 유지)로만 변경</li>
 * </ul>
 *
 * <p><strong>재배치 (re-parenting):</strong></p>
 * <pre>
 * p1.add(n);   // n ∈ p1.children, n.parent = p1
 * p2.add(n);   // n ∉ p1.children, n ∈ p2.children (1회), n.parent = p2
 * </pre>
 *
 * <p><strong>동시성:</strong> 내부 잠금이 없습니다. 구조 변경은 호출자가 직렬화해야 하며,
 * {@code execute()}와 동시에 실행하면 안 됩니다.</p>
 *
 * @author Composite Team
 * @since 1.0.0
 */
public final class Container implements Node {

    private final List<Node> children;
    private Container parent;

    private Container() {
        this.children = new ArrayList<>();
    }

    /**
     * 부모와 자식이 없는 빈 Container 생성.
     *
     * @return 새 Container
     */
    public static Container create() {
        return new Container();
    }

    /**
     * 자식 추가.
     *
     * <p>child가 이미 다른 Container(또는 이 Container)에 속해 있으면 먼저 분리한 뒤
     * 목록 끝에 추가하고 부모 참조를 이 Container로 설정합니다.</p>
     *
     * @param child 추가할 노드
     * @throws IllegalArgumentException child가 null인 경우
     * @throws CycleDetectedException child가 이 Container 자신이거나 조상인 경우 (트리 변경 없음)
     */
    public void add(Node child) {
        if (child == null) {
            throw new IllegalArgumentException("child cannot be null");
        }
        if (child == this || (child instanceof Container container && container.isAncestorOf(this))) {
            throw new CycleDetectedException(this, child);
        }

        Container previous = child.getParent().orElse(null);
        if (previous != null) {
            previous.children.remove(previous.indexOf(child));
        }

        children.add(child);
        assignParent(child, this);
    }

    /**
     * 자식 제거.
     *
     * <p>없는 자식을 제거하면 아무것도 변경하지 않습니다 (child의 부모 참조도 유지).</p>
     *
     * @param child 제거할 노드
     * @return 제거되었으면 true, 자식이 아니었으면 false
     * @throws IllegalArgumentException child가 null인 경우
     */
    public boolean remove(Node child) {
        if (child == null) {
            throw new IllegalArgumentException("child cannot be null");
        }
        int index = indexOf(child);
        if (index < 0) {
            return false;
        }
        children.remove(index);
        assignParent(child, null);
        return true;
    }

    /**
     * 자식 목록 스냅샷 (삽입 순서).
     *
     * @return 수정 불가능한 자식 목록
     */
    public List<Node> getChildren() {
        return Collections.unmodifiableList(new ArrayList<>(children));
    }

    /**
     * 위치로 자식 조회.
     *
     * @param index 0부터 시작하는 위치
     * @return 자식 노드
     * @throws IndexOutOfBoundsException 범위를 벗어난 경우
     */
    public Node childAt(int index) {
        return children.get(index);
    }

    public int size() {
        return children.size();
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    /**
     * 자식인지 확인 (참조 동일성).
     *
     * @param node 확인할 노드
     * @return 직계 자식이면 true
     */
    public boolean contains(Node node) {
        return indexOf(node) >= 0;
    }

    /**
     * 자식 위치 조회 (참조 동일성).
     *
     * @param node 찾을 노드
     * @return 위치, 없으면 -1
     */
    public int indexOf(Node node) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    /**
     * node의 부모 체인에 이 Container가 있는지 확인.
     *
     * @param node 확인할 노드
     * @return 이 Container가 node의 조상이면 true
     */
    public boolean isAncestorOf(Node node) {
        if (node == null) {
            return false;
        }
        Container current = node.getParent().orElse(null);
        while (current != null) {
            if (current == this) {
                return true;
            }
            current = current.parent;
        }
        return false;
    }

    @Override
    public String execute() {
        return TreeAggregator.render(this);
    }

    @Override
    public boolean isContainer() {
        return true;
    }

    @Override
    public Optional<Container> getParent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public String toString() {
        return "Container{children=" + children.size() + '}';
    }

    private static void assignParent(Node node, Container parent) {
        if (node instanceof Leaf leaf) {
            leaf.setParent(parent);
        } else if (node instanceof Container container) {
            container.parent = parent;
        }
    }
}

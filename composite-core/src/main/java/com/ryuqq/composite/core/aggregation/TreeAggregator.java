package com.ryuqq.composite.core.aggregation;

import com.ryuqq.composite.core.node.Container;
import com.ryuqq.composite.core.node.Leaf;
import com.ryuqq.composite.core.node.Node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 트리 집계 알고리즘.
 *
 * <p>Container의 자식 결과를 삽입 순서대로 접어(fold) 하나의 값으로 만듭니다.</p>
 *
 * <p><strong>렌더링 규칙:</strong></p>
 * <ul>
 *   <li>빈 Container → {@code Branch()}</li>
 *   <li>자식이 있는 Container → {@code Branch(a+b+c)} (마지막 원소 뒤에 구분자 없음)</li>
 *   <li>Leaf → Payload 값 (기본 {@code Leaf})</li>
 * </ul>
 *
 * <p><strong>알고리즘:</strong> 명시적 작업 스택을 사용하는 반복적 깊이 우선 순회입니다.
 * 호출 스택 사용량은 트리 깊이와 무관하며, 렌더링은 하나의 버퍼에 순서대로 기록됩니다.</p>
 * <pre>
 * push(root); out += "Branch("
 * while (stack not empty):
 *   top = peek()
 *   if top has unvisited child:
 *     not first child    → out += "+"
 *     child is Leaf      → out += payload
 *     child is Container → out += "Branch("; push(child)
 *   else:
 *     pop(); out += ")"; fold counts into parent frame
 * </pre>
 *
 * @author Composite Team
 * @since 1.0.0
 */
public final class TreeAggregator {

    public static final String BRANCH_PREFIX = "Branch(";
    public static final String BRANCH_SUFFIX = ")";
    public static final String SEPARATOR = "+";

    // Utility class - prevent instantiation
    private TreeAggregator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 노드 렌더링.
     *
     * @param node 평가할 노드
     * @return 렌더링 결과
     * @throws IllegalArgumentException node가 null인 경우
     */
    public static String render(Node node) {
        return aggregate(node).rendering();
    }

    /**
     * 노드를 루트로 하는 하위 트리 집계.
     *
     * @param node 평가할 노드
     * @return 집계 결과
     * @throws IllegalArgumentException node가 null인 경우
     */
    public static Aggregate aggregate(Node node) {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        if (node instanceof Leaf leaf) {
            return Aggregate.ofLeaf(leaf.execute());
        }

        StringBuilder rendering = new StringBuilder();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame((Container) node));
        rendering.append(BRANCH_PREFIX);

        while (true) {
            Frame top = stack.peek();
            if (top.hasNext()) {
                if (top.cursor > 0) {
                    rendering.append(SEPARATOR);
                }
                Node child = top.next();
                if (child instanceof Container container) {
                    rendering.append(BRANCH_PREFIX);
                    stack.push(new Frame(container));
                } else {
                    rendering.append(child.execute());
                    top.nodeCount++;
                    top.leafCount++;
                    top.maxChildHeight = Math.max(top.maxChildHeight, 0);
                }
                continue;
            }

            stack.pop();
            rendering.append(BRANCH_SUFFIX);
            int height = top.maxChildHeight + 1;
            Frame parent = stack.peek();
            if (parent == null) {
                return new Aggregate(rendering.toString(), top.nodeCount, top.leafCount, height);
            }
            parent.nodeCount += top.nodeCount;
            parent.leafCount += top.leafCount;
            parent.maxChildHeight = Math.max(parent.maxChildHeight, height);
        }
    }

    /**
     * 자식 집계 결과를 Container 집계 결과로 결합.
     *
     * <p>순서가 곧 렌더링 순서입니다. 병렬 평가 후 재결합에도 사용됩니다.</p>
     *
     * @param children 삽입 순서대로 정렬된 자식 집계 결과
     * @return Container 집계 결과
     * @throws IllegalArgumentException children이 null이거나 null 원소를 포함한 경우
     */
    public static Aggregate combine(List<Aggregate> children) {
        if (children == null) {
            throw new IllegalArgumentException("children cannot be null");
        }

        StringBuilder rendering = new StringBuilder(BRANCH_PREFIX);
        int nodeCount = 1;
        int leafCount = 0;
        int maxChildHeight = -1;

        for (int i = 0; i < children.size(); i++) {
            Aggregate child = children.get(i);
            if (child == null) {
                throw new IllegalArgumentException("children cannot contain null (index: " + i + ")");
            }
            if (i > 0) {
                rendering.append(SEPARATOR);
            }
            rendering.append(child.rendering());
            nodeCount += child.nodeCount();
            leafCount += child.leafCount();
            maxChildHeight = Math.max(maxChildHeight, child.height());
        }
        rendering.append(BRANCH_SUFFIX);

        return new Aggregate(rendering.toString(), nodeCount, leafCount, maxChildHeight + 1);
    }

    /**
     * 작업 스택 프레임: 방문 중인 Container와 지금까지 모은 하위 트리 통계.
     */
    private static final class Frame {

        private final Container container;
        private int cursor;
        private int nodeCount = 1;
        private int leafCount;
        private int maxChildHeight = -1;

        private Frame(Container container) {
            this.container = container;
        }

        private boolean hasNext() {
            return cursor < container.size();
        }

        private Node next() {
            return container.childAt(cursor++);
        }
    }
}

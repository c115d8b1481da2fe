package com.ryuqq.composite.core.node;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * 트리 구조 불변식 검증.
 *
 * <p>주어진 노드를 루트로 하는 하위 트리를 반복적으로 순회하며
 * 다음 불변식을 검사합니다:</p>
 * <ul>
 *   <li>I1 트리 형태: 어떤 노드도 두 번 도달되지 않음 (순환 없음)</li>
 *   <li>I2 부모 일관성: 각 자식의 부모 참조가 자신을 담은 Container</li>
 *   <li>I3 단일 소유: 같은 노드가 둘 이상의 자식 슬롯에 나타나지 않음</li>
 * </ul>
 *
 * <p>테스트와 진단 용도입니다. public API만 사용한 트리는 항상 검증을 통과합니다.</p>
 *
 * @author Composite Team
 * @since 1.0.0
 */
public final class TreeInvariants {

    // Utility class - prevent instantiation
    private TreeInvariants() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 하위 트리 불변식 검증.
     *
     * @param root 검증할 하위 트리의 루트
     * @return 검사한 노드 수 (root 포함)
     * @throws IllegalArgumentException root가 null인 경우
     * @throws IllegalStateException 불변식 위반이 발견된 경우
     */
    public static int verify(Node root) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }

        Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        visited.add(root);
        if (!(root instanceof Container rootContainer)) {
            return 1;
        }

        Deque<Container> pending = new ArrayDeque<>();
        pending.push(rootContainer);

        while (!pending.isEmpty()) {
            Container container = pending.pop();
            for (int i = 0; i < container.size(); i++) {
                Node child = container.childAt(i);
                if (!visited.add(child)) {
                    throw new IllegalStateException(
                        String.format("Node %s reached twice under %s (index: %d): cycle or shared ownership",
                            child, container, i)
                    );
                }
                Container parent = child.getParent().orElse(null);
                if (parent != container) {
                    throw new IllegalStateException(
                        String.format("Parent reference of %s is %s but it is a child of %s",
                            child, parent, container)
                    );
                }
                if (child instanceof Container childContainer) {
                    pending.push(childContainer);
                }
            }
        }
        return visited.size();
    }
}

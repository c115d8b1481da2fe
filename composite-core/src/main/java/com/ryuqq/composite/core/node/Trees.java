package com.ryuqq.composite.core.node;

/**
 * 트리 구성/변경/조회를 위한 균일 API.
 *
 * <p>부모를 {@link Node} 타입으로 받는 클라이언트 코드를 위한 진입점입니다.
 * Leaf에 자식 관리 연산을 요청하면 조용히 무시하지 않고
 * {@link InvalidOperationException}으로 즉시 실패합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Node tree = Trees.container(
 *     Trees.container(Trees.leaf(), Trees.leaf()),
 *     Trees.container(Trees.leaf())
 * );
 * Trees.execute(tree); // "Branch(Branch(Leaf+Leaf)+Branch(Leaf))"
 * </pre>
 *
 * @author Composite Team
 * @since 1.0.0
 */
public final class Trees {

    // Utility class - prevent instantiation
    private Trees() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Leaf leaf() {
        return Leaf.create();
    }

    public static Leaf leaf(String payload) {
        return Leaf.of(payload);
    }

    public static Container container() {
        return Container.create();
    }

    /**
     * 자식을 순서대로 추가한 Container 생성.
     *
     * @param children 추가할 자식들 (이미 부모가 있으면 재배치됨)
     * @return 새 Container
     * @throws IllegalArgumentException children 또는 원소가 null인 경우
     */
    public static Container container(Node... children) {
        if (children == null) {
            throw new IllegalArgumentException("children cannot be null");
        }
        Container container = Container.create();
        for (Node child : children) {
            container.add(child);
        }
        return container;
    }

    /**
     * parent에 child 추가.
     *
     * @param parent 부모 노드
     * @param child 자식 노드
     * @throws IllegalArgumentException parent 또는 child가 null인 경우
     * @throws InvalidOperationException parent가 Leaf인 경우
     * @throws CycleDetectedException child가 parent 자신이거나 조상인 경우
     */
    public static void add(Node parent, Node child) {
        asContainer(parent, "add").add(child);
    }

    /**
     * parent에서 child 제거.
     *
     * @param parent 부모 노드
     * @param child 자식 노드
     * @return 제거되었으면 true
     * @throws IllegalArgumentException parent 또는 child가 null인 경우
     * @throws InvalidOperationException parent가 Leaf인 경우
     */
    public static boolean remove(Node parent, Node child) {
        return asContainer(parent, "remove").remove(child);
    }

    /**
     * 노드 평가.
     *
     * @param node 평가할 노드
     * @return 렌더링 결과
     * @throws IllegalArgumentException node가 null인 경우
     */
    public static String execute(Node node) {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        return node.execute();
    }

    private static Container asContainer(Node parent, String operation) {
        if (parent == null) {
            throw new IllegalArgumentException("parent cannot be null");
        }
        if (parent instanceof Leaf leaf) {
            throw new InvalidOperationException(operation, leaf);
        }
        return (Container) parent;
    }
}

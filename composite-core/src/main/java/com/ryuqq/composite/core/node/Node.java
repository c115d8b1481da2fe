package com.ryuqq.composite.core.node;

import java.util.Optional;

/**
 * 트리의 모든 구성원이 만족하는 공통 계약.
 *
 * <p>Node는 두 가지 변형만 가집니다:</p>
 * <ul>
 *   <li>{@link Leaf}: 자식이 없는 말단 노드, 실제 작업 단위를 수행</li>
 *   <li>{@link Container}: 순서 있는 자식 목록을 소유하고 결과를 집계</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 변형 집합이 컴파일 타임에 고정됩니다.
 * 자식 관리 연산({@code add}/{@code remove})은 {@link Container}에만 존재하므로,
 * Leaf에 자식을 추가하려는 코드는 컴파일되지 않습니다.</p>
 *
 * <p><strong>식별성:</strong> 노드의 동일성은 참조 동일성입니다
 * ({@code equals}/{@code hashCode}를 재정의하지 않음).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Container tree = Container.create();
 * Container branch = Container.create();
 * branch.add(Leaf.create());
 * tree.add(branch);
 *
 * String result = tree.execute(); // "Branch(Branch(Leaf))"
 * </pre>
 *
 * @author Composite Team
 * @since 1.0.0
 */
public sealed interface Node permits Leaf, Container {

    /**
     * 노드의 기여값 계산.
     *
     * <p>트리 구조를 변경하지 않습니다. Leaf는 Payload를, Container는
     * 자식 결과의 집계를 반환합니다.</p>
     *
     * @return 렌더링된 결과 ({@code Leaf | Branch(<node>{+<node>})})
     */
    String execute();

    /**
     * Container 변형인지 확인.
     *
     * @return Container인 경우 true
     */
    boolean isContainer();

    /**
     * 현재 이 노드를 소유한 Container 조회.
     *
     * <p>탐색 전용 역참조이며 수명에 관여하지 않습니다.
     * 부모 설정은 {@link Container#add(Node)}/{@link Container#remove(Node)}만 수행합니다.</p>
     *
     * @return 부모 Container (없으면 empty)
     */
    Optional<Container> getParent();

    /**
     * 부모 체인을 따라 올라가 최상위 노드 조회.
     *
     * @return 루트 노드 (부모가 없으면 자기 자신)
     */
    default Node root() {
        Node current = this;
        Optional<Container> parent = current.getParent();
        while (parent.isPresent()) {
            current = parent.get();
            parent = current.getParent();
        }
        return current;
    }

    /**
     * 조상 수 (루트의 깊이는 0).
     *
     * @return 깊이
     */
    default int depth() {
        int depth = 0;
        Optional<Container> parent = getParent();
        while (parent.isPresent()) {
            depth++;
            parent = parent.get().getParent();
        }
        return depth;
    }

    /**
     * 주어진 Container의 하위 노드인지 확인.
     *
     * @param ancestor 조상 후보
     * @return ancestor가 부모 체인에 있으면 true
     */
    default boolean isDescendantOf(Container ancestor) {
        return ancestor != null && ancestor.isAncestorOf(this);
    }
}

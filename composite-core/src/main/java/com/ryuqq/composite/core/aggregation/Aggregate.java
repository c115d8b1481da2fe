package com.ryuqq.composite.core.aggregation;

/**
 * 하나의 하위 트리를 평가한 집계 결과.
 *
 * <p>렌더링 문자열과 함께 하위 트리의 구조 통계를 담습니다.</p>
 *
 * @param rendering 렌더링 결과 ({@code Leaf | Branch(<node>{+<node>})})
 * @param nodeCount 하위 트리의 전체 노드 수 (자기 자신 포함, 1 이상)
 * @param leafCount 하위 트리의 Leaf 수 (0 이상)
 * @param height 하위 트리 높이 (Leaf와 빈 Container는 0)
 *
 * @author Composite Team
 * @since 1.0.0
 */
public record Aggregate(
    String rendering,
    int nodeCount,
    int leafCount,
    int height
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Aggregate {
        if (rendering == null || rendering.isEmpty()) {
            throw new IllegalArgumentException("rendering cannot be null or empty");
        }
        if (nodeCount < 1) {
            throw new IllegalArgumentException("nodeCount must be positive (current: " + nodeCount + ")");
        }
        if (leafCount < 0 || leafCount > nodeCount) {
            throw new IllegalArgumentException(
                "leafCount must be between 0 and nodeCount (current: " + leafCount + ", nodeCount: " + nodeCount + ")"
            );
        }
        if (height < 0) {
            throw new IllegalArgumentException("height must be non-negative (current: " + height + ")");
        }
    }

    /**
     * Leaf 하나에 대한 집계 결과.
     *
     * @param rendering Leaf 렌더링 값
     * @return 노드 1개, Leaf 1개, 높이 0인 Aggregate
     */
    public static Aggregate ofLeaf(String rendering) {
        return new Aggregate(rendering, 1, 1, 0);
    }
}

package com.ryuqq.composite.application.evaluation;

import com.ryuqq.composite.core.aggregation.Aggregate;
import com.ryuqq.composite.core.node.Node;

/**
 * 트리 평가 결과 핸들.
 *
 * <p>평가한 루트, 렌더링 결과, 구조 통계와 소요 시간을 담습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가. 단, 루트 노드 자체는 평가 이후에도
 * 변경될 수 있으므로 결과는 평가 시점의 스냅샷입니다.</p>
 *
 * @author Composite Team
 * @since 1.0.0
 */
public final class Evaluation {

    private final Node root;
    private final Aggregate aggregate;
    private final long elapsedNanos;

    /**
     * Private constructor - 정적 팩토리 메서드 사용 권장.
     *
     * @param root 평가한 루트
     * @param aggregate 집계 결과
     * @param elapsedNanos 소요 시간 (나노초)
     * @throws IllegalArgumentException root 또는 aggregate가 null이거나 elapsedNanos가 음수인 경우
     */
    private Evaluation(Node root, Aggregate aggregate, long elapsedNanos) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        if (aggregate == null) {
            throw new IllegalArgumentException("aggregate cannot be null");
        }
        if (elapsedNanos < 0) {
            throw new IllegalArgumentException("elapsedNanos must be non-negative (current: " + elapsedNanos + ")");
        }
        this.root = root;
        this.aggregate = aggregate;
        this.elapsedNanos = elapsedNanos;
    }

    /**
     * 평가 결과 생성.
     *
     * @param root 평가한 루트
     * @param aggregate 집계 결과
     * @param elapsedNanos 소요 시간 (나노초)
     * @return Evaluation 인스턴스
     */
    public static Evaluation of(Node root, Aggregate aggregate, long elapsedNanos) {
        return new Evaluation(root, aggregate, elapsedNanos);
    }

    public Node getRoot() {
        return root;
    }

    public Aggregate getAggregate() {
        return aggregate;
    }

    /**
     * 렌더링 결과 ({@code Leaf | Branch(<node>{+<node>})}).
     *
     * @return 렌더링 결과
     */
    public String getResult() {
        return aggregate.rendering();
    }

    public int getNodeCount() {
        return aggregate.nodeCount();
    }

    public int getLeafCount() {
        return aggregate.leafCount();
    }

    public int getHeight() {
        return aggregate.height();
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }

    @Override
    public String toString() {
        return "Evaluation{" +
            "result=" + aggregate.rendering() +
            ", nodeCount=" + aggregate.nodeCount() +
            ", leafCount=" + aggregate.leafCount() +
            ", height=" + aggregate.height() +
            ", elapsedNanos=" + elapsedNanos +
            '}';
    }
}

package com.ryuqq.composite.adapter.runner;

import com.ryuqq.composite.application.evaluation.Evaluation;
import com.ryuqq.composite.application.evaluation.TreeEvaluator;
import com.ryuqq.composite.core.aggregation.Aggregate;
import com.ryuqq.composite.core.aggregation.TreeAggregator;
import com.ryuqq.composite.core.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 단일 스레드 트리 평가 구현체.
 *
 * <p>호출 스레드에서 {@link TreeAggregator}의 반복적 순회로 평가합니다.
 * 상태를 갖지 않으므로 여러 스레드에서 공유해도 안전합니다
 * (단, 평가 중인 트리는 변경되면 안 됨).</p>
 *
 * @author Composite Team
 * @since 1.0.0
 */
public final class SequentialTreeEvaluator implements TreeEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SequentialTreeEvaluator.class);

    @Override
    public Evaluation evaluate(Node root) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }

        long startNanos = System.nanoTime();
        Aggregate aggregate = TreeAggregator.aggregate(root);
        long elapsedNanos = System.nanoTime() - startNanos;

        log.debug("Evaluated {} sequentially: {} nodes, height {} in {}ns",
            root, aggregate.nodeCount(), aggregate.height(), elapsedNanos);
        return Evaluation.of(root, aggregate, elapsedNanos);
    }
}

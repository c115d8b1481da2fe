package com.ryuqq.composite.application.evaluation;

import com.ryuqq.composite.core.node.Node;

/**
 * 트리 평가 조정자.
 *
 * <p>클라이언트가 구성한 트리를 평가하여 렌더링 결과와 구조 통계를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Container tree = Trees.container(Trees.leaf(), Trees.leaf());
 * Evaluation evaluation = evaluator.evaluate(tree);
 *
 * evaluation.getResult();    // "Branch(Leaf+Leaf)"
 * evaluation.getLeafCount(); // 2
 * </pre>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>결과는 자식 삽입 순서를 보존해야 함 (병렬 구현 포함)</li>
 *   <li>트리 구조를 변경하지 않음</li>
 *   <li>트리 깊이와 무관하게 호출 스택을 소모하지 않음</li>
 *   <li>평가 중 구조 변경은 호출자가 막아야 함 (내부 잠금 없음)</li>
 * </ul>
 *
 * @author Composite Team
 * @since 1.0.0
 */
public interface TreeEvaluator {

    /**
     * 트리 평가.
     *
     * @param root 평가할 노드 (Leaf 또는 Container)
     * @return 평가 결과
     * @throws IllegalArgumentException root가 null인 경우
     */
    Evaluation evaluate(Node root);
}

package com.ryuqq.composite.adapter.runner;

import com.ryuqq.composite.application.evaluation.Evaluation;
import com.ryuqq.composite.application.evaluation.TreeEvaluator;
import com.ryuqq.composite.core.node.Container;
import com.ryuqq.composite.core.node.Node;
import com.ryuqq.composite.core.node.Trees;

import java.io.PrintStream;

/**
 * 트리를 구성하고 평가를 요청하는 클라이언트 드라이버.
 *
 * <p>Leaf와 Container를 구분하지 않고 {@link Node} 계약만으로 다룹니다.</p>
 *
 * <p><strong>출력 형식:</strong></p>
 * <pre>
 * Client: I've got a simple component:
 * RESULT: Leaf
 *
 * Client: Now I've got a composite tree:
 * RESULT: Branch(Branch(Leaf+Leaf)+Branch(Leaf))
 * </pre>
 *
 * @author Composite Team
 * @since 1.0.0
 */
public final class CompositeClient {

    private final TreeEvaluator evaluator;
    private final PrintStream out;

    /**
     * 생성자.
     *
     * @param evaluator 트리 평가자
     * @param out 출력 스트림
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CompositeClient(TreeEvaluator evaluator, PrintStream out) {
        if (evaluator == null) {
            throw new IllegalArgumentException("evaluator cannot be null");
        }
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        this.evaluator = evaluator;
        this.out = out;
    }

    /**
     * 노드를 평가하고 결과 출력.
     *
     * @param node 평가할 노드
     * @return 평가 결과
     * @throws IllegalArgumentException node가 null인 경우
     */
    public Evaluation run(Node node) {
        Evaluation evaluation = evaluator.evaluate(node);
        out.println("RESULT: " + evaluation.getResult());
        return evaluation;
    }

    /**
     * 단일 Leaf와 2단계 트리를 차례로 평가.
     */
    public void runDemo() {
        out.println("Client: I've got a simple component:");
        run(Trees.leaf());
        out.println();

        Container branch1 = Trees.container(Trees.leaf(), Trees.leaf());
        Container branch2 = Trees.container(Trees.leaf());
        Container tree = Trees.container(branch1, branch2);

        out.println("Client: Now I've got a composite tree:");
        run(tree);
        out.println();
    }

    public static void main(String[] args) {
        new CompositeClient(new SequentialTreeEvaluator(), System.out).runDemo();
    }
}

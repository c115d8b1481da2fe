package com.ryuqq.composite.testkit.contract;

import com.ryuqq.composite.application.evaluation.Evaluation;
import com.ryuqq.composite.application.evaluation.TreeEvaluator;
import com.ryuqq.composite.core.node.Container;
import com.ryuqq.composite.core.node.Leaf;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Test every {@link TreeEvaluator} implementation must pass.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Empty container renders {@code Branch()}</li>
 *   <li>Single leaf renders {@code Leaf}</li>
 *   <li>Flat aggregation joins children with {@code +}, no trailing separator</li>
 *   <li>Nested aggregation preserves insertion order at every level</li>
 *   <li>Distinct payloads render distinctly and in order</li>
 *   <li>Deep chains evaluate without stack exhaustion</li>
 *   <li>Evaluation never mutates the tree</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyEvaluatorContractTest extends TreeEvaluatorContractTest {
 *     {@literal @}Override
 *     protected TreeEvaluator createEvaluator() {
 *         return new MyEvaluator();
 *     }
 * }
 * </pre>
 *
 * @author Composite Team
 * @since 1.0.0
 */
public abstract class TreeEvaluatorContractTest extends AbstractTreeContractTest {

    protected TreeEvaluator evaluator;

    /**
     * Creates the evaluator under test. Called before each test.
     *
     * @return a fresh evaluator
     */
    protected abstract TreeEvaluator createEvaluator();

    @BeforeEach
    protected void setUpEvaluator() {
        evaluator = createEvaluator();
    }

    @AfterEach
    protected void tearDownEvaluator() throws Exception {
        if (evaluator instanceof AutoCloseable closeable) {
            closeable.close();
        }
    }

    @Test
    public void testEvaluate_EmptyContainer_RendersEmptyBranch() {
        // When
        Evaluation evaluation = evaluator.evaluate(branch());

        // Then
        assertThat(evaluation.getResult()).isEqualTo("Branch()");
        assertThat(evaluation.getNodeCount()).isEqualTo(1);
        assertThat(evaluation.getLeafCount()).isZero();
        assertThat(evaluation.getHeight()).isZero();
    }

    @Test
    public void testEvaluate_SingleLeaf_RendersLeaf() {
        // Given
        Leaf leaf = leaf();

        // When
        Evaluation evaluation = evaluator.evaluate(leaf);

        // Then
        assertThat(evaluation.getResult()).isEqualTo("Leaf");
        assertThat(evaluation.getRoot()).isSameAs(leaf);
        assertThat(evaluation.getNodeCount()).isEqualTo(1);
    }

    @Test
    public void testEvaluate_FlatContainer_JoinsWithoutTrailingSeparator() {
        // Given
        Container container = branch(leaf(), leaf(), leaf());

        // When
        Evaluation evaluation = evaluator.evaluate(container);

        // Then
        assertThat(evaluation.getResult()).isEqualTo("Branch(Leaf+Leaf+Leaf)");
        assertThat(evaluation.getLeafCount()).isEqualTo(3);
    }

    @Test
    public void testEvaluate_NestedContainers_RendersInInsertionOrder() {
        // Given
        Container tree = branch(branch(leaf(), leaf()), branch(leaf()));

        // When
        Evaluation evaluation = evaluator.evaluate(tree);

        // Then
        assertThat(evaluation.getResult()).isEqualTo("Branch(Branch(Leaf+Leaf)+Branch(Leaf))");
        assertThat(evaluation.getNodeCount()).isEqualTo(6);
        assertThat(evaluation.getHeight()).isEqualTo(2);
    }

    @Test
    public void testEvaluate_DistinctPayloads_RenderInOrder() {
        // Given
        Container tree = branch(leaf("a"), branch(leaf("b"), branch(), leaf("c")), leaf("d"));

        // When
        Evaluation evaluation = evaluator.evaluate(tree);

        // Then
        assertThat(evaluation.getResult()).isEqualTo("Branch(a+Branch(b+Branch()+c)+d)");
    }

    @Test
    public void testEvaluate_ManySiblings_PreservesOrder() {
        // Given
        Container tree = branch();
        StringBuilder expected = new StringBuilder("Branch(");
        for (int i = 0; i < 200; i++) {
            String payload = "n" + i;
            tree.add(branch(leaf(payload)));
            if (i > 0) {
                expected.append('+');
            }
            expected.append("Branch(").append(payload).append(')');
        }
        expected.append(')');

        // When
        Evaluation evaluation = evaluator.evaluate(tree);

        // Then
        assertThat(evaluation.getResult()).isEqualTo(expected.toString());
        assertThat(evaluation.getLeafCount()).isEqualTo(200);
    }

    @Test
    public void testEvaluate_DeepChain_DoesNotExhaustStack() {
        // Given
        int depth = 50_000;
        Container chain = deepChain(depth);

        // When
        Evaluation evaluation = evaluator.evaluate(chain);

        // Then
        assertThat(evaluation.getResult()).isEqualTo(deepChainRendering(depth));
        assertThat(evaluation.getHeight()).isEqualTo(depth);
    }

    @Test
    public void testEvaluate_DoesNotMutateTree() {
        // Given
        Leaf a = leaf("a");
        Container inner = branch(a);
        Container tree = branch(inner, leaf("b"));

        // When
        evaluator.evaluate(tree);
        evaluator.evaluate(tree);

        // Then
        assertChildrenInOrder(inner, a);
        assertParent(a, inner);
        assertParent(inner, tree);
        assertNoParent(tree);
        assertInvariants(tree);
    }

    @Test
    public void testEvaluate_Subtree_IgnoresAncestors() {
        // Given
        Container inner = branch(leaf("x"));
        branch(inner, leaf("y"));

        // When
        Evaluation evaluation = evaluator.evaluate(inner);

        // Then
        assertThat(evaluation.getResult()).isEqualTo("Branch(x)");
    }

    @Test
    public void testEvaluate_NullRoot_ThrowsException() {
        assertThatThrownBy(() -> evaluator.evaluate(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.ryuqq.composite.adapter.runner;

import com.ryuqq.composite.application.evaluation.Evaluation;
import com.ryuqq.composite.application.evaluation.TreeEvaluator;
import com.ryuqq.composite.core.aggregation.TreeAggregator;
import com.ryuqq.composite.core.node.Leaf;
import com.ryuqq.composite.core.node.Node;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * CompositeClient 유닛 테스트.
 *
 * @author Composite Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class CompositeClientTest {

    @Mock
    private TreeEvaluator evaluator;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    @Test
    void run_평가자에게_위임하고_결과_출력() {
        // given
        Leaf leaf = Leaf.of("product");
        Evaluation evaluation = Evaluation.of(leaf, TreeAggregator.aggregate(leaf), 0L);
        when(evaluator.evaluate(leaf)).thenReturn(evaluation);
        CompositeClient client = new CompositeClient(evaluator, out);

        // when
        Evaluation result = client.run(leaf);

        // then
        assertThat(result).isSameAs(evaluation);
        assertThat(output()).isEqualTo("RESULT: product" + System.lineSeparator());
        verify(evaluator).evaluate(leaf);
    }

    @Test
    void runDemo_단일_Leaf와_트리를_차례로_평가() {
        // given
        when(evaluator.evaluate(any())).thenAnswer(invocation -> {
            Node node = invocation.getArgument(0);
            return Evaluation.of(node, TreeAggregator.aggregate(node), 0L);
        });
        CompositeClient client = new CompositeClient(evaluator, out);

        // when
        client.runDemo();

        // then
        String nl = System.lineSeparator();
        assertThat(output()).isEqualTo(
            "Client: I've got a simple component:" + nl +
            "RESULT: Leaf" + nl +
            nl +
            "Client: Now I've got a composite tree:" + nl +
            "RESULT: Branch(Branch(Leaf+Leaf)+Branch(Leaf))" + nl +
            nl
        );

        ArgumentCaptor<Node> captor = ArgumentCaptor.forClass(Node.class);
        verify(evaluator, times(2)).evaluate(captor.capture());
        assertThat(captor.getAllValues().get(0).isContainer()).isFalse();
        assertThat(captor.getAllValues().get(1).isContainer()).isTrue();
    }

    @Test
    void runDemo_실제_평가자로_실행() {
        // given
        CompositeClient client = new CompositeClient(new SequentialTreeEvaluator(), out);

        // when
        client.runDemo();

        // then
        assertThat(output())
            .contains("RESULT: Leaf")
            .contains("RESULT: Branch(Branch(Leaf+Leaf)+Branch(Leaf))");
        verifyNoInteractions(evaluator);
    }

    @Test
    void 생성자_null_의존성은_예외() {
        assertThatThrownBy(() -> new CompositeClient(null, out))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("evaluator cannot be null");
        assertThatThrownBy(() -> new CompositeClient(evaluator, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("out cannot be null");
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}

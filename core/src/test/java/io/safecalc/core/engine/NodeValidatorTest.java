package io.safecalc.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.safecalc.core.error.DisallowedNodeException;
import io.safecalc.core.model.ExpressionNode;
import io.safecalc.core.model.NodeKind;
import io.safecalc.core.spi.EvaluationListener;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;

class NodeValidatorTest {

    @Test
    void standardValidatorAcceptsEveryGrammarKind() {
        assertThat(NodeValidator.STANDARD.allowed()).containsExactlyInAnyOrder(NodeKind.values());
        NodeValidator.STANDARD.check(new ExpressionNode.Literal(1));
        NodeValidator.STANDARD.check(new ExpressionNode.Identifier("pi"));
    }

    @Test
    void missingNodeIsRejected() {
        assertThatThrownBy(() -> NodeValidator.STANDARD.check(null)).isInstanceOf(DisallowedNodeException.class);
    }

    @Test
    void kindOutsideTheAllowListIsRejected() {
        NodeValidator noCalls = new NodeValidator(EnumSet.complementOf(EnumSet.of(NodeKind.CALL)));

        assertThatThrownBy(() -> noCalls.check(new ExpressionNode.Call("sqrt", List.of())))
                .isInstanceOfSatisfying(
                        DisallowedNodeException.class, ex -> assertThat(ex.kind()).isEqualTo(NodeKind.CALL));
    }

    @Test
    void evaluatorConsultsTheValidatorForNestedNodes() {
        NodeValidator literalsOnly = new NodeValidator(EnumSet.of(NodeKind.LITERAL, NodeKind.BINARY_OP));
        CalculatorEngine engine =
                new CalculatorEngine(FunctionRegistry.STANDARD, EvalPolicy.DEFAULT, literalsOnly, EvaluationListener.NOOP);

        assertThat(engine.evaluate("1 + 2 * 3")).isEqualTo(7.0);
        assertThatThrownBy(() -> engine.evaluate("1 + sqrt(4)"))
                .isInstanceOfSatisfying(
                        DisallowedNodeException.class, ex -> assertThat(ex.kind()).isEqualTo(NodeKind.CALL));
        assertThatThrownBy(() -> engine.evaluate("1 + -2")).isInstanceOf(DisallowedNodeException.class);
    }

    @Test
    void allowListIsCopied() {
        EnumSet<NodeKind> kinds = EnumSet.of(NodeKind.LITERAL);
        NodeValidator validator = new NodeValidator(kinds);
        kinds.add(NodeKind.CALL);

        assertThat(validator.allowed()).containsExactly(NodeKind.LITERAL);
    }
}

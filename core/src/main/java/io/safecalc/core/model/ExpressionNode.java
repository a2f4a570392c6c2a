package io.safecalc.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable expression tree produced by the parser and consumed once by the evaluator.
 *
 * <p>The hierarchy is sealed: exactly five node kinds exist, and each reports its {@link NodeKind}
 * so the evaluator can switch over them exhaustively. Adding a kind means adding a record here, a
 * constant to {@link NodeKind}, and an entry to the validator's allow-list.
 */
public sealed interface ExpressionNode
        permits ExpressionNode.Literal,
                ExpressionNode.UnaryOp,
                ExpressionNode.BinaryOp,
                ExpressionNode.Call,
                ExpressionNode.Identifier {

    NodeKind kind();

    /** Numeric literal. */
    record Literal(double value) implements ExpressionNode {
        @Override
        public NodeKind kind() {
            return NodeKind.LITERAL;
        }
    }

    /** Prefix {@code +x} or {@code -x}. */
    record UnaryOp(UnaryOperator operator, ExpressionNode operand) implements ExpressionNode {
        public UnaryOp {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.UNARY_OP;
        }
    }

    /** Infix arithmetic. */
    record BinaryOp(BinaryOperator operator, ExpressionNode left, ExpressionNode right) implements ExpressionNode {
        public BinaryOp {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BINARY_OP;
        }
    }

    /** Call of a named function with positional arguments. */
    record Call(String name, List<ExpressionNode> args) implements ExpressionNode {
        public Call {
            Objects.requireNonNull(name, "name must not be null");
            args = List.copyOf(args);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CALL;
        }
    }

    /** Bare name, resolved against the constant table. */
    record Identifier(String name) implements ExpressionNode {
        public Identifier {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IDENTIFIER;
        }
    }
}

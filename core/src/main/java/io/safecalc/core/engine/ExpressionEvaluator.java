package io.safecalc.core.engine;

import io.safecalc.core.error.ArithmeticEvalException;
import io.safecalc.core.error.ArithmeticEvalException.Reason;
import io.safecalc.core.error.CalcException;
import io.safecalc.core.error.DisallowedNodeException;
import io.safecalc.core.error.ExpressionLimitException;
import io.safecalc.core.error.FunctionNotAllowedException;
import io.safecalc.core.error.UnknownIdentifierException;
import io.safecalc.core.model.BinaryOperator;
import io.safecalc.core.model.ExpressionNode;
import io.safecalc.core.model.NodeKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Walks an expression tree and computes its value with IEEE-754 double arithmetic.
 *
 * <p>Every node passes the {@link NodeValidator} before it is acted on; the walk then switches over
 * the node's kind. Floor division and modulo round toward negative infinity ({@code -7 // 2 == -4},
 * {@code -7 % 2 == 1}). Exponentiation is refused outright when either operand exceeds the {@link
 * EvalPolicy} thresholds.
 *
 * <p>Stateless apart from its immutable collaborators; safe to share across threads.
 */
public final class ExpressionEvaluator {

    private final FunctionRegistry registry;
    private final EvalPolicy policy;
    private final NodeValidator validator;

    public ExpressionEvaluator(FunctionRegistry registry, EvalPolicy policy, NodeValidator validator) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    /**
     * Evaluates {@code tree}.
     *
     * @return the exact double result
     * @throws io.safecalc.core.error.CalcEvalException on disallowed nodes, unknown names or
     *     arithmetic failures
     * @throws ExpressionLimitException if the tree nests deeper than {@link EvalPolicy#maxDepth()}; the
     *     left operand chain of a binary operator counts as one level
     */
    public double evaluate(ExpressionNode tree) {
        return eval(tree, 1);
    }

    private double eval(ExpressionNode node, int depth) {
        validator.check(node);
        if (depth > policy.maxDepth()) {
            throw new ExpressionLimitException(
                    "Expression nests deeper than " + policy.maxDepth() + " levels",
                    ExpressionLimitException.Limit.DEPTH,
                    CalcException.Phase.EVALUATION);
        }
        return switch (node.kind()) {
            case LITERAL -> as(ExpressionNode.Literal.class, node).value();
            case UNARY_OP -> unary(as(ExpressionNode.UnaryOp.class, node), depth);
            case BINARY_OP -> binary(as(ExpressionNode.BinaryOp.class, node), depth);
            case CALL -> call(as(ExpressionNode.Call.class, node), depth);
            case IDENTIFIER -> identifier(as(ExpressionNode.Identifier.class, node));
        };
    }

    private double unary(ExpressionNode.UnaryOp node, int depth) {
        double operand = eval(node.operand(), depth + 1);
        return switch (node.operator()) {
            case IDENTITY -> +operand;
            case NEGATE -> -operand;
        };
    }

    /**
     * Folds the left spine of a binary chain ({@code a+b+c} is {@code ((a+b)+c)}) in a loop, so a
     * long chain of operands costs no stack. Right operands recurse one level deeper. Operands are
     * still evaluated left to right.
     */
    private double binary(ExpressionNode.BinaryOp node, int depth) {
        Deque<ExpressionNode.BinaryOp> spine = new ArrayDeque<>();
        ExpressionNode current = node;
        while (current.kind() == NodeKind.BINARY_OP) {
            validator.check(current);
            ExpressionNode.BinaryOp op = as(ExpressionNode.BinaryOp.class, current);
            spine.push(op);
            current = op.left();
        }
        double acc = eval(current, depth + 1);
        while (!spine.isEmpty()) {
            ExpressionNode.BinaryOp op = spine.pop();
            acc = apply(op.operator(), acc, eval(op.right(), depth + 1));
        }
        return acc;
    }

    double apply(BinaryOperator operator, double left, double right) {
        return switch (operator) {
            case ADD -> left + right;
            case SUB -> left - right;
            case MUL -> left * right;
            case DIV -> divide(left, right);
            case FLOORDIV -> floorDivide(left, right);
            case MOD -> floorMod(left, right);
            case POW -> power(left, right);
        };
    }

    private double call(ExpressionNode.Call node, int depth) {
        MathFunction function =
                registry.function(node.name()).orElseThrow(() -> new FunctionNotAllowedException(node.name()));
        List<Double> args = new ArrayList<>(node.args().size());
        for (ExpressionNode arg : node.args()) {
            args.add(eval(arg, depth + 1));
        }
        return function.apply(args);
    }

    private double identifier(ExpressionNode.Identifier node) {
        return registry.constant(node.name()).orElseThrow(() -> new UnknownIdentifierException(node.name()));
    }

    // --- Arithmetic ---

    private static double divide(double left, double right) {
        if (right == 0) {
            throw divisionByZero("division by zero");
        }
        return left / right;
    }

    /** Floor of {@code left / right}, computed from the fmod remainder to stay exact near integers. */
    private static double floorDivide(double left, double right) {
        if (right == 0) {
            throw divisionByZero("integer division or modulo by zero");
        }
        double mod = left % right;
        double div = (left - mod) / right;
        if (mod != 0 && ((right < 0) != (mod < 0))) {
            div -= 1.0;
        }
        if (div == 0) {
            return Math.copySign(0.0, left / right);
        }
        double floor = Math.floor(div);
        if (div - floor > 0.5) {
            floor += 1.0;
        }
        return floor;
    }

    /** Remainder whose sign follows the divisor. */
    private static double floorMod(double left, double right) {
        if (right == 0) {
            throw divisionByZero("integer division or modulo by zero");
        }
        double mod = left % right;
        if (mod != 0) {
            if ((right < 0) != (mod < 0)) {
                mod += right;
            }
            return mod;
        }
        return Math.copySign(0.0, right);
    }

    private double power(double base, double exponent) {
        if (Math.abs(base) > policy.maxPowBase() || Math.abs(exponent) > policy.maxPowExponent()) {
            throw new ArithmeticEvalException(
                    Reason.EXPONENT_TOO_LARGE,
                    "Exponent too large: base and exponent must satisfy |base| <= " + policy.maxPowBase()
                            + " and |exponent| <= " + policy.maxPowExponent());
        }
        if (base == 1.0 || exponent == 0) {
            return 1.0;
        }
        if (base == 0 && exponent < 0) {
            throw divisionByZero("0.0 cannot be raised to a negative power");
        }
        if (base < 0 && Double.isFinite(exponent) && exponent != Math.rint(exponent)) {
            throw new ArithmeticEvalException(
                    Reason.DOMAIN_ERROR, "negative number cannot be raised to a fractional power");
        }
        return Math.pow(base, exponent);
    }

    private static ArithmeticEvalException divisionByZero(String message) {
        return new ArithmeticEvalException(Reason.DIVISION_BY_ZERO, message);
    }

    /** Narrows a validated node to its record type, rejecting a node whose kind and class disagree. */
    private static <T extends ExpressionNode> T as(Class<T> type, ExpressionNode node) {
        if (!type.isInstance(node)) {
            throw new DisallowedNodeException("Disallowed expression: " + node.getClass().getName(), node.kind());
        }
        return type.cast(node);
    }
}

package io.safecalc.core.engine;

import io.safecalc.core.error.CalcException;
import io.safecalc.core.error.ExpressionLimitException;
import io.safecalc.core.error.ExpressionSyntaxException;
import io.safecalc.core.model.EvaluationResult;
import io.safecalc.core.model.ExpressionNode;
import io.safecalc.core.parse.ExpressionParser;
import io.safecalc.core.parse.GlyphSanitizer;
import io.safecalc.core.spi.EvaluationListener;
import io.safecalc.core.spi.EvaluationListener.EvaluationCompletedEvent;
import io.safecalc.core.spi.EvaluationListener.EvaluationFailedEvent;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Public entry point: turns a raw calculator expression into a number.
 *
 * <p>
 * Pipeline: input length guard → {@link GlyphSanitizer} → {@link ExpressionParser}
 * → {@link ExpressionEvaluator} (which runs the {@link NodeValidator} on every
 * node). Callers may pass display glyphs ({@code ×}, {@code ÷}, {@code −})
 * directly; they are normalized here.
 *
 * <p>
 * Thread-safe: holds only immutable collaborators, and every call builds and
 * discards its own tree.
 */
public final class CalculatorEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CalculatorEngine.class);

    private final EvalPolicy policy;
    private final ExpressionParser parser;
    private final ExpressionEvaluator evaluator;
    private final EvaluationListener listener;

    /** Creates an engine with the standard registry, default policy and full allow-list. */
    public CalculatorEngine() {
        this(EvalPolicy.DEFAULT);
    }

    /** Creates an engine with the standard registry and allow-list under the given policy. */
    public CalculatorEngine(EvalPolicy policy) {
        this(FunctionRegistry.STANDARD, policy, NodeValidator.STANDARD, EvaluationListener.NOOP);
    }

    /**
     * Creates an engine with all collaborators supplied.
     *
     * @param registry  constants and functions reachable from expressions
     * @param policy    resource guards
     * @param validator node kind allow-list
     * @param listener  lifecycle listener, {@link EvaluationListener#NOOP} for none
     */
    public CalculatorEngine(
            FunctionRegistry registry, EvalPolicy policy, NodeValidator validator, EvaluationListener listener) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.parser = new ExpressionParser(policy.maxDepth());
        this.evaluator = new ExpressionEvaluator(registry, policy, validator);
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /**
     * Evaluates an expression.
     *
     * @param expression raw expression text, glyphs allowed
     * @return the exact, un-rounded result
     * @throws CalcException for any rejected input; never any other exception type for a string input
     */
    public double evaluate(String expression) {
        long startNanos = System.nanoTime();
        int length = expression == null ? 0 : expression.codePointCount(0, expression.length());
        try {
            double value = evaluator.evaluate(parse(expression));
            long elapsed = System.nanoTime() - startNanos;
            LOG.debug("calc.evaluated length={} duration_us={}", length, elapsed / 1_000);
            notifyCompleted(new EvaluationCompletedEvent(length, value, elapsed));
            return value;
        } catch (CalcException e) {
            long elapsed = System.nanoTime() - startNanos;
            LOG.debug(
                    "calc.rejected length={} type={} phase={} detail={} duration_us={}",
                    length,
                    e.type(),
                    e.phase(),
                    e.detail(),
                    elapsed / 1_000);
            notifyFailed(new EvaluationFailedEvent(length, e.type(), e.detail(), elapsed));
            throw e;
        }
    }

    /**
     * Evaluates an expression, capturing any failure in the result instead of throwing.
     *
     * @param expression raw expression text
     * @return SUCCESS with the value, or ERROR with the typed failure
     */
    public EvaluationResult tryEvaluate(String expression) {
        try {
            return EvaluationResult.success(evaluate(expression));
        } catch (CalcException e) {
            return EvaluationResult.error(e);
        }
    }

    /**
     * Sanitizes and parses without evaluating.
     *
     * @throws io.safecalc.core.error.CalcParseException if the text is not a valid expression
     * @throws ExpressionLimitException                  if the input is too long or too deep
     */
    public ExpressionNode parse(String expression) {
        if (expression == null) {
            throw new ExpressionSyntaxException("Empty expression", 0);
        }
        int codePoints = expression.codePointCount(0, expression.length());
        if (codePoints > policy.maxInputLength()) {
            throw new ExpressionLimitException(
                    "Expression is " + codePoints + " characters long; the limit is " + policy.maxInputLength(),
                    ExpressionLimitException.Limit.INPUT_LENGTH,
                    CalcException.Phase.PARSE);
        }
        return parser.parse(GlyphSanitizer.sanitize(expression));
    }

    /** The policy this engine enforces. */
    public EvalPolicy policy() {
        return policy;
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they MUST NOT affect
    // the evaluation result.

    private void notifyCompleted(EvaluationCompletedEvent event) {
        try {
            listener.onEvaluationCompleted(event);
        } catch (Exception e) {
            LOG.warn("EvaluationListener.onEvaluationCompleted failed", e);
        }
    }

    private void notifyFailed(EvaluationFailedEvent event) {
        try {
            listener.onEvaluationFailed(event);
        } catch (Exception e) {
            LOG.warn("EvaluationListener.onEvaluationFailed failed", e);
        }
    }
}

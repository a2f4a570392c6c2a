package io.safecalc.core.engine;

/**
 * Resource guards applied to every evaluation. These limits are denial-of-service policy, not
 * mathematics: the exponentiation thresholds keep {@code **} cheap, and the depth and length caps
 * keep the recursive parser and evaluator from exhausting the stack.
 *
 * <p>Immutable and thread-safe.
 *
 * @param maxPowBase     largest permitted {@code abs(base)} for {@code **} (default 1e6)
 * @param maxPowExponent largest permitted {@code abs(exponent)} for {@code **} (default 10)
 * @param maxDepth       maximum syntactic nesting (default 200); operand chains count as one level
 * @param maxInputLength maximum input length in code points (default 1024)
 */
public record EvalPolicy(double maxPowBase, double maxPowExponent, int maxDepth, int maxInputLength) {

    public static final double DEFAULT_MAX_POW_BASE = 1e6;
    public static final double DEFAULT_MAX_POW_EXPONENT = 10;
    public static final int DEFAULT_MAX_DEPTH = 200;
    public static final int DEFAULT_MAX_INPUT_LENGTH = 1024;

    /** Default policy. */
    public static final EvalPolicy DEFAULT = new EvalPolicy(
            DEFAULT_MAX_POW_BASE, DEFAULT_MAX_POW_EXPONENT, DEFAULT_MAX_DEPTH, DEFAULT_MAX_INPUT_LENGTH);

    public EvalPolicy {
        if (!(maxPowBase > 0)) {
            throw new IllegalArgumentException("maxPowBase must be positive, got: " + maxPowBase);
        }
        if (!(maxPowExponent > 0)) {
            throw new IllegalArgumentException("maxPowExponent must be positive, got: " + maxPowExponent);
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        if (maxInputLength <= 0) {
            throw new IllegalArgumentException("maxInputLength must be positive, got: " + maxInputLength);
        }
    }
}

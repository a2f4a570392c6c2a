package io.safecalc.core.error;

/**
 * Thrown when an expression exceeds a resource guard from {@code EvalPolicy}: the input is too long
 * or the tree nests too deeply. Raised in the parse phase for text input and in the evaluation
 * phase for trees built by hand. URN: {@code urn:safecalc:error:limit-exceeded}
 */
public final class ExpressionLimitException extends CalcException {

    private static final long serialVersionUID = 1L;

    public static final String TYPE = "urn:safecalc:error:limit-exceeded";

    /** The guard that tripped. */
    public enum Limit {
        INPUT_LENGTH,
        DEPTH
    }

    private final Limit limit;

    public ExpressionLimitException(String message, Limit limit, Phase phase) {
        super(message, phase);
        this.limit = limit;
    }

    public Limit limit() {
        return limit;
    }

    @Override
    public String type() {
        return TYPE;
    }
}

package io.safecalc.core.error;

/**
 * Abstract parent for errors raised while turning the input text into an expression tree. Carries
 * the 0-based character offset in the sanitized input where the problem was detected, or {@code -1}
 * when no single position applies.
 */
public abstract class CalcParseException extends CalcException {

    private static final long serialVersionUID = 1L;

    private final int position;

    protected CalcParseException(String message, int position) {
        super(message, Phase.PARSE);
        this.position = position;
    }

    protected CalcParseException(String message, Throwable cause, int position) {
        super(message, cause, Phase.PARSE);
        this.position = position;
    }

    /** Offset into the sanitized expression, or {@code -1} if unknown. */
    public int position() {
        return position;
    }
}

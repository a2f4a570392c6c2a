package io.safecalc.core.error;

/**
 * Abstract base for all safecalc exceptions. Never thrown directly; use the concrete subclasses
 * under {@link CalcParseException}, {@link CalcEvalException} or {@link ExpressionLimitException}.
 */
public abstract class CalcException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        EVALUATION
    }

    private final Phase phase;

    protected CalcException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected CalcException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    /** URN identifying the error kind, used as the problem {@code type} by HTTP callers. */
    public abstract String type();
}

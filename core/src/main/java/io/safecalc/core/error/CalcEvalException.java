package io.safecalc.core.error;

/**
 * Abstract parent for errors raised while walking a parsed expression tree. Evaluation never
 * partially completes: when one of these is thrown no numeric value is produced.
 */
public abstract class CalcEvalException extends CalcException {

    private static final long serialVersionUID = 1L;

    protected CalcEvalException(String message) {
        super(message, Phase.EVALUATION);
    }

    protected CalcEvalException(String message, Throwable cause) {
        super(message, cause, Phase.EVALUATION);
    }
}

package io.safecalc.core.error;

/**
 * Thrown for arithmetic failures: division by zero, exponent guard violations, function domain
 * errors and bad function arguments. URN: {@code urn:safecalc:error:arithmetic}
 */
public final class ArithmeticEvalException extends CalcEvalException {

    private static final long serialVersionUID = 1L;

    public static final String TYPE = "urn:safecalc:error:arithmetic";

    /** Cause category. */
    public enum Reason {
        DIVISION_BY_ZERO,
        EXPONENT_TOO_LARGE,
        DOMAIN_ERROR,
        ARITY_MISMATCH,
        INVALID_ARGUMENT
    }

    private final Reason reason;

    public ArithmeticEvalException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    @Override
    public String type() {
        return TYPE;
    }
}

package io.safecalc.core.error;

/**
 * Thrown when the input is not a sentence of the calculator grammar: unbalanced parentheses, stray
 * operators, empty input, malformed numbers or unrecognized characters. URN: {@code
 * urn:safecalc:error:syntax}
 */
public final class ExpressionSyntaxException extends CalcParseException {

    private static final long serialVersionUID = 1L;

    public static final String TYPE = "urn:safecalc:error:syntax";

    public ExpressionSyntaxException(String message, int position) {
        super(message, position);
    }

    public ExpressionSyntaxException(String message, Throwable cause, int position) {
        super(message, cause, position);
    }

    @Override
    public String type() {
        return TYPE;
    }
}

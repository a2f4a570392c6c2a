package io.safecalc.core.error;

/**
 * Thrown when a call targets a name that is not a registered function. URN: {@code
 * urn:safecalc:error:function-not-allowed}
 */
public final class FunctionNotAllowedException extends CalcEvalException {

    private static final long serialVersionUID = 1L;

    public static final String TYPE = "urn:safecalc:error:function-not-allowed";

    private final String functionName;

    public FunctionNotAllowedException(String functionName) {
        super("Function not allowed: '" + functionName + "'");
        this.functionName = functionName;
    }

    public String functionName() {
        return functionName;
    }

    @Override
    public String type() {
        return TYPE;
    }
}

package io.safecalc.core.error;

/**
 * Thrown when a bare identifier does not name a registered constant. URN: {@code
 * urn:safecalc:error:unknown-identifier}
 */
public final class UnknownIdentifierException extends CalcEvalException {

    private static final long serialVersionUID = 1L;

    public static final String TYPE = "urn:safecalc:error:unknown-identifier";

    private final String identifier;

    public UnknownIdentifierException(String identifier) {
        super("Unknown identifier: '" + identifier + "'");
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }

    @Override
    public String type() {
        return TYPE;
    }
}

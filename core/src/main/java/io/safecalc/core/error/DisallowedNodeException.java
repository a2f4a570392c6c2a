package io.safecalc.core.error;

import io.safecalc.core.model.NodeKind;

/**
 * Thrown when the evaluator meets a tree node whose kind is not on the validator's allow-list.
 * URN: {@code urn:safecalc:error:disallowed-node}
 */
public final class DisallowedNodeException extends CalcEvalException {

    private static final long serialVersionUID = 1L;

    public static final String TYPE = "urn:safecalc:error:disallowed-node";

    private final NodeKind kind;

    public DisallowedNodeException(String message, NodeKind kind) {
        super(message);
        this.kind = kind;
    }

    /** The rejected node kind, or {@code null} if the node itself was missing. */
    public NodeKind kind() {
        return kind;
    }

    @Override
    public String type() {
        return TYPE;
    }
}

package io.safecalc.core.engine;

import io.safecalc.core.error.DisallowedNodeException;
import io.safecalc.core.model.ExpressionNode;
import io.safecalc.core.model.NodeKind;
import java.util.EnumSet;
import java.util.Set;

/**
 * Allow-list check run on every node before the evaluator acts on it. Anything whose kind is not
 * listed is rejected, including kinds added to the grammar later without updating the list.
 *
 * <p>Immutable and thread-safe.
 */
public final class NodeValidator {

    /** The kinds the standard grammar produces. */
    public static final Set<NodeKind> STANDARD_KINDS = Set.copyOf(EnumSet.of(
            NodeKind.LITERAL, NodeKind.UNARY_OP, NodeKind.BINARY_OP, NodeKind.CALL, NodeKind.IDENTIFIER));

    /** Validator accepting {@link #STANDARD_KINDS}. */
    public static final NodeValidator STANDARD = new NodeValidator(STANDARD_KINDS);

    private final Set<NodeKind> allowed;

    /**
     * @param allowed node kinds the evaluator may act on; usually a subset of {@link #STANDARD_KINDS}
     */
    public NodeValidator(Set<NodeKind> allowed) {
        this.allowed = Set.copyOf(allowed);
    }

    /**
     * Rejects {@code node} unless its kind is allowed.
     *
     * @throws DisallowedNodeException if the node is missing or of a kind outside the allow-list
     */
    public void check(ExpressionNode node) {
        if (node == null) {
            throw new DisallowedNodeException("Disallowed expression: missing node", null);
        }
        NodeKind kind = node.kind();
        if (kind == null || !allowed.contains(kind)) {
            throw new DisallowedNodeException("Disallowed expression: " + kind, kind);
        }
    }

    public Set<NodeKind> allowed() {
        return allowed;
    }
}

package io.safecalc.core.model;

/** The closed set of expression tree node kinds. */
public enum NodeKind {
    LITERAL,
    UNARY_OP,
    BINARY_OP,
    CALL,
    IDENTIFIER
}

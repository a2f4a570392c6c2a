package io.safecalc.core.parse;

/** Lexical categories of the calculator grammar. */
public enum TokenType {
    NUMBER,
    IDENTIFIER,
    PLUS,
    MINUS,
    STAR,
    DOUBLE_STAR,
    SLASH,
    DOUBLE_SLASH,
    PERCENT,
    LPAREN,
    RPAREN,
    COMMA,
    EOF
}

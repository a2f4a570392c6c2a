package io.safecalc.core.parse;

/**
 * A lexical token.
 *
 * @param type     token category
 * @param text     the source text of the token (empty for {@link TokenType#EOF})
 * @param position 0-based offset of the first character in the sanitized input
 * @param value    numeric value for {@link TokenType#NUMBER}, otherwise {@code 0}
 */
public record Token(TokenType type, String text, int position, double value) {

    static Token of(TokenType type, String text, int position) {
        return new Token(type, text, position, 0);
    }

    /** Text used in error messages. */
    String describe() {
        return type == TokenType.EOF ? "end of expression" : "'" + text + "'";
    }
}
